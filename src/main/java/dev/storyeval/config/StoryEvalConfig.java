package dev.storyeval.config;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Configuration for storyeval batch jobs with sane defaults.
 *
 * <p>Most runs will configure everything with envars. Any envar can also be overridden during
 * config construction, which is how command line flags are applied.
 *
 * <p>File locations and the concurrency bound are optional here because every job brings its own
 * defaults for them.
 */
@Getter
@Accessors(fluent = true)
public final class StoryEvalConfig extends BaseConfig {
    public static final String OPENROUTER_API_KEY = "OPENROUTER_API_KEY";
    public static final String PANGRAM_API_KEY = "PANGRAM_API_KEY";

    private final Optional<String> inputFile =
            Optional.ofNullable(getConfig("STORYEVAL_INPUT_FILE", null, String.class));
    private final Optional<String> outputFile =
            Optional.ofNullable(getConfig("STORYEVAL_OUTPUT_FILE", null, String.class));
    private final Optional<String> seedFile =
            Optional.ofNullable(getConfig("STORYEVAL_SEED_FILE", null, String.class));
    private final Optional<Integer> concurrency =
            Optional.ofNullable(getConfig("STORYEVAL_CONCURRENCY", null, Integer.class));
    private final int maxPasses = getConfig("STORYEVAL_MAX_PASSES", 5);
    private final Duration retryDelay =
            Duration.ofSeconds(getConfig("STORYEVAL_RETRY_DELAY_SECONDS", 2));
    private final Duration requestTimeout =
            Duration.ofSeconds(getConfig("STORYEVAL_REQUEST_TIMEOUT", 60));
    private final Optional<String> openRouterApiKey =
            Optional.ofNullable(getConfig(OPENROUTER_API_KEY, null, String.class));
    private final String openRouterBaseUrl =
            getConfig("OPENROUTER_BASE_URL", "https://openrouter.ai/api/v1");
    private final Optional<String> pangramApiKey =
            Optional.ofNullable(getConfig(PANGRAM_API_KEY, null, String.class));
    private final String pangramApiUrl =
            getConfig("PANGRAM_API_URL", "https://text.api.pangram.com/v3");
    private final String judgeModel =
            getConfig("STORYEVAL_JUDGE_MODEL", "anthropic/claude-opus-4.5");
    private final int judgeMaxTokens = getConfig("STORYEVAL_JUDGE_MAX_TOKENS", 900);
    private final String writerModel =
            getConfig("STORYEVAL_WRITER_MODEL", "mistralai/mistral-large-2512");
    private final int writerMaxTokens = getConfig("STORYEVAL_WRITER_MAX_TOKENS", 1500);

    public static StoryEvalConfig fromEnvironment() {
        return of();
    }

    public static StoryEvalConfig of(String... envOverrides) {
        if (envOverrides.length % 2 != 0) {
            throw new ConfigException(
                    "config overrides require key-value pairs. Found dangling key: %s"
                            .formatted(envOverrides[envOverrides.length - 1]));
        }
        var overridesMap = new HashMap<String, String>();
        for (int i = 0; i < envOverrides.length - 1; i = i + 2) {
            overridesMap.put(envOverrides[i], envOverrides[i + 1]);
        }
        return new StoryEvalConfig(overridesMap);
    }

    public static StoryEvalConfig of(Map<String, String> envOverrides) {
        return new StoryEvalConfig(envOverrides);
    }

    private StoryEvalConfig(Map<String, String> envOverrides) {
        super(envOverrides);
        if (maxPasses < 1) {
            // an unbounded retry loop against a failing endpoint is never what anyone wants
            throw new ConfigException("STORYEVAL_MAX_PASSES must be at least 1: " + maxPasses);
        }
        if (concurrency.isPresent() && concurrency.get() < 1) {
            throw new ConfigException(
                    "STORYEVAL_CONCURRENCY must be at least 1: " + concurrency.get());
        }
        if (retryDelay.isNegative()) {
            throw new ConfigException("STORYEVAL_RETRY_DELAY_SECONDS must not be negative");
        }
    }

    /** The OpenRouter credential. Fatal when absent. */
    public String requireOpenRouterApiKey() {
        return openRouterApiKey.orElseThrow(
                () ->
                        new ConfigException(
                                "Set %s to your OpenRouter API key."
                                        .formatted(OPENROUTER_API_KEY)));
    }

    /** The Pangram credential. Fatal when absent. */
    public String requirePangramApiKey() {
        return pangramApiKey.orElseThrow(
                () ->
                        new ConfigException(
                                "Set %s to your Pangram API key.".formatted(PANGRAM_API_KEY)));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> envOverrides = new HashMap<>();

        public Builder inputFile(String value) {
            envOverrides.put("STORYEVAL_INPUT_FILE", nullable(value));
            return this;
        }

        public Builder outputFile(String value) {
            envOverrides.put("STORYEVAL_OUTPUT_FILE", nullable(value));
            return this;
        }

        public Builder seedFile(String value) {
            envOverrides.put("STORYEVAL_SEED_FILE", nullable(value));
            return this;
        }

        public Builder concurrency(int value) {
            envOverrides.put("STORYEVAL_CONCURRENCY", String.valueOf(value));
            return this;
        }

        public Builder maxPasses(int value) {
            envOverrides.put("STORYEVAL_MAX_PASSES", String.valueOf(value));
            return this;
        }

        public Builder retryDelay(Duration value) {
            envOverrides.put("STORYEVAL_RETRY_DELAY_SECONDS", String.valueOf(value.getSeconds()));
            return this;
        }

        public Builder requestTimeout(Duration value) {
            envOverrides.put("STORYEVAL_REQUEST_TIMEOUT", String.valueOf(value.getSeconds()));
            return this;
        }

        public Builder openRouterApiKey(String value) {
            envOverrides.put(OPENROUTER_API_KEY, nullable(value));
            return this;
        }

        public Builder openRouterBaseUrl(String value) {
            envOverrides.put("OPENROUTER_BASE_URL", value);
            return this;
        }

        public Builder pangramApiKey(String value) {
            envOverrides.put(PANGRAM_API_KEY, nullable(value));
            return this;
        }

        public Builder pangramApiUrl(String value) {
            envOverrides.put("PANGRAM_API_URL", value);
            return this;
        }

        public Builder judgeModel(String value) {
            envOverrides.put("STORYEVAL_JUDGE_MODEL", value);
            return this;
        }

        public Builder judgeMaxTokens(int value) {
            envOverrides.put("STORYEVAL_JUDGE_MAX_TOKENS", String.valueOf(value));
            return this;
        }

        public Builder writerModel(String value) {
            envOverrides.put("STORYEVAL_WRITER_MODEL", value);
            return this;
        }

        public Builder writerMaxTokens(int value) {
            envOverrides.put("STORYEVAL_WRITER_MAX_TOKENS", String.valueOf(value));
            return this;
        }

        public StoryEvalConfig build() {
            return new StoryEvalConfig(envOverrides);
        }

        private static String nullable(String value) {
            return value != null ? value : NULL_OVERRIDE;
        }
    }
}
