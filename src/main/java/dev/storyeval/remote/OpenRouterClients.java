package dev.storyeval.remote;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import dev.storyeval.config.StoryEvalConfig;

/** Builds OpenAI-compatible clients pointed at OpenRouter. */
public final class OpenRouterClients {
    private OpenRouterClients() {}

    /**
     * A client for the configured OpenRouter endpoint.
     *
     * <p>The client never retries on its own. A failed call surfaces as an error sub-result and is
     * retried on the next pass instead.
     *
     * @throws dev.storyeval.config.ConfigException if no OpenRouter API key is configured
     */
    public static OpenAIClient create(StoryEvalConfig config) {
        return OpenAIOkHttpClient.builder()
                .baseUrl(config.openRouterBaseUrl())
                .apiKey(config.requireOpenRouterApiKey())
                .timeout(config.requestTimeout())
                .maxRetries(0)
                .build();
    }
}
