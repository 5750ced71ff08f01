package dev.storyeval.config;

import static org.junit.jupiter.api.Assertions.*;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.time.Duration;
import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class StoryEvalConfigTest {
    @Test
    void defaultsApplyWhenNothingIsOverridden() {
        var config =
                StoryEvalConfig.of(
                        "STORYEVAL_MAX_PASSES", BaseConfig.NULL_OVERRIDE,
                        "STORYEVAL_RETRY_DELAY_SECONDS", BaseConfig.NULL_OVERRIDE,
                        "PANGRAM_API_URL", BaseConfig.NULL_OVERRIDE);
        assertEquals(5, config.maxPasses());
        assertEquals(Duration.ofSeconds(2), config.retryDelay());
        assertEquals("https://text.api.pangram.com/v3", config.pangramApiUrl());
    }

    @Test
    void overridesWinOverDefaults() {
        var config =
                StoryEvalConfig.of(
                        "STORYEVAL_CONCURRENCY", "16",
                        "STORYEVAL_MAX_PASSES", "2",
                        "STORYEVAL_INPUT_FILE", "in.jsonl");
        assertEquals(16, config.concurrency().orElseThrow());
        assertEquals(2, config.maxPasses());
        assertEquals("in.jsonl", config.inputFile().orElseThrow());
    }

    @Test
    void missingCredentialIsFatalWithClearMessage() {
        var config = StoryEvalConfig.builder().pangramApiKey(null).build();
        var e = assertThrows(ConfigException.class, config::requirePangramApiKey);
        assertEquals("Set PANGRAM_API_KEY to your Pangram API key.", e.getMessage());
    }

    @Test
    void blankCredentialCountsAsMissing() {
        var config = StoryEvalConfig.of("OPENROUTER_API_KEY", "   ");
        assertThrows(ConfigException.class, config::requireOpenRouterApiKey);
    }

    @Test
    void passBudgetMustBeFinite() {
        assertThrows(ConfigException.class, () -> StoryEvalConfig.of("STORYEVAL_MAX_PASSES", "0"));
        assertThrows(ConfigException.class, () -> StoryEvalConfig.of("STORYEVAL_CONCURRENCY", "0"));
    }

    @Test
    void nonNumericValueIsRejected() {
        var e =
                assertThrows(
                        ConfigException.class,
                        () -> StoryEvalConfig.of("STORYEVAL_MAX_PASSES", "lots"));
        assertTrue(e.getMessage().contains("STORYEVAL_MAX_PASSES"));
    }

    @Test
    void danglingOverrideKeyIsRejected() {
        assertThrows(ConfigException.class, () -> StoryEvalConfig.of("STORYEVAL_MAX_PASSES"));
    }

    @Test
    public void testBuilderEqualsEnv() {
        var fromEnv =
                StoryEvalConfig.of(
                        "PANGRAM_API_KEY", "testkey",
                        "STORYEVAL_MAX_PASSES", "3");
        var fromBuilder = StoryEvalConfig.builder().pangramApiKey("testkey").maxPasses(3).build();
        var otherBuilder = StoryEvalConfig.builder().pangramApiKey("otherkey").maxPasses(3).build();
        assertEquals(fromEnv, fromBuilder);
        assertNotEquals(fromEnv, otherBuilder);
    }

    @Test
    public void testBuilderHasMethodForEveryField() {
        Set<String> builderMethodNames =
                Arrays.stream(StoryEvalConfig.Builder.class.getDeclaredMethods())
                        .map(Method::getName)
                        .collect(Collectors.toSet());

        for (Field field : StoryEvalConfig.class.getDeclaredFields()) {
            if (Modifier.isStatic(field.getModifiers())) {
                continue;
            }
            assertTrue(
                    builderMethodNames.contains(field.getName()),
                    "Builder is missing method for field: " + field.getName());
        }
    }
}
