package dev.storyeval.batch;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Decides whether a successful sub-result payload is good enough to count as done.
 *
 * <p>A sub-result that fails this check stays pending and is requested again on the next pass,
 * the same as an error.
 */
@FunctionalInterface
public interface CompletionPredicate {
    boolean isSatisfied(String resultKey, JsonNode payload);

    /** Any success counts. */
    static CompletionPredicate anySuccess() {
        return (key, payload) -> true;
    }

    /** The payload is an object carrying the given field. */
    static CompletionPredicate hasField(String field) {
        return (key, payload) -> payload.isObject() && payload.has(field);
    }

    /** The payload is a non-blank string. */
    static CompletionPredicate nonBlankText() {
        return (key, payload) -> payload.isTextual() && !payload.asText().isBlank();
    }

    /** Every named child of the payload's {@code container} object is a number. */
    static CompletionPredicate allNumbers(String container, List<String> names) {
        return (key, payload) -> {
            var scores = payload.path(container);
            return scores.isObject() && names.stream().allMatch(n -> scores.path(n).isNumber());
        };
    }
}
