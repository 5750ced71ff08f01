package dev.storyeval.batch;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.annotation.Nonnull;

/**
 * What one item's task produced in a pass: the inputs it ran against and one sub-result per
 * requested key. Failures are carried here as data and never thrown.
 */
public record ItemOutcome(
        int id, @Nonnull Map<String, JsonNode> inputs, @Nonnull Map<String, SubResult> results) {

    public ItemOutcome {
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public long failures() {
        return results.values().stream().filter(r -> !r.isSuccess()).count();
    }
}
