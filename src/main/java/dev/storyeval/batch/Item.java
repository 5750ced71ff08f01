package dev.storyeval.batch;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import javax.annotation.Nonnull;

/**
 * One unit of work.
 *
 * @param id stable 1-based identity derived from the item's position in its source
 * @param inputs fields echoed into the output record. A change in any of them between runs
 *     invalidates stored results for this id.
 * @param targets text to send to the remote caller, keyed by the sub-result it produces
 */
public record Item(
        int id, @Nonnull Map<String, JsonNode> inputs, @Nonnull Map<String, String> targets) {

    public Item {
        if (id < 1) {
            throw new IllegalArgumentException("item ids are 1-based: " + id);
        }
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("item %d has nothing to evaluate".formatted(id));
        }
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
    }

    public Set<String> resultKeys() {
        return targets.keySet();
    }
}
