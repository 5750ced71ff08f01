package dev.storyeval.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;

/**
 * The persisted outcome for one item.
 *
 * @param id the item id
 * @param fields plain fields in file order: the echoed inputs, plus any fields this job does not
 *     own (results written by a different job into the same file). Carried through verbatim.
 * @param results the sub-results owned by the running job, in insertion order
 */
public record ResultRecord(
        int id, @Nonnull Map<String, JsonNode> fields, @Nonnull Map<String, SubResult> results) {

    public ResultRecord {
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    /** A record with the item's echoed inputs and no results. */
    public static ResultRecord placeholder(Item item) {
        return new ResultRecord(item.id(), item.inputs(), Map.of());
    }

    public Optional<SubResult> result(String key) {
        return Optional.ofNullable(results.get(key));
    }

    /**
     * True if every given input has the same value here. A field that is absent compares equal to
     * JSON null. Fields not named in {@code inputs} are ignored.
     */
    public boolean echoes(Map<String, JsonNode> inputs) {
        for (var entry : inputs.entrySet()) {
            if (!Objects.equals(
                    normalize(fields.get(entry.getKey())), normalize(entry.getValue()))) {
                return false;
            }
        }
        return true;
    }

    private static JsonNode normalize(JsonNode node) {
        return node == null || node.isMissingNode() ? NullNode.getInstance() : node;
    }
}
