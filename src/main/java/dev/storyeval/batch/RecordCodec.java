package dev.storyeval.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import javax.annotation.Nullable;

/**
 * Maps {@link ResultRecord}s to and from the JSON objects stored one per line in a snapshot.
 *
 * <p>The id field is written first, then the plain fields, then the sub-results. Only fields
 * named in {@code resultKeys} are decoded into {@link SubResult}s. Everything else round-trips as
 * plain JSON.
 */
public final class RecordCodec {
    private final String idField;
    private final Set<String> resultKeys;
    @Nullable private final String legacyErrorField;

    public RecordCodec(String idField, Set<String> resultKeys) {
        this(idField, resultKeys, null);
    }

    /**
     * @param legacyErrorField record-level error field that older result files used for this job,
     *     such as {@code control_error}. It is read as a plain field and dropped once the record is
     *     fixed up.
     */
    public RecordCodec(String idField, Set<String> resultKeys, @Nullable String legacyErrorField) {
        this.idField = idField;
        this.resultKeys = Set.copyOf(resultKeys);
        this.legacyErrorField = legacyErrorField;
    }

    public String idField() {
        return idField;
    }

    public Set<String> resultKeys() {
        return resultKeys;
    }

    public Optional<String> legacyErrorField() {
        return Optional.ofNullable(legacyErrorField);
    }

    /**
     * Decode one snapshot object.
     *
     * @return empty if the object has no integral id that fits in an int
     */
    public Optional<ResultRecord> decode(ObjectNode node) {
        var idNode = node.get(idField);
        if (idNode == null || !idNode.isIntegralNumber() || !idNode.canConvertToInt()) {
            return Optional.empty();
        }
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Map<String, SubResult> results = new LinkedHashMap<>();
        var it = node.fields();
        while (it.hasNext()) {
            var entry = it.next();
            var name = entry.getKey();
            if (name.equals(idField)) {
                continue;
            }
            if (resultKeys.contains(name)) {
                SubResult.fromJson(entry.getValue()).ifPresent(r -> results.put(name, r));
            } else {
                fields.put(name, entry.getValue());
            }
        }
        return Optional.of(new ResultRecord(idNode.intValue(), fields, results));
    }

    public ObjectNode encode(ResultRecord record) {
        var node = JsonNodeFactory.instance.objectNode();
        node.put(idField, record.id());
        record.fields().forEach((name, value) -> node.set(name, value));
        record.results().forEach((key, result) -> node.set(key, result.toJson()));
        return node;
    }
}
