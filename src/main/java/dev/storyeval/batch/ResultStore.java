package dev.storyeval.batch;

import com.fasterxml.jackson.databind.JsonNode;
import dev.storyeval.json.StoryEvalJsonMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import javax.annotation.concurrent.NotThreadSafe;
import lombok.extern.slf4j.Slf4j;

/**
 * The latest known {@link ResultRecord} per item id.
 *
 * <p>Records are only ever changed through {@link #merge}, which folds new sub-results into what is
 * already stored. A previously successful sub-result survives a merge unless the item's echoed
 * inputs changed, in which case the job's stale results for that id are dropped.
 *
 * <p>Only the orchestrating thread touches a store. Workers hand their results back instead.
 */
@Slf4j
@NotThreadSafe
public final class ResultStore {
    private final RecordCodec codec;
    private final Map<Integer, ResultRecord> records = new HashMap<>();

    public ResultStore(RecordCodec codec) {
        this.codec = codec;
    }

    /**
     * Load a snapshot file. A missing file is an empty store. Blank lines, lines that are not valid
     * UTF-8, lines that are not JSON objects and objects without an integer id are skipped. When an
     * id repeats, the last line wins.
     */
    public static ResultStore load(Path path, RecordCodec codec) throws IOException {
        var store = new ResultStore(codec);
        if (!Files.exists(path)) {
            log.debug("no snapshot at {}; starting empty", path);
            return store;
        }
        int skipped = 0;
        int lineNumber = 0;
        for (var decoded : Utf8Lines.read(path)) {
            lineNumber++;
            if (decoded.isPresent() && decoded.get().isBlank()) {
                continue;
            }
            var record =
                    decoded.flatMap(StoryEvalJsonMapper::parseObjectLine).flatMap(codec::decode);
            if (record.isPresent()) {
                store.records.put(record.get().id(), record.get());
            } else {
                skipped++;
                log.debug("skipping unusable line {} of snapshot {}", lineNumber, path);
            }
        }
        if (skipped > 0) {
            log.info("skipped {} unusable lines in {}", skipped, path);
        }
        log.info("loaded {} records from {}", store.records.size(), path);
        return store;
    }

    public RecordCodec codec() {
        return codec;
    }

    public Optional<ResultRecord> get(int id) {
        return Optional.ofNullable(records.get(id));
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }

    public SortedSet<Integer> ids() {
        return new TreeSet<>(records.keySet());
    }

    /**
     * Fold new sub-results into the record for {@code id}.
     *
     * <p>If the stored record does not echo {@code echoedInputs}, its sub-results are discarded
     * first. Otherwise new values replace old ones key by key, except that a failure never
     * replaces a stored success. The codec's legacy record-level error field is dropped when the
     * inputs changed or any update is a success.
     */
    public void merge(int id, Map<String, JsonNode> echoedInputs, Map<String, SubResult> updates) {
        var existing = records.get(id);
        Map<String, JsonNode> fields = new LinkedHashMap<>();
        Map<String, SubResult> results = new LinkedHashMap<>();
        boolean drifted = false;
        if (existing != null) {
            fields.putAll(existing.fields());
            if (existing.echoes(echoedInputs)) {
                results.putAll(existing.results());
            } else {
                drifted = true;
                if (!existing.results().isEmpty()) {
                    log.info(
                            "inputs changed for id {}; discarding {} stored results",
                            id,
                            existing.results().size());
                }
            }
        }
        // older files kept one error per record
        if (drifted || updates.values().stream().anyMatch(SubResult::isSuccess)) {
            codec.legacyErrorField().ifPresent(fields::remove);
        }
        fields.putAll(echoedInputs);
        updates.forEach(
                (key, update) -> {
                    var current = results.get(key);
                    if (current != null && current.isSuccess() && !update.isSuccess()) {
                        return;
                    }
                    results.put(key, update);
                });
        records.put(id, new ResultRecord(id, fields, results));
    }

    /**
     * True iff a record exists for the item, it echoes the item's current inputs, and every
     * sub-result the item asks for is a success that satisfies {@code predicate}.
     */
    public boolean isComplete(Item item, CompletionPredicate predicate) {
        return pendingKeys(item, predicate).isEmpty();
    }

    /** The item's sub-result keys that still need a remote call, in the item's target order. */
    public Set<String> pendingKeys(Item item, CompletionPredicate predicate) {
        var record = records.get(item.id());
        if (record == null || !record.echoes(item.inputs())) {
            return new LinkedHashSet<>(item.resultKeys());
        }
        Set<String> pending = new LinkedHashSet<>();
        for (var key : item.resultKeys()) {
            var result = record.result(key).orElse(null);
            if (!(result instanceof SubResult.Success success)
                    || !predicate.isSatisfied(key, success.payload())) {
                pending.add(key);
            }
        }
        return pending;
    }
}
