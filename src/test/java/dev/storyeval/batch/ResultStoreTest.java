package dev.storyeval.batch;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import dev.storyeval.json.StoryEvalJsonMapper;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.SneakyThrows;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ResultStoreTest {
    private static final RecordCodec CODEC =
            new RecordCodec("story_id", Set.of("a_eval", "b_eval"));

    @TempDir Path tempDir;

    private static Item item(int id, String a, String b) {
        Map<String, JsonNode> inputs = new LinkedHashMap<>();
        inputs.put("a", TextNode.valueOf(a));
        inputs.put("b", TextNode.valueOf(b));
        Map<String, String> targets = new LinkedHashMap<>();
        targets.put("a_eval", a);
        targets.put("b_eval", b);
        return new Item(id, inputs, targets);
    }

    private static JsonNode scored() {
        return StoryEvalJsonMapper.parseObjectLine("{\"score\":1}").orElseThrow();
    }

    @Test
    @SneakyThrows
    void loadSkipsUnusableLinesAndKeepsLastDuplicate() {
        var file = tempDir.resolve("snapshot.jsonl");
        Files.writeString(
                file,
                String.join(
                        "\n",
                        "{\"story_id\":1,\"a_eval\":{\"error\":\"first\"}}",
                        "",
                        "not json",
                        "[1,2]",
                        "{\"no_id\":true}",
                        "{\"story_id\":1,\"a_eval\":{\"error\":\"second\"}}",
                        "{\"story_id\":2}"),
                StandardCharsets.UTF_8);

        var store = ResultStore.load(file, CODEC);

        assertEquals(2, store.size());
        assertEquals(Set.of(1, 2), store.ids());
        assertEquals(
                new SubResult.Failure("second"),
                store.get(1).orElseThrow().result("a_eval").orElseThrow());
    }

    @Test
    @SneakyThrows
    void loadSkipsLineThatIsNotUtf8() {
        var file = tempDir.resolve("snapshot.jsonl");
        try (var out = Files.newOutputStream(file)) {
            out.write("{\"story_id\":1}\n".getBytes(StandardCharsets.UTF_8));
            out.write(new byte[] {'{', '"', 'a', (byte) 0xFF, '"', ':', '1', '}', '\n'});
            out.write("{\"story_id\":2}\n".getBytes(StandardCharsets.UTF_8));
        }

        var store = ResultStore.load(file, CODEC);

        assertEquals(Set.of(1, 2), store.ids());
    }

    @Test
    @SneakyThrows
    void missingFileIsEmpty() {
        var store = ResultStore.load(tempDir.resolve("absent.jsonl"), CODEC);

        assertTrue(store.isEmpty());
    }

    @Test
    void absentRecordNeedsEveryKey() {
        var store = new ResultStore(CODEC);
        var item = item(1, "x", "y");

        assertEquals(
                List.of("a_eval", "b_eval"),
                List.copyOf(store.pendingKeys(item, CompletionPredicate.anySuccess())));
        assertFalse(store.isComplete(item, CompletionPredicate.anySuccess()));
    }

    @Test
    void onlyUnsatisfiedKeysStayPending() {
        var store = new ResultStore(CODEC);
        var item = item(1, "x", "y");
        store.merge(
                1,
                item.inputs(),
                Map.of("a_eval", SubResult.success(scored()), "b_eval", SubResult.failure("500")));

        assertEquals(Set.of("b_eval"), store.pendingKeys(item, CompletionPredicate.anySuccess()));

        store.merge(1, item.inputs(), Map.of("b_eval", SubResult.success(scored())));

        assertTrue(store.isComplete(item, CompletionPredicate.anySuccess()));
    }

    @Test
    void successThatFailsPredicateIsPending() {
        var store = new ResultStore(CODEC);
        var item = item(1, "x", "y");
        store.merge(
                1,
                item.inputs(),
                Map.of(
                        "a_eval", SubResult.success(scored()),
                        "b_eval", SubResult.success(IntNode.valueOf(3))));

        assertEquals(
                Set.of("b_eval"), store.pendingKeys(item, CompletionPredicate.hasField("score")));
    }

    @Test
    void failureNeverReplacesSuccess() {
        var store = new ResultStore(CODEC);
        var item = item(1, "x", "y");
        store.merge(1, item.inputs(), Map.of("a_eval", SubResult.success(scored())));

        store.merge(1, item.inputs(), Map.of("a_eval", SubResult.failure("timeout")));

        assertTrue(store.get(1).orElseThrow().result("a_eval").orElseThrow().isSuccess());
    }

    @Test
    void driftDiscardsResultsButKeepsForeignFields() {
        var store = new ResultStore(CODEC);
        var original =
                CODEC.decode(
                                StoryEvalJsonMapper.parseObjectLine(
                                                "{\"story_id\":1,\"a\":\"x\",\"b\":\"y\",\"other_eval\":{\"score\":9},"
                                                        + "\"a_eval\":{\"score\":1}}")
                                        .orElseThrow())
                        .orElseThrow();
        store.merge(1, original.fields(), original.results());
        var changed = item(1, "x", "edited");

        assertEquals(
                Set.of("a_eval", "b_eval"),
                store.pendingKeys(changed, CompletionPredicate.anySuccess()));

        store.merge(1, changed.inputs(), Map.of("b_eval", SubResult.failure("500")));

        var record = store.get(1).orElseThrow();
        assertTrue(record.result("a_eval").isEmpty());
        assertEquals(TextNode.valueOf("edited"), record.fields().get("b"));
        assertEquals(9, record.fields().get("other_eval").get("score").asInt());
    }

    @Test
    void missingInputEqualsNull() {
        var store = new ResultStore(CODEC);
        Map<String, JsonNode> inputs = new LinkedHashMap<>();
        inputs.put("prompt", NullNode.getInstance());
        var item = new Item(4, inputs, Map.of("a_eval", "text"));
        store.merge(4, Map.of(), Map.of("a_eval", SubResult.success(scored())));

        assertTrue(store.isComplete(item, CompletionPredicate.anySuccess()));
    }

    @Test
    void successDropsLegacyRecordError() {
        var codec = new RecordCodec("story_id", Set.of("a_eval", "b_eval"), "control_error");
        var store = new ResultStore(codec);
        var item = item(1, "x", "y");
        var old =
                codec.decode(
                                StoryEvalJsonMapper.parseObjectLine(
                                                "{\"story_id\":1,\"a\":\"x\",\"b\":\"y\","
                                                        + "\"error\":\"other job\","
                                                        + "\"control_error\":\"HTTP 429\"}")
                                        .orElseThrow())
                        .orElseThrow();
        store.merge(1, old.fields(), old.results());

        store.merge(1, item.inputs(), Map.of("a_eval", SubResult.failure("500")));
        assertTrue(store.get(1).orElseThrow().fields().containsKey("control_error"));

        store.merge(1, item.inputs(), Map.of("a_eval", SubResult.success(scored())));

        var fields = store.get(1).orElseThrow().fields();
        assertFalse(fields.containsKey("control_error"));
        assertEquals(TextNode.valueOf("other job"), fields.get("error"));
    }

    @Test
    void driftDropsLegacyRecordError() {
        var codec = new RecordCodec("story_id", Set.of("a_eval", "b_eval"), "control_error");
        var store = new ResultStore(codec);
        Map<String, JsonNode> fields = new LinkedHashMap<>(item(1, "x", "y").inputs());
        fields.put("control_error", TextNode.valueOf("timeout"));
        store.merge(1, fields, Map.of());

        store.merge(
                1, item(1, "x", "edited").inputs(), Map.of("a_eval", SubResult.failure("500")));

        assertFalse(store.get(1).orElseThrow().fields().containsKey("control_error"));
    }
}
