package dev.storyeval.jobs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.storyeval.batch.Item;
import dev.storyeval.batch.JsonlItemSource;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Line mappers for the story JSONL files. */
final class StoryLines {
    static final String ORIGINAL_STORY = "original_story";
    static final String UNSLOPPED_STORY = "unslopped_story";
    static final String CONTROL_STORY = "control_story";
    static final String STORY = "story";
    static final String PROMPT = "prompt";
    static final String PROMPT_ID = "prompt_id";

    private StoryLines() {}

    /**
     * A line carrying both the original and the rewritten story becomes one item with a sub-result
     * per story.
     */
    static JsonlItemSource.LineMapper pairs(String originalKey, String unsloppedKey) {
        return (lineNumber, line) -> pair(lineNumber, line, originalKey, unsloppedKey);
    }

    /** Pairs where present, otherwise a single generated {@code story} with its prompt. */
    static JsonlItemSource.LineMapper pairsOrSingles(
            String originalKey, String unsloppedKey, String singleKey) {
        return (lineNumber, line) ->
                pair(lineNumber, line, originalKey, unsloppedKey)
                        .or(() -> single(lineNumber, line, singleKey));
    }

    /** The rewritten story of a control file, echoed as {@code control_story}. */
    static JsonlItemSource.LineMapper controls(String resultKey) {
        return (lineNumber, line) ->
                text(line, UNSLOPPED_STORY)
                        .map(
                                story ->
                                        new Item(
                                                lineNumber,
                                                Map.of(CONTROL_STORY, line.get(UNSLOPPED_STORY)),
                                                Map.of(resultKey, story)));
    }

    private static Optional<Item> pair(
            int lineNumber, ObjectNode line, String originalKey, String unsloppedKey) {
        var original = text(line, ORIGINAL_STORY);
        var unslopped = text(line, UNSLOPPED_STORY);
        if (original.isEmpty() || unslopped.isEmpty()) {
            return Optional.empty();
        }
        Map<String, JsonNode> inputs = new LinkedHashMap<>();
        inputs.put(ORIGINAL_STORY, line.get(ORIGINAL_STORY));
        inputs.put(UNSLOPPED_STORY, line.get(UNSLOPPED_STORY));
        Map<String, String> targets = new LinkedHashMap<>();
        targets.put(originalKey, original.get());
        targets.put(unsloppedKey, unslopped.get());
        return Optional.of(new Item(lineNumber, inputs, targets));
    }

    private static Optional<Item> single(int lineNumber, ObjectNode line, String resultKey) {
        return text(line, STORY)
                .map(
                        story -> {
                            Map<String, JsonNode> inputs = new LinkedHashMap<>();
                            inputs.put(PROMPT_ID, valueOrNull(line, PROMPT_ID));
                            inputs.put(PROMPT, valueOrNull(line, PROMPT));
                            inputs.put(STORY, line.get(STORY));
                            return new Item(lineNumber, inputs, Map.of(resultKey, story));
                        });
    }

    private static JsonNode valueOrNull(ObjectNode line, String field) {
        var node = line.get(field);
        return node != null ? node : NullNode.getInstance();
    }

    private static Optional<String> text(ObjectNode line, String field) {
        var node = line.get(field);
        return node != null && node.isTextual() ? Optional.of(node.asText()) : Optional.empty();
    }
}
