package dev.storyeval.batch;

import com.fasterxml.jackson.databind.node.TextNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

/**
 * Items read from a plain-text list of writing prompts, one per line.
 *
 * <p>Blank lines are ignored and a leading list number such as {@code 12.} or {@code 12)} is
 * stripped. Ids count non-blank lines from 1. A line holding only a list number still takes its id
 * but is not sent anywhere.
 */
@Slf4j
public final class PromptListItemSource implements ItemSource {
    private static final Pattern LIST_NUMBER = Pattern.compile("^\\s*\\d+[.)]\\s*");

    private final Path path;
    private final String inputField;
    private final String resultKey;

    /**
     * @param inputField name under which the prompt text is echoed
     * @param resultKey sub-result the prompt is sent for
     */
    public PromptListItemSource(Path path, String inputField, String resultKey) {
        this.path = path;
        this.inputField = inputField;
        this.resultKey = resultKey;
    }

    @Override
    public List<Item> load() {
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceException("Unable to read prompts from " + path, e);
        }
        List<Item> items = new ArrayList<>();
        int ordinal = 0;
        for (var line : lines) {
            if (line.isBlank()) {
                continue;
            }
            ordinal++;
            var prompt = LIST_NUMBER.matcher(line.strip()).replaceFirst("");
            if (prompt.isBlank()) {
                log.debug("prompt {} of {} has no text; skipping", ordinal, path);
                continue;
            }
            items.add(
                    new Item(
                            ordinal,
                            Map.of(inputField, TextNode.valueOf(prompt)),
                            Map.of(resultKey, prompt)));
        }
        if (items.isEmpty()) {
            throw new SourceException("No prompts found in " + path);
        }
        return items;
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
