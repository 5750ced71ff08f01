package dev.storyeval.batch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.storyeval.json.StoryEvalJsonMapper;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Items read from a newline-delimited JSON file.
 *
 * <p>An item's id is the 1-based physical line number, so blank and skipped lines still advance
 * the count and ids stay stable when neighbouring lines are fixed up later. Lines that are not
 * valid UTF-8 or not JSON objects, and objects the {@link LineMapper} rejects, are skipped.
 */
@Slf4j
public final class JsonlItemSource implements ItemSource {
    /** Turns one parsed line into an item, or rejects it. */
    @FunctionalInterface
    public interface LineMapper {
        Optional<Item> toItem(int lineNumber, ObjectNode line);
    }

    private final Path path;
    private final LineMapper mapper;

    public JsonlItemSource(Path path, LineMapper mapper) {
        this.path = path;
        this.mapper = mapper;
    }

    @Override
    public List<Item> load() {
        List<Item> items = new ArrayList<>();
        int lineNumber = 0;
        int skipped = 0;
        List<Optional<String>> lines;
        try {
            lines = Utf8Lines.read(path);
        } catch (IOException e) {
            throw new SourceException("Unable to read items from " + path, e);
        }
        for (var decoded : lines) {
            lineNumber++;
            if (decoded.isPresent() && decoded.get().isBlank()) {
                continue;
            }
            final int id = lineNumber;
            var item =
                    decoded.flatMap(StoryEvalJsonMapper::parseObjectLine)
                            .flatMap(obj -> mapper.toItem(id, obj));
            if (item.isPresent()) {
                items.add(item.get());
            } else {
                skipped++;
                log.debug("skipping line {} of {}", lineNumber, path);
            }
        }
        if (skipped > 0) {
            log.info("skipped {} lines of {} without usable fields", skipped, path);
        }
        if (items.isEmpty()) {
            throw new SourceException("No items found in " + path);
        }
        return items;
    }

    @Override
    public String describe() {
        return path.toString();
    }
}
