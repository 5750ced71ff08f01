package dev.storyeval.batch;

import java.util.List;

/**
 * Loads the collection a batch job works through.
 *
 * <p>Items come back in source order, each with a stable 1-based id derived from its position.
 */
public interface ItemSource {
    /**
     * Load every usable item.
     *
     * @throws SourceException if the source is unreadable or yields no usable items
     */
    List<Item> load() throws SourceException;

    /** Human readable location, for log and error messages. */
    String describe();
}
