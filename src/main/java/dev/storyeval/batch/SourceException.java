package dev.storyeval.batch;

import javax.annotation.Nullable;

/**
 * Exception thrown when an {@link ItemSource} cannot produce any work.
 *
 * <p>This is fatal: a batch never starts against an unreadable or empty source.
 */
public class SourceException extends RuntimeException {
    public SourceException(String message) {
        super(message);
    }

    public SourceException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
