package dev.storyeval.remote;

import javax.annotation.Nullable;

/** Exception thrown when a remote endpoint fails or answers with something unusable. */
public class RemoteCallException extends RuntimeException {
    public RemoteCallException(String message) {
        super(message);
    }

    public RemoteCallException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
