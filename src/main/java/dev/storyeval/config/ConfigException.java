package dev.storyeval.config;

import javax.annotation.Nullable;

/**
 * Exception thrown when configuration is missing or invalid.
 *
 * <p>This is a RuntimeException so it doesn't require explicit handling. It is always fatal: it is
 * raised before any remote work starts and the command line exits non-zero.
 */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, @Nullable Throwable cause) {
        super(message, cause);
    }
}
