package dev.storyeval.config;

import java.util.Map;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Base class for env-backed configuration.
 *
 * <p>Values are resolved from the override map first and the process environment second. An
 * override of {@link #NULL_OVERRIDE} forces the value to be absent even if the environment sets
 * it.
 */
public abstract class BaseConfig {
    /** Override value which makes a key resolve as unset. */
    public static final String NULL_OVERRIDE = "__storyeval_null_override__";

    protected final Map<String, String> envOverrides;

    protected BaseConfig(Map<String, String> envOverrides) {
        this.envOverrides = Map.copyOf(envOverrides);
    }

    protected final String getConfig(String key, String defaultValue) {
        return getConfig(key, defaultValue, String.class);
    }

    protected final int getConfig(String key, int defaultValue) {
        return getConfig(key, defaultValue, Integer.class);
    }

    @Nullable
    protected final <T> T getConfig(String key, @Nullable T defaultValue, Class<T> type) {
        var value = lookup(key);
        if (value == null) {
            return defaultValue;
        }
        return convert(key, value, type);
    }

    @Nullable
    private String lookup(String key) {
        String value =
                envOverrides.containsKey(key) ? envOverrides.get(key) : System.getenv(key);
        if (value == null || NULL_OVERRIDE.equals(value) || value.isBlank()) {
            return null;
        }
        return value.trim();
    }

    private static <T> T convert(String key, String value, Class<T> type) {
        try {
            if (type == String.class) {
                return type.cast(value);
            } else if (type == Integer.class) {
                return type.cast(Integer.valueOf(value));
            }
        } catch (NumberFormatException e) {
            throw new ConfigException(
                    "Invalid value for %s: '%s' is not a number".formatted(key, value), e);
        }
        throw new ConfigException("Unsupported config type for %s: %s".formatted(key, type));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return envOverrides.equals(((BaseConfig) o).envOverrides);
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), envOverrides);
    }
}
