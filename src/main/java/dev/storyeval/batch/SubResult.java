package dev.storyeval.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;
import java.util.Optional;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * One named evaluation or generation outcome within a {@link ResultRecord}: either the payload a
 * remote call returned, or the reason it failed.
 *
 * <p>On disk a failure is the object {@code {"error": "<message>"}}. Anything else is a success.
 */
public sealed interface SubResult permits SubResult.Success, SubResult.Failure {
    String ERROR_FIELD = "error";

    JsonNode toJson();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success(@Nonnull JsonNode payload) implements SubResult {
        public Success {
            Objects.requireNonNull(payload);
        }

        @Override
        public JsonNode toJson() {
            return payload;
        }
    }

    record Failure(@Nonnull String error) implements SubResult {
        public Failure {
            Objects.requireNonNull(error);
        }

        @Override
        public JsonNode toJson() {
            return JsonNodeFactory.instance.objectNode().put(ERROR_FIELD, error);
        }
    }

    static SubResult success(JsonNode payload) {
        return new Success(payload);
    }

    static SubResult failure(String error) {
        return new Failure(error);
    }

    /** Failure message for a call that threw. */
    static SubResult failure(Throwable t) {
        var message = t.getMessage();
        return new Failure(message != null ? message : t.getClass().getName());
    }

    /**
     * Decode a stored sub-result.
     *
     * @return empty for a missing or JSON null value
     */
    static Optional<SubResult> fromJson(@Nullable JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Optional.empty();
        }
        if (node instanceof ObjectNode object
                && object.size() == 1
                && object.path(ERROR_FIELD).isTextual()) {
            return Optional.of(new Failure(object.get(ERROR_FIELD).asText()));
        }
        return Optional.of(new Success(node));
    }
}
