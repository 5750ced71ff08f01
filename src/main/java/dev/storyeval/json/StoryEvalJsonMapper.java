package dev.storyeval.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import java.util.Optional;
import lombok.SneakyThrows;

/** Centralized ObjectMapper for storyeval. */
public final class StoryEvalJsonMapper {

    private static volatile ObjectMapper instance;

    private StoryEvalJsonMapper() {}

    public static ObjectMapper get() {
        if (instance == null) {
            synchronized (StoryEvalJsonMapper.class) {
                if (instance == null) {
                    instance =
                            new ObjectMapper()
                                    .registerModule(new Jdk8Module())
                                    .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                                    .setDefaultPropertyInclusion(JsonInclude.Include.NON_ABSENT)
                                    .configure(
                                            DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                                            false);
                }
            }
        }
        return instance;
    }

    @SneakyThrows
    public static String toJson(Object o) {
        return get().writeValueAsString(o);
    }

    /** Convert a value into a JSON tree using the shared naming and inclusion rules. */
    public static JsonNode toTree(Object o) {
        return get().valueToTree(o);
    }

    /**
     * Parse one line of newline-delimited JSON.
     *
     * @return the object on the line, or empty if the line is not a JSON object
     */
    public static Optional<ObjectNode> parseObjectLine(String line) {
        try {
            var node = get().readTree(line);
            if (node instanceof ObjectNode objectNode) {
                return Optional.of(objectNode);
            }
            return Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }
}
