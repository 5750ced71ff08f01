package dev.storyeval.json;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class StoryEvalJsonMapperTest {

    @Test
    void toJson_usesSnakeCaseNaming() {
        record Evaluation(String rawResponse, int totalScore) {}

        String json = StoryEvalJsonMapper.toJson(new Evaluation("<general>7</general>", 7));

        assertEquals("{\"raw_response\":\"<general>7</general>\",\"total_score\":7}", json);
    }

    @Test
    void toJson_excludesEmptyOptionalsAndNulls() {
        record TestRecord(String name, Optional<String> nickname, String email) {}

        String json = StoryEvalJsonMapper.toJson(new TestRecord("Alice", Optional.empty(), null));

        assertEquals("{\"name\":\"Alice\"}", json);
    }

    @Test
    void parseObjectLine_acceptsObjectsOnly() {
        assertTrue(StoryEvalJsonMapper.parseObjectLine("{\"story_id\": 1}").isPresent());
        assertTrue(StoryEvalJsonMapper.parseObjectLine("[1, 2]").isEmpty());
        assertTrue(StoryEvalJsonMapper.parseObjectLine("{\"story_id\": ").isEmpty());
        assertTrue(StoryEvalJsonMapper.parseObjectLine("not json").isEmpty());
    }

    @Test
    void toTree_keepsFieldOrder() {
        record Scores(Double coherence, Double style, Double general) {}

        var tree = StoryEvalJsonMapper.toTree(new Scores(1.0, 2.0, 3.0));

        assertEquals("{\"coherence\":1.0,\"style\":2.0,\"general\":3.0}", tree.toString());
    }
}
