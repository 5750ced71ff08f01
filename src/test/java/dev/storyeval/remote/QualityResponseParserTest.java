package dev.storyeval.remote;

import static org.junit.jupiter.api.Assertions.*;

import dev.storyeval.json.StoryEvalJsonMapper;
import java.util.List;
import org.junit.jupiter.api.Test;

class QualityResponseParserTest {

    @Test
    void parsesAnalysisAndScores() {
        var reply =
                "<analysis>\n  Tight pacing, flat ending.\n</analysis>\n"
                        + "<coherence>8</coherence><style>7.5/10</style><general> 6 </general>";

        var evaluation = QualityResponseParser.parse(reply);

        assertEquals(reply, evaluation.rawResponse());
        assertEquals("Tight pacing, flat ending.", evaluation.analysis());
        assertEquals(new QualityEvaluation.Scores(8.0, 7.5, 6.0), evaluation.scores());
        assertEquals(List.of(), evaluation.missingTags());
    }

    @Test
    void tagsMatchIgnoringCase() {
        var evaluation =
                QualityResponseParser.parse(
                        "<ANALYSIS>ok</Analysis><Coherence>3</COHERENCE><style>4</style><general>5</general>");

        assertEquals("ok", evaluation.analysis());
        assertEquals(3.0, evaluation.scores().coherence());
    }

    @Test
    void missingOrNonNumericScoresAreReported() {
        var evaluation =
                QualityResponseParser.parse("<coherence>excellent</coherence><general>9</general>");

        assertNull(evaluation.analysis());
        assertNull(evaluation.scores().coherence());
        assertNull(evaluation.scores().style());
        assertEquals(9.0, evaluation.scores().general());
        assertEquals(List.of("coherence", "style"), evaluation.missingTags());
    }

    @Test
    void serializesEveryFieldIncludingNulls() {
        var json = StoryEvalJsonMapper.toJson(QualityResponseParser.parse("<style>2</style>"));

        assertEquals(
                "{\"raw_response\":\"<style>2</style>\",\"analysis\":null,"
                        + "\"scores\":{\"coherence\":null,\"style\":2.0,\"general\":null},"
                        + "\"missing_tags\":[\"coherence\",\"general\"]}",
                json);
    }
}
