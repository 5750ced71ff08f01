package dev.storyeval.remote;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;
import javax.annotation.Nullable;

/**
 * A parsed literary-quality judgement. Absent values are written as JSON nulls so every record has
 * the same shape.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record QualityEvaluation(
        String rawResponse, @Nullable String analysis, Scores scores, List<String> missingTags) {

    public QualityEvaluation {
        missingTags = List.copyOf(missingTags);
    }

    /** Scores from 1 to 10. Null when the model left the tag out or put no number in it. */
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record Scores(
            @Nullable Double coherence, @Nullable Double style, @Nullable Double general) {}
}
