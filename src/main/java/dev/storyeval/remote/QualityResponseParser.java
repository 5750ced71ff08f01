package dev.storyeval.remote;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Pulls the analysis and the three scores out of a judge reply made of XML-ish tags. */
public final class QualityResponseParser {
    public static final List<String> SCORE_TAGS = List.of("coherence", "style", "general");

    private static final Pattern NUMBER = Pattern.compile("(\\d+(?:\\.\\d+)?)");

    private QualityResponseParser() {}

    public static QualityEvaluation parse(String response) {
        var analysis = extractTag(response, "analysis").orElse(null);
        var coherence = extractScore(response, "coherence");
        var style = extractScore(response, "style");
        var general = extractScore(response, "general");
        List<String> missing = new ArrayList<>();
        if (coherence.isEmpty()) {
            missing.add("coherence");
        }
        if (style.isEmpty()) {
            missing.add("style");
        }
        if (general.isEmpty()) {
            missing.add("general");
        }
        return new QualityEvaluation(
                response,
                analysis,
                new QualityEvaluation.Scores(
                        coherence.orElse(null), style.orElse(null), general.orElse(null)),
                missing);
    }

    /** Stripped content of the first {@code <tag>...</tag>}, ignoring case. */
    static Optional<String> extractTag(String text, String tag) {
        var quoted = Pattern.quote(tag);
        Matcher matcher =
                Pattern.compile(
                                "<" + quoted + ">(.*?)</" + quoted + ">",
                                Pattern.CASE_INSENSITIVE | Pattern.DOTALL)
                        .matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1).strip());
    }

    /** First number inside the tag, if any. */
    static Optional<Double> extractScore(String text, String tag) {
        return extractTag(text, tag)
                .flatMap(
                        content -> {
                            var matcher = NUMBER.matcher(content);
                            return matcher.find()
                                    ? Optional.of(Double.parseDouble(matcher.group(1)))
                                    : Optional.empty();
                        });
    }
}
