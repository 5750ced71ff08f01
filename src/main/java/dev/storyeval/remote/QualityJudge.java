package dev.storyeval.remote;

import com.fasterxml.jackson.databind.JsonNode;
import dev.storyeval.json.StoryEvalJsonMapper;

/**
 * Asks a chat model to critique a story and returns the parsed {@link QualityEvaluation} as JSON.
 *
 * <p>A reply with missing scores is still a successful call. Whether it counts as done is up to
 * the job's completion check.
 */
public class QualityJudge implements RemoteCaller {
    private final ChatCompletionCaller chat;

    public QualityJudge(ChatCompletionCaller chat) {
        this.chat = chat;
    }

    @Override
    public JsonNode call(String story) {
        return StoryEvalJsonMapper.toTree(QualityResponseParser.parse(chat.complete(story)));
    }
}
