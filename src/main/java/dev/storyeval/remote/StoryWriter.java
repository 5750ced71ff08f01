package dev.storyeval.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/** Asks a chat model for a short story and returns its text as a JSON string. */
public class StoryWriter implements RemoteCaller {
    private final ChatCompletionCaller chat;

    public StoryWriter(ChatCompletionCaller chat) {
        this.chat = chat;
    }

    @Override
    public JsonNode call(String prompt) {
        var story = chat.complete(prompt);
        if (story.isBlank()) {
            throw new RemoteCallException("model returned an empty story");
        }
        return TextNode.valueOf(story);
    }
}
