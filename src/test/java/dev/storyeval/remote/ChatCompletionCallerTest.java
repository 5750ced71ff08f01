package dev.storyeval.remote;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.junit.jupiter.api.Assertions.*;

import com.github.tomakehurst.wiremock.WireMockServer;
import dev.storyeval.ChatCompletionStubs;
import dev.storyeval.config.StoryEvalConfig;
import dev.storyeval.prompt.PromptTemplate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ChatCompletionCallerTest {
    private WireMockServer wireMock;
    private StoryEvalConfig config;

    @BeforeEach
    void beforeEach() {
        wireMock = new WireMockServer(wireMockConfig().dynamicPort());
        wireMock.start();
        config =
                StoryEvalConfig.builder()
                        .openRouterApiKey("or-test-key")
                        .openRouterBaseUrl(wireMock.baseUrl())
                        .judgeModel("judge/model")
                        .writerModel("writer/model")
                        .build();
    }

    @AfterEach
    void afterEach() {
        wireMock.stop();
    }

    private ChatCompletionCaller judgeChat() {
        return new ChatCompletionCaller(
                OpenRouterClients.create(config),
                config.judgeModel(),
                PromptTemplate.QUALITY_SYSTEM,
                PromptTemplate.QUALITY_USER,
                "story",
                0.2,
                config.judgeMaxTokens());
    }

    @Test
    void judgeSendsRenderedPromptAndParsesReply() {
        wireMock.stubFor(
                post(ChatCompletionStubs.PATH)
                        .willReturn(
                                okJson(
                                        ChatCompletionStubs.completion(
                                                "  <analysis>Vivid.</analysis><coherence>9</coherence>"
                                                        + "<style>8</style><general>8.5</general>\n"))));

        var evaluation = new QualityJudge(judgeChat()).call("It was a dark & stormy night.");

        assertEquals("Vivid.", evaluation.get("analysis").asText());
        assertEquals(8.5, evaluation.get("scores").get("general").asDouble());
        assertTrue(evaluation.get("raw_response").asText().startsWith("<analysis>"));
        assertEquals(0, evaluation.get("missing_tags").size());
        wireMock.verify(
                postRequestedFor(urlEqualTo(ChatCompletionStubs.PATH))
                        .withHeader("Authorization", equalTo("Bearer or-test-key"))
                        .withRequestBody(matchingJsonPath("$.model", equalTo("judge/model")))
                        .withRequestBody(matchingJsonPath("$.temperature", equalTo("0.2")))
                        .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("900")))
                        .withRequestBody(
                                matchingJsonPath(
                                        "$.messages[0].content",
                                        containing("rigorous literary critic")))
                        .withRequestBody(
                                matchingJsonPath(
                                        "$.messages[1].content",
                                        containing("<story>\nIt was a dark & stormy night.\n</story>"))));
    }

    @Test
    void writerReturnsStoryText() {
        wireMock.stubFor(
                post(ChatCompletionStubs.PATH)
                        .willReturn(okJson(ChatCompletionStubs.completion("The tide came in.\n"))));
        var writer =
                new StoryWriter(
                        new ChatCompletionCaller(
                                OpenRouterClients.create(config),
                                config.writerModel(),
                                PromptTemplate.STORY_SYSTEM,
                                PromptTemplate.STORY_USER,
                                "prompt",
                                0.9,
                                config.writerMaxTokens()));

        var story = writer.call("A lighthouse keeper");

        assertTrue(story.isTextual());
        assertEquals("The tide came in.", story.asText());
        wireMock.verify(
                postRequestedFor(urlEqualTo(ChatCompletionStubs.PATH))
                        .withRequestBody(matchingJsonPath("$.model", equalTo("writer/model")))
                        .withRequestBody(
                                matchingJsonPath(
                                        "$.messages[1].content",
                                        containing("Prompt: A lighthouse keeper"))));
    }

    @Test
    void blankStoryIsAFailure() {
        wireMock.stubFor(
                post(ChatCompletionStubs.PATH)
                        .willReturn(okJson(ChatCompletionStubs.completion("   "))));
        var writer =
                new StoryWriter(
                        new ChatCompletionCaller(
                                OpenRouterClients.create(config),
                                config.writerModel(),
                                PromptTemplate.STORY_SYSTEM,
                                PromptTemplate.STORY_USER,
                                "prompt",
                                0.9,
                                config.writerMaxTokens()));

        var e = assertThrows(RemoteCallException.class, () -> writer.call("anything"));
        assertEquals("model returned an empty story", e.getMessage());
    }

    @Test
    void serverErrorPropagates() {
        wireMock.stubFor(
                post(ChatCompletionStubs.PATH)
                        .willReturn(aResponse().withStatus(500).withBody("{\"error\":{\"message\":\"down\"}}")));

        assertThrows(RuntimeException.class, () -> new QualityJudge(judgeChat()).call("story"));
        wireMock.verify(1, postRequestedFor(urlEqualTo(ChatCompletionStubs.PATH)));
    }
}
