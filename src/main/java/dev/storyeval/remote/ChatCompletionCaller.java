package dev.storyeval.remote;

import com.openai.client.OpenAIClient;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import dev.storyeval.prompt.PromptTemplate;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * One system prompt plus one rendered user prompt, sent as a single chat completion.
 *
 * <p>The text handed to {@link #complete} is bound to {@code variable} in the user template.
 */
@Slf4j
public class ChatCompletionCaller {
    private final OpenAIClient client;
    private final String model;
    private final String systemPrompt;
    private final PromptTemplate userTemplate;
    private final String variable;
    private final double temperature;
    private final long maxTokens;

    public ChatCompletionCaller(
            OpenAIClient client,
            String model,
            PromptTemplate systemTemplate,
            PromptTemplate userTemplate,
            String variable,
            double temperature,
            long maxTokens) {
        this.client = client;
        this.model = model;
        this.systemPrompt = systemTemplate.render();
        this.userTemplate = userTemplate;
        this.variable = variable;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    /**
     * Send the completion request.
     *
     * @return the first choice's content with surrounding whitespace removed
     * @throws RemoteCallException if the reply has no choices or no content
     */
    public String complete(String text) {
        var params =
                ChatCompletionCreateParams.builder()
                        .model(model)
                        .addSystemMessage(systemPrompt)
                        .addUserMessage(userTemplate.render(Map.of(variable, text)))
                        .temperature(temperature)
                        .maxTokens(maxTokens)
                        .build();
        log.debug("chat completion request: model {}, {} chars", model, text.length());
        var completion = client.chat().completions().create(params);
        if (completion.choices().isEmpty()) {
            throw new RemoteCallException("chat completion returned no choices");
        }
        return completion
                .choices()
                .get(0)
                .message()
                .content()
                .map(String::strip)
                .orElseThrow(() -> new RemoteCallException("chat completion returned no content"));
    }
}
