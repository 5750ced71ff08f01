package dev.storyeval.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.github.mustachejava.MustacheNotFoundException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PromptTemplateTest {

    @Test
    void qualityPromptWrapsStoryWithoutEscaping() {
        var story = "\"Run,\" she said. <b>Tom & Jerry</b>";

        var rendered = PromptTemplate.QUALITY_USER.render(Map.of("story", story));

        assertTrue(rendered.startsWith("Analyze the story deeply"), rendered);
        assertTrue(rendered.endsWith("<story>\n" + story + "\n</story>"), rendered);
    }

    @Test
    void storyPromptNamesTheTargetLength() {
        assertEquals(
                "Prompt: A map with no edges\n\n"
                        + "Write a short story of about 800 words (aim for 750-850 words).",
                PromptTemplate.STORY_USER.render(Map.of("prompt", "A map with no edges")));
    }

    @Test
    void systemPromptsHaveNoTrailingNewline() {
        assertEquals(
                "You are a rigorous literary critic. Analyze the story in depth and then score it."
                        + " Return only XML tags with no extra text.",
                PromptTemplate.QUALITY_SYSTEM.render());
        assertFalse(PromptTemplate.STORY_SYSTEM.render().endsWith("\n"));
    }

    @Test
    void unknownTemplateFails() {
        assertThrows(MustacheNotFoundException.class, () -> PromptTemplate.load("no_such_prompt"));
    }
}
