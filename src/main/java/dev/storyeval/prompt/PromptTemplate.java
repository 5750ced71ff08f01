package dev.storyeval.prompt;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import java.io.StringWriter;
import java.util.Map;

/**
 * A Mustache template loaded from {@code prompts/<name>.mustache} on the classpath.
 *
 * <p>Templates use triple mustaches for story and prompt text so nothing is HTML-escaped. A
 * compiled template is safe to render from many threads at once.
 */
public final class PromptTemplate {
    private static final MustacheFactory FACTORY = new DefaultMustacheFactory("prompts");

    public static final PromptTemplate QUALITY_SYSTEM = load("quality_system");
    public static final PromptTemplate QUALITY_USER = load("quality_user");
    public static final PromptTemplate STORY_SYSTEM = load("story_system");
    public static final PromptTemplate STORY_USER = load("story_user");

    private final Mustache mustache;

    private PromptTemplate(Mustache mustache) {
        this.mustache = mustache;
    }

    /**
     * Compile a template.
     *
     * @throws com.github.mustachejava.MustacheNotFoundException if there is no such resource
     */
    public static PromptTemplate load(String name) {
        return new PromptTemplate(FACTORY.compile(name + ".mustache"));
    }

    /** Render with the given variables, dropping trailing whitespace left by the template file. */
    public String render(Map<String, ?> variables) {
        var writer = new StringWriter();
        mustache.execute(writer, variables);
        writer.flush();
        return writer.toString().stripTrailing();
    }

    /** Render a template that takes no variables. */
    public String render() {
        return render(Map.of());
    }
}
