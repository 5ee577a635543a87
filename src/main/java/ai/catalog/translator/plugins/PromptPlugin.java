package ai.catalog.translator.plugins;

import ai.catalog.translator.pipeline.MiddlewarePlugin;
import ai.catalog.translator.pipeline.Next;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.TranslationContext;
import ai.catalog.translator.prompt.PromptTemplates;
import java.util.List;
import java.util.Objects;

/**
 * Makes the prompt templates available to the translation stage.
 */
public class PromptPlugin implements MiddlewarePlugin {

    public static final String NAME = "prompt";
    public static final String TEMPLATES = "templates";

    private final PromptTemplates templates;

    public PromptPlugin() {
        this(PromptTemplates.loadDefault());
    }

    public PromptPlugin(PromptTemplates templates) {
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> stages() {
        return List.of(PipelineStages.PREPARATION);
    }

    @Override
    public void handle(TranslationContext context, Next next) {
        context.pluginData(NAME).put(TEMPLATES, templates);
        next.proceed(context);
    }
}
