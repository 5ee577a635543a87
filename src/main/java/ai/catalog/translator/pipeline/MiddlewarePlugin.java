package ai.catalog.translator.pipeline;

import ai.catalog.translator.model.TranslationResult;
import ai.catalog.translator.plugin.Plugin;
import java.util.List;

/**
 * Wraps the rest of a stage. A middleware may work before calling {@code next}, after it returns,
 * both, or short-circuit the stage by not calling it.
 */
public interface MiddlewarePlugin extends Plugin {

    /**
     * Stages this middleware joins. {@link TranslationContext#currentStage()} tells which one is
     * running.
     */
    List<String> stages();

    void handle(TranslationContext context, Next next);

    default void terminate(TranslationContext context, TranslationResult snapshot) {
    }
}
