package ai.catalog.translator.pipeline;

import ai.catalog.translator.model.TranslationResult;

/**
 * Runs after a pipeline run has finished, successfully or not.
 */
@FunctionalInterface
public interface Terminator {

    void terminate(TranslationContext context, TranslationResult snapshot);
}
