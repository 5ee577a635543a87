package ai.catalog.translator.pipeline;

import ai.catalog.translator.translate.TranslationException;

/**
 * The run was cancelled, typically because its output stream was closed early.
 */
public class PipelineInterruptedException extends TranslationException {

    public PipelineInterruptedException(String stage) {
        super("Translation interrupted before stage " + stage);
    }
}
