package ai.catalog.translator.pipeline;

/**
 * Terminal work of a stage, run after every middleware of the stage called onward.
 */
@FunctionalInterface
public interface StageHandler {

    void handle(TranslationContext context);
}
