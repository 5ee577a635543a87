package ai.catalog.translator.pipeline;

/**
 * The remainder of a stage's middleware chain.
 */
@FunctionalInterface
public interface Next {

    void proceed(TranslationContext context);
}
