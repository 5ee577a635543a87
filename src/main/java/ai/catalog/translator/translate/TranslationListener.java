package ai.catalog.translator.translate;

import ai.catalog.translator.model.LocalizedItem;
import ai.catalog.translator.model.TokenUsage;
import ai.catalog.translator.model.TranslationRequest;

/**
 * Progress callbacks fired while a request is processed. Callbacks may arrive from backend worker
 * threads; implementations must be thread-safe.
 */
public interface TranslationListener {

    TranslationListener NO_OP = new TranslationListener() {
    };

    enum PromptType {
        SYSTEM,
        USER
    }

    default void onStarted(TranslationRequest request) {
    }

    default void onItemTranslated(String locale, String provider, LocalizedItem item) {
    }

    default void onRawChunk(String provider, String delta) {
    }

    default void onReasoningStart(String provider) {
    }

    default void onReasoningDelta(String provider, String delta) {
    }

    default void onReasoningEnd(String provider) {
    }

    /**
     * {@link TokenUsage#isFinal()} separates interim updates from the once-per-call final total.
     */
    default void onTokenUsage(String provider, TokenUsage usage) {
    }

    default void onPromptGenerated(PromptType type, String prompt) {
    }
}
