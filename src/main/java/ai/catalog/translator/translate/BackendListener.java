package ai.catalog.translator.translate;

import ai.catalog.translator.model.TokenUsage;

/**
 * Per-chunk callbacks of a live backend call. Reasoning callbacks carry block boundaries reported
 * by the vendor as sideband metadata.
 */
public interface BackendListener {

    BackendListener NO_OP = new BackendListener() {
    };

    default void onText(String delta) {
    }

    default void onReasoningStart() {
    }

    default void onReasoningDelta(String delta) {
    }

    default void onReasoningEnd() {
    }

    default void onUsage(TokenUsage delta) {
    }
}
