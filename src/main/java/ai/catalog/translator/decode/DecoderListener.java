package ai.catalog.translator.decode;

import ai.catalog.translator.model.LocalizedItem;

/**
 * Receives decoded items and reasoning text as soon as the decoder has consumed them.
 */
@FunctionalInterface
public interface DecoderListener {

    void onItem(LocalizedItem item);

    default void onReasoningStart() {
    }

    default void onReasoningDelta(String text) {
    }

    default void onReasoningEnd() {
    }
}
