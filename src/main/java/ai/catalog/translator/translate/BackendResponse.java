package ai.catalog.translator.translate;

import ai.catalog.translator.model.TokenUsage;

/**
 * Completed reply of a backend call.
 */
public record BackendResponse(String text, TokenUsage usage) {

    public BackendResponse {
        text = text == null ? "" : text;
        usage = usage == null ? TokenUsage.EMPTY : usage;
    }

    public static BackendResponse of(String text) {
        return new BackendResponse(text, TokenUsage.EMPTY);
    }
}
