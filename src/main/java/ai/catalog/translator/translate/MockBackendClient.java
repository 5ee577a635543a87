package ai.catalog.translator.translate;

import ai.catalog.translator.decode.ItemFormat;
import ai.catalog.translator.model.TokenUsage;

/**
 * Offline backend producing {@code [locale] text} for every entry, streamed one item per chunk.
 */
public class MockBackendClient implements BackendClient {

    @Override
    public BackendResponse send(BackendRequest request, BackendListener listener) {
        BackendListener callbacks = listener == null ? BackendListener.NO_OP : listener;
        StringBuilder reply = new StringBuilder();
        request.entries().forEach((key, value) -> {
            String item = ItemFormat.renderItem(key, "[" + request.targetLocale() + "] " + value) + "\n";
            callbacks.onText(item);
            reply.append(item);
        });
        TokenUsage usage = TokenUsage.of(estimate(request.systemPrompt()) + estimate(request.userPrompt()), estimate(reply.toString()));
        callbacks.onUsage(usage);
        return new BackendResponse(reply.toString(), usage);
    }

    private static long estimate(String text) {
        return (text.length() + 3) / 4;
    }
}
