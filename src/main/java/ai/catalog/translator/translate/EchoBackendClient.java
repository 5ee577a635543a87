package ai.catalog.translator.translate;

import ai.catalog.translator.decode.ItemFormat;

/**
 * Dry-run backend that answers with the source text unchanged.
 */
public class EchoBackendClient implements BackendClient {

    @Override
    public BackendResponse send(BackendRequest request, BackendListener listener) {
        String reply = ItemFormat.render(request.entries());
        if (listener != null) {
            listener.onText(reply);
        }
        return BackendResponse.of(reply);
    }
}
