package ai.catalog.translator.translate;

/**
 * Performs one call against an LLM vendor. Implementations block until the reply is complete and
 * report text deltas to the listener while it streams in.
 */
@FunctionalInterface
public interface BackendClient {

    /**
     * @throws ProviderException when the vendor or transport fails
     */
    BackendResponse send(BackendRequest request, BackendListener listener);
}
