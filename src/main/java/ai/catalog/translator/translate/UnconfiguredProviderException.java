package ai.catalog.translator.translate;

/**
 * The requested vendor or model is not recognized. Never retried.
 */
public class UnconfiguredProviderException extends TranslationException {

    public UnconfiguredProviderException(String message) {
        super(message);
    }
}
