package ai.catalog.translator.translate;

/**
 * Raised when a backend reply contains no item with both a key and a translated value.
 */
public class VerificationFailedException extends TranslationException {

    public VerificationFailedException(String message) {
        super(message);
    }
}
