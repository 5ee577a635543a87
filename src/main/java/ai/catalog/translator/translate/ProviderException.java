package ai.catalog.translator.translate;

/**
 * Transport or vendor failure of a single backend call, including per-attempt timeouts.
 */
public class ProviderException extends TranslationException {

    private final String provider;

    public ProviderException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public ProviderException(String provider, String message) {
        this(provider, message, null);
    }

    public String provider() {
        return provider;
    }
}
