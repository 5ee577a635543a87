package ai.catalog.translator.translate;

/**
 * Every attempt of the verification loop failed.
 */
public class RetriesExhaustedException extends TranslationException {

    private final int attempts;

    public RetriesExhaustedException(String provider, int attempts, Throwable lastFailure) {
        super("%s failed after %d attempt(s): %s".formatted(provider, attempts,
                lastFailure == null ? "unknown failure" : lastFailure.getMessage()), lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
