package ai.catalog.translator.consensus;

import ai.catalog.translator.translate.TranslationException;

/**
 * A locale ended in {@link LocaleState#FAILED}.
 */
public class LocaleFailedException extends TranslationException {

    private final String locale;

    public LocaleFailedException(String locale, String message, Throwable cause) {
        super("Translation to %s failed: %s".formatted(locale, message), cause);
        this.locale = locale;
    }

    public String locale() {
        return locale;
    }
}
