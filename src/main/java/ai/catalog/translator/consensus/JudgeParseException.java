package ai.catalog.translator.consensus;

import ai.catalog.translator.translate.TranslationException;

/**
 * The judge's reply did not contain a selection within the candidate range.
 */
public class JudgeParseException extends TranslationException {

    public JudgeParseException(String message) {
        super(message);
    }
}
