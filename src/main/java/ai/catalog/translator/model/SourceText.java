package ai.catalog.translator.model;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A source string with an optional disambiguation context and already approved translations in
 * other locales.
 */
public record SourceText(String text, Optional<String> context, Map<String, String> references) {

    public SourceText {
        text = Objects.requireNonNull(text, "text");
        context = context == null ? Optional.empty() : context.filter(value -> !value.isBlank());
        references = references == null ? Map.of() : Map.copyOf(references);
    }

    public static SourceText of(String text) {
        return new SourceText(text, Optional.empty(), Map.of());
    }

    public SourceText withText(String newText) {
        return new SourceText(newText, context, references);
    }
}
