package ai.catalog.translator.model;

import java.util.Map;
import java.util.Objects;

/**
 * One translated key for one locale, as yielded by the pipeline's output sequence.
 */
public record TranslationOutput(String key, String value, String locale, boolean cached, Map<String, Object> metadata) {

    public TranslationOutput {
        key = Objects.requireNonNull(key, "key");
        value = Objects.requireNonNull(value, "value");
        locale = Objects.requireNonNull(locale, "locale");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public TranslationOutput(String key, String value, String locale) {
        this(key, value, locale, false, Map.of());
    }
}
