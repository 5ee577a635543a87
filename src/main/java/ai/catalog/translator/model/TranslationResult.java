package ai.catalog.translator.model;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Final outcome of {@code translate(request)}: per-locale translations, token usage and warnings.
 */
public record TranslationResult(Map<String, Map<String, String>> translations,
                                TokenUsage tokenUsage,
                                List<String> warnings,
                                List<String> errors,
                                Duration duration) {

    public TranslationResult {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (translations != null) {
            translations.forEach((locale, entries) ->
                    copy.put(locale, Collections.unmodifiableMap(new LinkedHashMap<>(entries))));
        }
        translations = Collections.unmodifiableMap(copy);
        tokenUsage = tokenUsage == null ? TokenUsage.EMPTY : tokenUsage;
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
        duration = duration == null ? Duration.ZERO : duration;
    }

    public Optional<String> translation(String locale, String key) {
        return Optional.ofNullable(translations.getOrDefault(locale, Map.of()).get(key));
    }

    public Map<String, String> translationsFor(String locale) {
        return translations.getOrDefault(locale, Map.of());
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
