package ai.catalog.translator.config;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Source of {@code TRANSLATOR_*} settings and vendor keys.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader of(Map<String, String> values) {
        Objects.requireNonNull(values, "values");
        return key -> Optional.ofNullable(values.get(key));
    }
}
