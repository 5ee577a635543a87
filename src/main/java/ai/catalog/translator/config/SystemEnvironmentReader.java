package ai.catalog.translator.config;

import java.util.Optional;

/**
 * Reads process environment variables. A JVM system property of the same name is used when the
 * variable is unset, so {@code -DTRANSLATOR_PROVIDERS=...} works for local runs.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        String value = System.getenv(key);
        if (value == null || value.isBlank()) {
            value = System.getProperty(key);
        }
        return Optional.ofNullable(value);
    }
}
