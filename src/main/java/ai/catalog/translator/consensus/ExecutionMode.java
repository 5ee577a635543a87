package ai.catalog.translator.consensus;

import java.util.Locale;

/**
 * How the configured providers are dispatched for one locale.
 */
public enum ExecutionMode {
    PARALLEL,
    SEQUENTIAL;

    public static ExecutionMode from(String value) {
        if (value == null || value.isBlank()) {
            return PARALLEL;
        }
        try {
            return ExecutionMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported execution mode: " + value, ex);
        }
    }
}
