package ai.catalog.translator.model;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Backend selection for one call: vendor, model and sampling parameters.
 */
public record ProviderConfig(String vendor,
                             String model,
                             double temperature,
                             int maxTokens,
                             Map<String, Object> extras) {

    public static final String EXTRA_REASONING_BUDGET = "reasoning_budget";
    public static final int DEFAULT_MAX_TOKENS = 4096;

    public ProviderConfig {
        vendor = requireNonBlank(vendor, "vendor").trim().toLowerCase(Locale.ROOT);
        model = requireNonBlank(model, "model").trim();
        if (temperature < 0.0 || temperature > 2.0) {
            throw new IllegalArgumentException("temperature must be between 0.0 and 2.0");
        }
        if (maxTokens < 1) {
            throw new IllegalArgumentException("maxTokens must be at least 1");
        }
        extras = extras == null ? Map.of() : Map.copyOf(extras);
    }

    public ProviderConfig(String vendor, String model, double temperature) {
        this(vendor, model, temperature, DEFAULT_MAX_TOKENS, Map.of());
    }

    /**
     * Parses {@code vendor:model}. The model part may itself contain colons (ollama tags).
     */
    public static ProviderConfig parse(String spec, double temperature) {
        Objects.requireNonNull(spec, "spec");
        int separator = spec.indexOf(':');
        if (separator <= 0 || separator == spec.length() - 1) {
            throw new IllegalArgumentException("provider must be formatted as vendor:model but was '" + spec + "'");
        }
        return new ProviderConfig(spec.substring(0, separator), spec.substring(separator + 1), temperature);
    }

    public String label() {
        return vendor + ":" + model;
    }

    public Optional<Integer> reasoningBudget() {
        Object value = extras.get(EXTRA_REASONING_BUDGET);
        if (value instanceof Number number) {
            return Optional.of(number.intValue());
        }
        return Optional.empty();
    }

    public ProviderConfig withTemperature(double newTemperature) {
        return new ProviderConfig(vendor, model, newTemperature, maxTokens, extras);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
