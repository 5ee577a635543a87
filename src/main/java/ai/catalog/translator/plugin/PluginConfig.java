package ai.catalog.translator.plugin;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Immutable configuration of one plugin with typed accessors. Values are layered with
 * {@link #merge(Map)}: later layers shadow earlier ones key by key.
 */
public final class PluginConfig {

    private static final PluginConfig EMPTY = new PluginConfig(Map.of());

    private final Map<String, Object> values;

    private PluginConfig(Map<String, Object> values) {
        this.values = values;
    }

    public static PluginConfig empty() {
        return EMPTY;
    }

    public static PluginConfig of(Map<String, ?> values) {
        return EMPTY.merge(values);
    }

    public PluginConfig merge(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        Map<String, Object> merged = new LinkedHashMap<>(values);
        overrides.forEach((key, value) -> {
            if (value != null) {
                merged.put(key, value);
            }
        });
        return new PluginConfig(Collections.unmodifiableMap(merged));
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public String getString(String key, String defaultValue) {
        return get(key).map(Object::toString).filter(value -> !value.isBlank()).orElse(defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        return get(key).map(value -> value instanceof Number number
                ? number.intValue()
                : parse(key, value, Integer::parseInt)).orElse(defaultValue);
    }

    public double getDouble(String key, double defaultValue) {
        return get(key).map(value -> value instanceof Number number
                ? number.doubleValue()
                : parse(key, value, Double::parseDouble)).orElse(defaultValue);
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        return get(key).map(value -> value instanceof Boolean bool
                ? bool
                : Boolean.parseBoolean(value.toString().trim())).orElse(defaultValue);
    }

    public List<String> getStrings(String key) {
        return get(key).map(value -> {
            if (value instanceof List<?> list) {
                return list.stream().map(Object::toString).collect(Collectors.toList());
            }
            return Arrays.stream(value.toString().split(","))
                    .map(String::trim)
                    .filter(item -> !item.isEmpty())
                    .collect(Collectors.toList());
        }).orElse(List.of());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static <T> T parse(String key, Object value, Function<String, T> parser) {
        try {
            return parser.apply(value.toString().trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid numeric value for '" + key + "': " + value, ex);
        }
    }

    @Override
    public String toString() {
        return "PluginConfig" + values;
    }
}
