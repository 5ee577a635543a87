package ai.catalog.translator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable input of a single pipeline run. Text order follows the caller's map order.
 */
public record TranslationRequest(String sourceLocale,
                                 List<String> targetLocales,
                                 Map<String, SourceText> texts,
                                 Map<String, Object> options,
                                 Map<String, String> metadata,
                                 Optional<String> tenantId,
                                 Map<String, Map<String, Object>> pluginConfigs) {

    public static final String METADATA_FILENAME = "filename";
    public static final String METADATA_KEY_PREFIX = "key_prefix";
    public static final String METADATA_REQUEST_ID = "request_id";

    public TranslationRequest {
        sourceLocale = requireNonBlank(sourceLocale, "sourceLocale");
        Objects.requireNonNull(targetLocales, "targetLocales");
        if (targetLocales.isEmpty()) {
            throw new IllegalArgumentException("targetLocales must not be empty");
        }
        targetLocales = List.copyOf(targetLocales);
        texts = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(texts, "texts")));
        options = options == null ? Map.of() : Map.copyOf(options);
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        tenantId = tenantId == null ? Optional.empty() : tenantId.filter(value -> !value.isBlank());
        pluginConfigs = pluginConfigs == null ? Map.of() : Map.copyOf(pluginConfigs);
    }

    public static TranslationRequest of(String sourceLocale, List<String> targetLocales, Map<String, String> texts) {
        Map<String, SourceText> sources = new LinkedHashMap<>();
        texts.forEach((key, value) -> sources.put(key, SourceText.of(value)));
        return new TranslationRequest(sourceLocale, targetLocales, sources, Map.of(), Map.of(), Optional.empty(), Map.of());
    }

    public TranslationRequest withOptions(Map<String, Object> newOptions) {
        return new TranslationRequest(sourceLocale, targetLocales, texts, newOptions, metadata, tenantId, pluginConfigs);
    }

    public TranslationRequest withMetadata(Map<String, String> newMetadata) {
        return new TranslationRequest(sourceLocale, targetLocales, texts, options, newMetadata, tenantId, pluginConfigs);
    }

    public TranslationRequest withTenant(String tenant) {
        return new TranslationRequest(sourceLocale, targetLocales, texts, options, metadata, Optional.ofNullable(tenant), pluginConfigs);
    }

    public TranslationRequest withPluginConfigs(Map<String, Map<String, Object>> configs) {
        return new TranslationRequest(sourceLocale, targetLocales, texts, options, metadata, tenantId, configs);
    }

    public TranslationRequest forLocale(String locale) {
        return new TranslationRequest(sourceLocale, List.of(locale), texts, options, metadata, tenantId, pluginConfigs);
    }

    public Optional<Object> option(String key) {
        return Optional.ofNullable(options.get(key));
    }

    public boolean flag(String key) {
        return option(key)
                .map(value -> value instanceof Boolean bool ? bool : Boolean.parseBoolean(value.toString()))
                .orElse(false);
    }

    public Optional<String> metadata(String key) {
        return Optional.ofNullable(metadata.get(key)).filter(value -> !value.isBlank());
    }

    public Optional<String> keyPrefix() {
        return metadata(METADATA_KEY_PREFIX);
    }

    public String requestId() {
        return metadata(METADATA_REQUEST_ID).orElseGet(() -> Integer.toHexString(System.identityHashCode(this)));
    }

    public static String newRequestId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
