package ai.catalog.translator.pipeline;

import ai.catalog.translator.model.SourceText;
import ai.catalog.translator.model.TokenUsage;
import ai.catalog.translator.model.TranslationOutput;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.model.TranslationResult;
import ai.catalog.translator.plugin.PluginConfig;
import ai.catalog.translator.plugin.PluginRegistry;
import ai.catalog.translator.translate.TokenUsageAccumulator;
import ai.catalog.translator.translate.TranslationListener;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * Mutable state of one pipeline run.
 *
 * <p>The working text map starts as a copy of the request texts and may be rewritten by
 * middleware (masking, chunking). Translations are stored per locale; all writes go through
 * synchronized methods so that locale workers running in parallel never interleave on the same
 * slot. Plugin data is keyed by plugin name.
 */
public class TranslationContext implements ContextView {

    private final TranslationRequest request;
    private final PluginRegistry registry;
    private final TokenUsageAccumulator usage = new TokenUsageAccumulator();
    private final TranslationListener listener;
    private final Instant startedAt = Instant.now();
    private final Map<String, SourceText> texts;
    private final Map<String, Map<String, String>> translations = new LinkedHashMap<>();
    private final Map<String, Map<String, String>> providers = new HashMap<>();
    private final Map<String, Set<String>> cachedKeys = new HashMap<>();
    private final Map<String, Set<String>> unresolvedKeys = new HashMap<>();
    private final Map<String, Set<String>> publishedKeys = new HashMap<>();
    private final Map<String, Map<String, Object>> pluginData = new ConcurrentHashMap<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private volatile String currentStage = "";
    private volatile List<List<String>> chunks;
    private volatile Instant completedAt;
    private volatile Consumer<TranslationOutput> outputSink = output -> { };

    public TranslationContext(TranslationRequest request, PluginRegistry registry, TranslationListener listener) {
        this.request = Objects.requireNonNull(request, "request");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.listener = listener == null ? TranslationListener.NO_OP : listener;
        this.texts = new LinkedHashMap<>(request.texts());
    }

    @Override
    public TranslationRequest request() {
        return request;
    }

    @Override
    public String currentStage() {
        return currentStage;
    }

    void setCurrentStage(String stage) {
        this.currentStage = stage;
    }

    public TranslationListener listener() {
        return listener;
    }

    public TokenUsageAccumulator usage() {
        return usage;
    }

    // Working texts

    public synchronized Map<String, SourceText> texts() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(texts));
    }

    public synchronized void replaceTexts(Map<String, SourceText> replacement) {
        texts.clear();
        texts.putAll(replacement);
    }

    /**
     * Working texts still to be translated for the locale: everything not already served from a
     * cached translation.
     */
    public synchronized Map<String, SourceText> pendingTexts(String locale) {
        Set<String> cached = cachedKeys.getOrDefault(locale, Set.of());
        Map<String, SourceText> pending = new LinkedHashMap<>();
        texts.forEach((key, text) -> {
            if (!cached.contains(key)) {
                pending.put(key, text);
            }
        });
        return pending;
    }

    /**
     * Key groups to send per backend call. Without a chunking plugin the whole working set is a
     * single chunk.
     */
    public List<List<String>> chunks() {
        List<List<String>> current = chunks;
        if (current == null) {
            return List.of(List.copyOf(texts().keySet()));
        }
        return current;
    }

    public void setChunks(List<List<String>> newChunks) {
        List<List<String>> copy = new ArrayList<>();
        newChunks.forEach(chunk -> copy.add(List.copyOf(chunk)));
        this.chunks = List.copyOf(copy);
    }

    // Translations

    public synchronized void putTranslation(String locale, String key, String value, String provider) {
        translations.computeIfAbsent(locale, ignored -> new LinkedHashMap<>()).put(key, value);
        if (provider != null) {
            providers.computeIfAbsent(locale, ignored -> new HashMap<>()).put(key, provider);
        }
        Set<String> unresolved = unresolvedKeys.get(locale);
        if (unresolved != null) {
            unresolved.remove(key);
        }
    }

    public synchronized void markCached(String locale, String key, String value) {
        cachedKeys.computeIfAbsent(locale, ignored -> new HashSet<>()).add(key);
        translations.computeIfAbsent(locale, ignored -> new LinkedHashMap<>()).put(key, value);
    }

    public synchronized boolean isCached(String locale, String key) {
        return cachedKeys.getOrDefault(locale, Set.of()).contains(key);
    }

    public synchronized void removeTranslation(String locale, String key) {
        Map<String, String> entries = translations.get(locale);
        if (entries != null) {
            entries.remove(key);
        }
    }

    public synchronized Optional<String> translation(String locale, String key) {
        return Optional.ofNullable(translations.getOrDefault(locale, Map.of()).get(key));
    }

    public synchronized Optional<String> providerOf(String locale, String key) {
        return Optional.ofNullable(providers.getOrDefault(locale, Map.of()).get(key));
    }

    @Override
    public synchronized Map<String, Map<String, String>> translations() {
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        translations.forEach((locale, entries) -> copy.put(locale, Collections.unmodifiableMap(new LinkedHashMap<>(entries))));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Records a key that could not be translated for a locale, together with the warning.
     */
    public synchronized void markUnresolved(String locale, String key, String warning) {
        unresolvedKeys.computeIfAbsent(locale, ignored -> new HashSet<>()).add(key);
        warnings.add(warning);
    }

    public synchronized boolean isUnresolved(String locale, String key) {
        return unresolvedKeys.getOrDefault(locale, Set.of()).contains(key);
    }

    // Diagnostics

    public synchronized void addWarning(String warning) {
        warnings.add(warning);
    }

    public synchronized void addWarnings(List<String> newWarnings) {
        warnings.addAll(newWarnings);
    }

    @Override
    public synchronized List<String> warnings() {
        return List.copyOf(warnings);
    }

    public synchronized void addError(String error) {
        errors.add(error);
    }

    @Override
    public synchronized List<String> errors() {
        return List.copyOf(errors);
    }

    // Plugin data and configuration

    public Map<String, Object> pluginData(String pluginName) {
        return pluginData.computeIfAbsent(pluginName, ignored -> new ConcurrentHashMap<>());
    }

    public <T> Optional<T> pluginValue(String pluginName, String key, Class<T> type) {
        Object value = pluginData.getOrDefault(pluginName, Map.of()).get(key);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    @Override
    public Optional<Object> pluginValue(String pluginName, String key) {
        return Optional.ofNullable(pluginData.getOrDefault(pluginName, Map.of()).get(key));
    }

    /**
     * Plugin configuration for this request: registry layers (defaults, global, tenant) plus the
     * request's own per-plugin config.
     */
    public PluginConfig configFor(String pluginName) {
        return registry.configFor(pluginName, request.tenantId())
                .merge(request.pluginConfigs().getOrDefault(pluginName, Map.of()));
    }

    public boolean isEnabledForTenant(String pluginName) {
        return request.tenantId()
                .map(tenant -> registry.isEnabledForTenant(tenant, pluginName))
                .orElse(true);
    }

    // Output and lifecycle

    void setOutputSink(Consumer<TranslationOutput> sink) {
        this.outputSink = Objects.requireNonNull(sink, "sink");
    }

    public void emit(TranslationOutput output) {
        outputSink.accept(output);
    }

    /**
     * Emits the current translation of a key as an output. Each locale and key pair is published
     * at most once, so a value rewritten after publication is not streamed again.
     *
     * @return {@code false} when the key has no translation or was already published
     */
    public boolean publish(String locale, String key) {
        TranslationOutput output;
        synchronized (this) {
            String value = translations.getOrDefault(locale, Map.of()).get(key);
            if (value == null || !publishedKeys.computeIfAbsent(locale, ignored -> new HashSet<>()).add(key)) {
                return false;
            }
            Map<String, Object> metadata = new LinkedHashMap<>();
            String provider = providers.getOrDefault(locale, Map.of()).get(key);
            if (provider != null) {
                metadata.put("provider", provider);
            }
            output = new TranslationOutput(key, value, locale, isCached(locale, key), metadata);
        }
        emit(output);
        return true;
    }

    public synchronized boolean isPublished(String locale, String key) {
        return publishedKeys.getOrDefault(locale, Set.of()).contains(key);
    }

    void complete() {
        completedAt = Instant.now();
    }

    public boolean isComplete() {
        return completedAt != null;
    }

    @Override
    public TokenUsage tokenUsage() {
        return usage.snapshot();
    }

    @Override
    public Duration elapsed() {
        Instant end = completedAt == null ? Instant.now() : completedAt;
        return Duration.between(startedAt, end);
    }

    public TranslationResult snapshot() {
        return new TranslationResult(translations(), tokenUsage(), warnings(), errors(), elapsed());
    }
}
