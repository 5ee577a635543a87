package ai.catalog.translator.plugins;

import ai.catalog.translator.consensus.ConsensusEngine;
import ai.catalog.translator.consensus.ConsensusSettings;
import ai.catalog.translator.consensus.ExecutionMode;
import ai.catalog.translator.consensus.FallbackSelector;
import ai.catalog.translator.consensus.LocaleFailedException;
import ai.catalog.translator.consensus.LocaleResolution;
import ai.catalog.translator.consensus.LocaleTask;
import ai.catalog.translator.consensus.LongestCandidateSelector;
import ai.catalog.translator.model.ProviderConfig;
import ai.catalog.translator.model.SourceText;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.ProviderPlugin;
import ai.catalog.translator.pipeline.TranslationContext;
import ai.catalog.translator.plugin.PluginConfig;
import ai.catalog.translator.prompt.Prompt;
import ai.catalog.translator.prompt.PromptBuilder;
import ai.catalog.translator.prompt.PromptTemplates;
import ai.catalog.translator.translate.BackendClient;
import ai.catalog.translator.translate.BackendRequest;
import ai.catalog.translator.translate.RetryPolicy;
import ai.catalog.translator.translate.TranslationException;
import ai.catalog.translator.translate.TranslationListener;
import ai.catalog.translator.translate.TranslationService;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Translates every target locale through the consensus engine. Locales run concurrently; each
 * result is written into the context on the calling thread as soon as its locale finishes, and
 * its keys are published right away unless post-processing still has to restore masked values in
 * them. Keys split by {@link TokenChunkingPlugin} only exist as parts at this point and are
 * published once merged.
 *
 * <p>Provider entries in the {@code providers} option are either {@code vendor:model} strings or
 * maps with {@code vendor}, {@code model} and optional {@code temperature} and {@code max_tokens}.
 */
public class MultiProviderPlugin implements ProviderPlugin, AutoCloseable {

    public static final String NAME = "multi_provider";
    public static final String SERVICE = "translation.multi_provider";

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiProviderPlugin.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final Function<ProviderConfig, BackendClient> backends;
    private final FallbackSelector fallbackSelector;
    private final ExecutorService executor;

    public MultiProviderPlugin(Function<ProviderConfig, BackendClient> backends) {
        this(backends, new LongestCandidateSelector());
    }

    public MultiProviderPlugin(Function<ProviderConfig, BackendClient> backends, FallbackSelector fallbackSelector) {
        this.backends = Objects.requireNonNull(backends, "backends");
        this.fallbackSelector = Objects.requireNonNull(fallbackSelector, "fallbackSelector");
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "translation-worker-" + THREAD_COUNTER.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public List<String> provides() {
        return List.of(SERVICE);
    }

    @Override
    public List<String> when() {
        return List.of(PipelineStages.TRANSLATION);
    }

    @Override
    public Map<String, Object> defaultConfig() {
        Map<String, Object> defaults = new LinkedHashMap<>();
        defaults.put("execution_mode", "parallel");
        defaults.put("consensus_threshold", ConsensusSettings.DEFAULT_CONSENSUS_THRESHOLD);
        defaults.put("fallback_on_failure", true);
        defaults.put("retry_attempts", RetryPolicy.DEFAULT.maxAttempts());
        defaults.put("initial_backoff_millis", RetryPolicy.DEFAULT.initialBackoff().toMillis());
        defaults.put("max_backoff_millis", RetryPolicy.DEFAULT.maxBackoff().toMillis());
        defaults.put("retry_jitter_factor", RetryPolicy.DEFAULT.jitterFactor());
        defaults.put("timeout_seconds", 30);
        defaults.put("temperature", 0.3);
        defaults.put("judge", ConsensusSettings.DEFAULT_JUDGE.label());
        defaults.put("judge_temperature", ConsensusSettings.DEFAULT_JUDGE.temperature());
        return Map.copyOf(defaults);
    }

    /**
     * @return resolutions per locale that had anything to translate
     * @throws LocaleFailedException when a locale fails and fallback on failure is disabled, or
     *         when no locale produced any translation
     */
    @Override
    public Map<String, LocaleResolution> execute(TranslationContext context) {
        PluginConfig config = context.configFor(NAME);
        List<String> warnings = new ArrayList<>();
        ConsensusSettings settings = settingsFrom(config, warnings);
        context.addWarnings(warnings);
        settings.providers().forEach(backends::apply);
        if (settings.providers().size() > 1) {
            backends.apply(settings.judge());
        }

        ConsensusEngine engine = new ConsensusEngine(settings, backends, translationService(config), fallbackSelector, executor);
        PromptBuilder prompts = new PromptBuilder(context.pluginValue(PromptPlugin.NAME, PromptPlugin.TEMPLATES, PromptTemplates.class)
                .orElseGet(PromptTemplates::loadDefault));

        CompletionService<LocaleResolution> completion = new ExecutorCompletionService<>(executor);
        Map<String, Future<LocaleResolution>> running = new LinkedHashMap<>();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        for (String locale : context.request().targetLocales()) {
            LocaleTask task = taskFor(context, locale, prompts);
            if (task.sources().isEmpty()) {
                LOGGER.info("Nothing to translate for {}", locale);
                continue;
            }
            running.put(locale, completion.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return engine.resolve(task);
                } finally {
                    MDC.clear();
                }
            }));
        }
        return collect(context, settings, completion, running);
    }

    private Map<String, LocaleResolution> collect(TranslationContext context,
                                                  ConsensusSettings settings,
                                                  CompletionService<LocaleResolution> completion,
                                                  Map<String, Future<LocaleResolution>> running) {
        Map<String, LocaleResolution> completed = new HashMap<>();
        List<LocaleFailedException> failures = new ArrayList<>();
        try {
            for (int received = 0; received < running.size(); received++) {
                Future<LocaleResolution> done = completion.take();
                try {
                    LocaleResolution resolution = done.get();
                    completed.put(resolution.locale(), resolution);
                    apply(context, resolution);
                    publishReady(context, resolution);
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() == null ? ex : ex.getCause();
                    if (cause instanceof LocaleFailedException localeFailure) {
                        if (!settings.fallbackOnFailure()) {
                            throw localeFailure;
                        }
                        failures.add(localeFailure);
                    } else if (cause instanceof RuntimeException runtimeException) {
                        throw runtimeException;
                    } else {
                        throw new TranslationException("Translation to " + localeOf(done, running) + " failed", cause);
                    }
                }
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TranslationException("Interrupted while waiting for locale translations", ex);
        } finally {
            running.values().forEach(future -> future.cancel(true));
        }

        boolean anyTranslation = completed.values().stream().anyMatch(resolution -> !resolution.translations().isEmpty());
        if (!running.isEmpty() && !anyTranslation) {
            throw failures.isEmpty()
                    ? new TranslationException("No translations were produced for " + running.keySet())
                    : failures.get(0);
        }

        failures.forEach(failure -> {
            LOGGER.error(failure.getMessage());
            context.addError(failure.getMessage());
        });
        Map<String, LocaleResolution> resolved = new LinkedHashMap<>();
        running.keySet().stream()
                .filter(completed::containsKey)
                .forEach(locale -> resolved.put(locale, completed.get(locale)));
        return resolved;
    }

    private static void apply(TranslationContext context, LocaleResolution resolution) {
        String locale = resolution.locale();
        resolution.translations().forEach((key, value) ->
                context.putTranslation(locale, key, value, resolution.providers().get(key)));
        context.addWarnings(resolution.warnings());
        resolution.unresolvedKeys().forEach(key ->
                context.markUnresolved(locale, key, "No translations found for key '%s' (%s)".formatted(key, locale)));
        LOGGER.info("{}: {} key(s) translated, state {}", locale, resolution.translations().size(), resolution.state());
    }

    @SuppressWarnings("unchecked")
    private static void publishReady(TranslationContext context, LocaleResolution resolution) {
        Map<String, String> maskTokens = context.pluginValue(PiiMaskingPlugin.NAME, PiiMaskingPlugin.MASK_MAP, Map.class)
                .orElse(Map.of());
        int published = 0;
        for (String key : context.request().texts().keySet()) {
            String value = resolution.translations().get(key);
            if (value == null || maskTokens.keySet().stream().anyMatch(value::contains)) {
                continue;
            }
            if (context.publish(resolution.locale(), key)) {
                published++;
            }
        }
        LOGGER.debug("{}: published {} key(s) ahead of the output stage", resolution.locale(), published);
    }

    private static String localeOf(Future<LocaleResolution> future, Map<String, Future<LocaleResolution>> running) {
        return running.entrySet().stream()
                .filter(entry -> entry.getValue() == future)
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse("unknown locale");
    }

    private static LocaleTask taskFor(TranslationContext context, String locale, PromptBuilder prompts) {
        TranslationRequest request = context.request();
        Map<String, SourceText> pending = context.pendingTexts(locale);
        Map<String, String> sources = new LinkedHashMap<>();
        pending.forEach((key, text) -> sources.put(key, text.text()));

        List<Map<String, SourceText>> chunks = new ArrayList<>();
        for (List<String> chunk : context.chunks()) {
            Map<String, SourceText> chunkTexts = new LinkedHashMap<>();
            chunk.stream().filter(pending::containsKey).forEach(key -> chunkTexts.put(key, pending.get(key)));
            if (!chunkTexts.isEmpty()) {
                chunks.add(chunkTexts);
            }
        }
        List<String> rules = new ArrayList<>(StylePlugin.rulesFor(context, locale));
        rules.addAll(GlossaryPlugin.rulesFor(context, locale));
        TranslationListener listener = context.listener();
        Function<ProviderConfig, List<BackendRequest>> requests = provider -> {
            List<BackendRequest> calls = new ArrayList<>();
            for (Map<String, SourceText> chunkTexts : chunks) {
                Prompt prompt = prompts.build(request.sourceLocale(), locale, chunkTexts, rules,
                        request.metadata(TranslationRequest.METADATA_FILENAME), request.keyPrefix());
                listener.onPromptGenerated(TranslationListener.PromptType.SYSTEM, prompt.system());
                listener.onPromptGenerated(TranslationListener.PromptType.USER, prompt.user());
                Map<String, String> entries = new LinkedHashMap<>();
                chunkTexts.forEach((key, text) -> entries.put(key, text.text()));
                calls.add(new BackendRequest(provider, prompt.system(), prompt.user(), locale, entries));
            }
            return calls;
        };
        return new LocaleTask(locale, sources, request.keyPrefix(), requests, context.usage(), listener);
    }

    private TranslationService translationService(PluginConfig config) {
        RetryPolicy policy = new RetryPolicy(
                config.getInt("retry_attempts", RetryPolicy.DEFAULT.maxAttempts()),
                Duration.ofMillis(config.getInt("initial_backoff_millis", (int) RetryPolicy.DEFAULT.initialBackoff().toMillis())),
                Duration.ofMillis(config.getInt("max_backoff_millis", (int) RetryPolicy.DEFAULT.maxBackoff().toMillis())),
                config.getDouble("retry_jitter_factor", RetryPolicy.DEFAULT.jitterFactor()));
        Duration timeout = Duration.ofSeconds(config.getInt("timeout_seconds", 30));
        return new TranslationService(policy, timeout, executor);
    }

    static ConsensusSettings settingsFrom(PluginConfig config, List<String> warnings) {
        double temperature = config.getDouble("temperature", 0.3);
        List<ProviderConfig> providers = new ArrayList<>();
        Object configured = config.get("providers").orElse(List.of());
        List<?> entries = configured instanceof List<?> list ? list : config.getStrings("providers");
        for (Object entry : entries) {
            parseProvider(entry, temperature).ifPresentOrElse(providers::add,
                    () -> {
                        LOGGER.warn("Skipping provider {} due to missing configuration", entry);
                        warnings.add("Skipping provider '%s' due to missing configuration".formatted(entry));
                    });
        }
        if (providers.isEmpty()) {
            throw new TranslationException("No providers configured for multi-provider translation");
        }
        ProviderConfig judge = parseProvider(config.getString("judge", ConsensusSettings.DEFAULT_JUDGE.label()),
                config.getDouble("judge_temperature", ConsensusSettings.DEFAULT_JUDGE.temperature()))
                .orElse(ConsensusSettings.DEFAULT_JUDGE);
        return new ConsensusSettings(providers, judge,
                ExecutionMode.from(config.getString("execution_mode", "parallel")),
                config.getInt("consensus_threshold", ConsensusSettings.DEFAULT_CONSENSUS_THRESHOLD),
                config.getBoolean("fallback_on_failure", true));
    }

    private static Optional<ProviderConfig> parseProvider(Object entry, double defaultTemperature) {
        if (entry instanceof Map<?, ?> map) {
            Object vendor = map.containsKey("vendor") ? map.get("vendor") : map.get("provider");
            Object model = map.get("model");
            if (vendor == null || model == null || vendor.toString().isBlank() || model.toString().isBlank()) {
                return Optional.empty();
            }
            double temperature = map.get("temperature") instanceof Number number ? number.doubleValue() : defaultTemperature;
            int maxTokens = map.get("max_tokens") instanceof Number number ? number.intValue() : ProviderConfig.DEFAULT_MAX_TOKENS;
            return Optional.of(new ProviderConfig(vendor.toString(), model.toString(), temperature, maxTokens, Map.of()));
        }
        if (entry instanceof ProviderConfig provider) {
            return Optional.of(provider);
        }
        String spec = entry == null ? "" : entry.toString().trim();
        int separator = spec.indexOf(':');
        if (separator <= 0 || separator == spec.length() - 1) {
            return Optional.empty();
        }
        return Optional.of(ProviderConfig.parse(spec, defaultTemperature));
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
