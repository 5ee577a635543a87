package ai.catalog.translator.consensus;

import ai.catalog.translator.model.ProviderConfig;
import ai.catalog.translator.model.TokenUsage;
import ai.catalog.translator.translate.BackendClient;
import ai.catalog.translator.translate.BackendListener;
import ai.catalog.translator.translate.BackendRequest;
import ai.catalog.translator.translate.BackendResponse;
import ai.catalog.translator.translate.BatchResult;
import ai.catalog.translator.translate.ProviderException;
import ai.catalog.translator.translate.TokenUsageAccumulator;
import ai.catalog.translator.translate.TranslationException;
import ai.catalog.translator.translate.TranslationService;
import ai.catalog.translator.translate.UnconfiguredProviderException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Translates one locale with every configured provider and reconciles their candidates.
 *
 * <p>In parallel mode each provider runs as its own task and fills its own slot; slots are merged
 * on the calling thread once every task has finished. Keys with more than one distinct candidate
 * are put to the judge; when its reply cannot be used, or the judge call fails or outlasts the
 * attempt timeout of the {@link TranslationService}, the {@link FallbackSelector} decides.
 */
public class ConsensusEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConsensusEngine.class);
    private static final String FIXED_TEMPERATURE_MODEL_PREFIX = "gpt-5";
    private static final double FIXED_TEMPERATURE = 1.0;

    private final ConsensusSettings settings;
    private final Function<ProviderConfig, BackendClient> clients;
    private final TranslationService translationService;
    private final FallbackSelector fallbackSelector;
    private final ExecutorService executor;

    /**
     * @param clients  backend lookup; may throw {@link UnconfiguredProviderException}
     * @param executor runs provider tasks in parallel mode
     */
    public ConsensusEngine(ConsensusSettings settings,
                           Function<ProviderConfig, BackendClient> clients,
                           TranslationService translationService,
                           FallbackSelector fallbackSelector,
                           ExecutorService executor) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clients = Objects.requireNonNull(clients, "clients");
        this.translationService = Objects.requireNonNull(translationService, "translationService");
        this.fallbackSelector = fallbackSelector == null ? new LongestCandidateSelector() : fallbackSelector;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public ConsensusSettings settings() {
        return settings;
    }

    /**
     * Some models only accept their default sampling temperature.
     */
    public static ProviderConfig applyOverrides(ProviderConfig provider) {
        String model = provider.model().toLowerCase(Locale.ROOT);
        if (model.startsWith(FIXED_TEMPERATURE_MODEL_PREFIX) && provider.temperature() != FIXED_TEMPERATURE) {
            LOGGER.info("Fixed temperature to {} for {} model", FIXED_TEMPERATURE, provider.model());
            return provider.withTemperature(FIXED_TEMPERATURE);
        }
        return provider;
    }

    /**
     * @throws LocaleFailedException when no provider produced a usable translation, or a provider
     *         failed while fallback on failure is disabled
     * @throws UnconfiguredProviderException when a provider or the judge is not configured
     */
    public LocaleResolution resolve(LocaleTask task) {
        Objects.requireNonNull(task, "task");
        String locale = task.locale();
        LocaleState state = transition(locale, LocaleState.PENDING, LocaleState.RUNNING);
        if (task.sources().isEmpty()) {
            return new LocaleResolution(locale, Map.of(), Map.of(), Set.of(), List.of(),
                    transition(locale, state, LocaleState.RESOLVED));
        }

        List<ProviderConfig> providers = new ArrayList<>();
        settings.providers().forEach(provider -> providers.add(applyOverrides(provider)));
        List<ProviderOutcome> outcomes = settings.executionMode() == ExecutionMode.PARALLEL && providers.size() > 1
                ? runParallel(providers, task)
                : runSequential(providers, task);

        List<String> warnings = new ArrayList<>();
        TranslationException lastFailure = null;
        int successful = 0;
        for (ProviderOutcome outcome : outcomes) {
            warnings.addAll(outcome.warnings());
            if (outcome.failure() != null) {
                lastFailure = outcome.failure();
                if (!settings.fallbackOnFailure()) {
                    transition(locale, state, LocaleState.FAILED);
                    throw new LocaleFailedException(locale, outcome.failure().getMessage(), outcome.failure());
                }
            }
            if (!outcome.translations().isEmpty()) {
                successful++;
            }
        }
        if (successful == 0) {
            transition(locale, state, LocaleState.FAILED);
            throw new LocaleFailedException(locale, "no provider returned a usable translation", lastFailure);
        }

        state = transition(locale, state, successful > 1 ? LocaleState.CONSENSUS : LocaleState.DIRECT);
        Map<String, String> chosen = new LinkedHashMap<>();
        Map<String, String> chosenProviders = new LinkedHashMap<>();
        Set<String> unresolved = new LinkedHashSet<>();
        for (Map.Entry<String, String> source : task.sources().entrySet()) {
            String key = source.getKey();
            List<Candidate> candidates = candidatesFor(key, outcomes);
            if (candidates.isEmpty()) {
                unresolved.add(key);
                continue;
            }
            Candidate winner = candidates.size() == 1
                    ? candidates.get(0)
                    : judge(task, key, source.getValue(), candidates, warnings);
            chosen.put(key, winner.text());
            chosenProviders.put(key, winner.provider());
        }
        return new LocaleResolution(locale, chosen, chosenProviders, unresolved, warnings,
                transition(locale, state, LocaleState.RESOLVED));
    }

    private List<ProviderOutcome> runSequential(List<ProviderConfig> providers, LocaleTask task) {
        List<ProviderOutcome> outcomes = new ArrayList<>();
        for (ProviderConfig provider : providers) {
            ProviderOutcome outcome = runProvider(provider, task);
            outcomes.add(outcome);
            if (!outcome.translations().isEmpty() && (providers.size() == 1 || !settings.needsConsensus())) {
                break;
            }
        }
        return outcomes;
    }

    private List<ProviderOutcome> runParallel(List<ProviderConfig> providers, LocaleTask task) {
        CompletionService<ProviderOutcome> completion = new ExecutorCompletionService<>(executor);
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        List<Future<ProviderOutcome>> futures = new ArrayList<>();
        ProviderOutcome[] slots = new ProviderOutcome[providers.size()];
        for (int index = 0; index < providers.size(); index++) {
            int slot = index;
            ProviderConfig provider = providers.get(index);
            futures.add(completion.submit(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return runProvider(provider, task).inSlot(slot);
                } finally {
                    MDC.clear();
                }
            }));
        }
        try {
            for (int received = 0; received < providers.size(); received++) {
                ProviderOutcome outcome = completion.take().get();
                slots[outcome.slot()] = outcome;
                LOGGER.debug("Provider {} finished for {}", outcome.provider(), task.locale());
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new LocaleFailedException(task.locale(), "interrupted while waiting for providers", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new LocaleFailedException(task.locale(), cause.getMessage(), cause);
        } finally {
            futures.forEach(future -> future.cancel(true));
        }
        return List.of(slots);
    }

    private ProviderOutcome runProvider(ProviderConfig provider, LocaleTask task) {
        String label = provider.label();
        BackendClient client = clients.apply(provider);
        Map<String, String> translations = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        TranslationException failure = null;
        for (BackendRequest request : task.requests().apply(provider)) {
            try {
                BatchResult batch = translationService.translate(client, request, request.entries().keySet(),
                        task.keyPrefix(), task.usage(), task.listener());
                translations.putAll(batch.translations());
                warnings.addAll(batch.warnings());
            } catch (UnconfiguredProviderException ex) {
                throw ex;
            } catch (TranslationException ex) {
                failure = ex;
                warnings.add("Provider %s failed for %s: %s".formatted(label, task.locale(), ex.getMessage()));
                LOGGER.warn("Provider {} failed for {}: {}", label, task.locale(), ex.getMessage());
            } catch (RuntimeException ex) {
                failure = new ProviderException(label, ex.getMessage(), ex);
                warnings.add("Provider %s failed for %s: %s".formatted(label, task.locale(), ex.getMessage()));
                LOGGER.warn("Provider {} failed for {}: {}", label, task.locale(), ex.getMessage(), ex);
            }
        }
        return new ProviderOutcome(label, translations, warnings, failure, 0);
    }

    private static List<Candidate> candidatesFor(String key, List<ProviderOutcome> outcomes) {
        List<Candidate> candidates = new ArrayList<>();
        Set<String> seenTexts = new LinkedHashSet<>();
        for (ProviderOutcome outcome : outcomes) {
            String text = outcome.translations().get(key);
            if (text != null && seenTexts.add(text)) {
                candidates.add(new Candidate(outcome.provider(), text));
            }
        }
        return candidates;
    }

    private Candidate judge(LocaleTask task, String key, String source, List<Candidate> candidates, List<String> warnings) {
        ProviderConfig judge = settings.judge();
        String prompt = JudgePrompt.format(source, task.locale(), candidates);
        try {
            BackendClient client = clients.apply(judge);
            TokenUsageAccumulator judgeUsage = task.usage().child();
            AtomicBoolean usageReported = new AtomicBoolean();
            BackendResponse response = translationService.send(client, new BackendRequest(judge, "", prompt, task.locale(), Map.of()), new BackendListener() {
                @Override
                public void onUsage(TokenUsage delta) {
                    usageReported.set(true);
                    judgeUsage.add(delta);
                }
            });
            if (!usageReported.get()) {
                judgeUsage.add(response.usage());
            }
            judgeUsage.reportFinal().ifPresent(total -> task.listener().onTokenUsage(judge.label(), total));
            Candidate winner = candidates.get(JudgePrompt.parseSelection(response.text(), candidates.size()));
            LOGGER.debug("Judge picked {} for key {}", winner.provider(), key);
            return winner;
        } catch (UnconfiguredProviderException ex) {
            throw ex;
        } catch (JudgeParseException ex) {
            warnings.add("Judge reply for key '%s' (%s) could not be used: %s; falling back".formatted(key, task.locale(), ex.getMessage()));
        } catch (RuntimeException ex) {
            LOGGER.warn("Judge {} failed for key {}: {}", judge.label(), key, ex.getMessage());
            warnings.add("Judge failed for key '%s' (%s): %s; falling back".formatted(key, task.locale(), ex.getMessage()));
        }
        return fallbackSelector.select(key, candidates);
    }

    private static LocaleState transition(String locale, LocaleState from, LocaleState to) {
        LOGGER.debug("Locale {}: {} -> {}", locale, from, to);
        return to;
    }

    private record ProviderOutcome(String provider,
                                   Map<String, String> translations,
                                   List<String> warnings,
                                   TranslationException failure,
                                   int slot) {

        ProviderOutcome inSlot(int newSlot) {
            return new ProviderOutcome(provider, translations, warnings, failure, newSlot);
        }
    }
}
