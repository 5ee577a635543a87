package ai.catalog.translator.pipeline;

import ai.catalog.translator.model.TokenUsage;
import ai.catalog.translator.model.TranslationOutput;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.model.TranslationResult;
import ai.catalog.translator.plugin.Plugin;
import ai.catalog.translator.plugin.PluginRegistry;
import ai.catalog.translator.translate.TranslationListener;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Runs translation requests through an ordered list of stages.
 *
 * <p>Within a stage every active middleware wraps the rest of the chain, highest priority
 * outermost. When the innermost middleware calls onward, the stage's providers and handlers run.
 * Every translated key/locale pair is published as one {@link TranslationOutput}. Providers may
 * publish a pair as soon as its locale is done; the OUTPUT stage ends by publishing the rest.
 *
 * <p>A pipeline is immutable once built and may serve concurrent requests; all per-request state
 * lives in the {@link TranslationContext}.
 */
public class TranslationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationPipeline.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    public static final String OPTION_SERVICES = "services";
    public static final String MDC_REQUEST = "request";
    public static final String MDC_TENANT = "tenant";

    private final List<String> stages;
    private final List<Plugin> order;
    private final Map<String, List<MiddlewarePlugin>> middleware;
    private final Map<String, List<StageHandler>> handlers;
    private final List<ProviderPlugin> providers;
    private final List<ObserverPlugin> observers;
    private final Map<String, Function<TranslationContext, Object>> services;
    private final Map<String, List<Consumer<ContextView>>> eventHandlers;
    private final List<Terminator> terminators;
    private final PluginRegistry registry;

    private TranslationPipeline(Builder builder) {
        this.registry = builder.registry;
        this.stages = List.copyOf(builder.stages);
        this.order = registry.resolveOrder();
        registry.seal();

        Map<String, List<MiddlewarePlugin>> middlewareByStage = new LinkedHashMap<>();
        List<ProviderPlugin> providerPlugins = new ArrayList<>();
        List<ObserverPlugin> observerPlugins = new ArrayList<>();
        Map<String, Function<TranslationContext, Object>> serviceTable = new LinkedHashMap<>(builder.services);
        for (Plugin plugin : order) {
            if (plugin instanceof MiddlewarePlugin middlewarePlugin) {
                for (String stage : middlewarePlugin.stages()) {
                    if (!stages.contains(stage)) {
                        LOGGER.warn("Plugin {} binds to unknown stage {}; ignoring", plugin.name(), stage);
                        continue;
                    }
                    middlewareByStage.computeIfAbsent(stage, key -> new ArrayList<>()).add(middlewarePlugin);
                }
            }
            if (plugin instanceof ProviderPlugin providerPlugin) {
                providerPlugins.add(providerPlugin);
                for (String service : providerPlugin.provides()) {
                    serviceTable.putIfAbsent(service, providerPlugin::execute);
                }
            }
            if (plugin instanceof ObserverPlugin observerPlugin) {
                observerPlugins.add(observerPlugin);
            }
        }
        // List.sort is stable, so equal priorities keep dependency order.
        Comparator<Plugin> byPriority = Comparator.comparingInt(Plugin::priority).reversed();
        middlewareByStage.values().forEach(list -> list.sort(byPriority));
        providerPlugins.sort(byPriority);

        this.middleware = freeze(middlewareByStage);
        this.providers = List.copyOf(providerPlugins);
        this.observers = List.copyOf(observerPlugins);
        this.services = Collections.unmodifiableMap(serviceTable);
        this.handlers = freeze(builder.handlers);
        this.eventHandlers = freeze(builder.eventHandlers);
        this.terminators = List.copyOf(builder.terminators);
        LOGGER.debug("Pipeline stages {} with plugins {}", stages, order.stream().map(Plugin::name).collect(Collectors.toList()));
    }

    public static Builder builder(PluginRegistry registry) {
        return new Builder(registry);
    }

    public List<String> stages() {
        return stages;
    }

    /**
     * Plugins in dependency order.
     */
    public List<Plugin> plugins() {
        return order;
    }

    public PluginRegistry registry() {
        return registry;
    }

    /**
     * Runs the request to completion and returns its final state.
     */
    public TranslationResult translate(TranslationRequest request) {
        return translate(request, TranslationListener.NO_OP);
    }

    public TranslationResult translate(TranslationRequest request, TranslationListener listener) {
        try (TranslationStream stream = process(request, listener)) {
            while (stream.hasNext()) {
                stream.next();
            }
            return stream.result();
        }
    }

    public TranslationStream process(TranslationRequest request) {
        return process(request, TranslationListener.NO_OP);
    }

    /**
     * Starts the request on a background thread and returns the sequence of its outputs.
     */
    public TranslationStream process(TranslationRequest request, TranslationListener listener) {
        Objects.requireNonNull(request, "request");
        TranslationContext context = new TranslationContext(request, registry, listener);
        TranslationStream stream = new TranslationStream();
        context.setOutputSink(stream::publish);
        Map<String, String> callerMdc = MDC.getCopyOfContextMap();
        Thread worker = new Thread(() -> run(context, stream, callerMdc), "translation-pipeline-" + THREAD_COUNTER.incrementAndGet());
        worker.setDaemon(true);
        stream.attach(worker);
        worker.start();
        return stream;
    }

    /**
     * Invokes a named service directly, outside of any stage.
     *
     * @throws ServiceNotFoundException when no provider or registered service has the name
     */
    public Object executeService(String name, TranslationContext context) {
        Function<TranslationContext, Object> service = services.get(name);
        if (service == null) {
            throw new ServiceNotFoundException(name);
        }
        return service.apply(context);
    }

    public boolean hasService(String name) {
        return services.containsKey(name);
    }

    private void run(TranslationContext context, TranslationStream stream, Map<String, String> callerMdc) {
        if (callerMdc != null) {
            MDC.setContextMap(callerMdc);
        }
        TranslationRequest request = context.request();
        MDC.put(MDC_REQUEST, request.requestId());
        request.tenantId().ifPresent(tenant -> MDC.put(MDC_TENANT, tenant));
        Throwable failure = null;
        try {
            LOGGER.info("Translating {} key(s) from {} to {}", request.texts().size(), request.sourceLocale(), request.targetLocales());
            context.listener().onStarted(request);
            emit(PipelineEvents.TRANSLATION_STARTED, context);
            for (String stage : stages) {
                runStage(stage, context);
            }
            context.complete();
            emit(PipelineEvents.TRANSLATION_COMPLETED, context);
            LOGGER.info("Translation finished in {} ms with {} warning(s)", context.elapsed().toMillis(), context.warnings().size());
        } catch (RuntimeException | Error ex) {
            failure = ex;
            context.addError(ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage());
            context.complete();
            LOGGER.error("Translation failed during stage {}: {}", context.currentStage(), ex.getMessage(), ex);
            emit(PipelineEvents.TRANSLATION_FAILED, context);
        } finally {
            runTerminators(context);
            if (failure == null) {
                stream.complete(context.snapshot());
            } else {
                stream.fail(failure);
            }
            MDC.clear();
        }
    }

    private void runStage(String stage, TranslationContext context) {
        if (Thread.currentThread().isInterrupted()) {
            throw new PipelineInterruptedException(stage);
        }
        context.setCurrentStage(stage);
        LOGGER.debug("Stage {} started", stage);
        emit(PipelineEvents.stageStarted(stage), context);
        List<MiddlewarePlugin> chain = middleware.getOrDefault(stage, List.of()).stream()
                .filter(plugin -> isActive(plugin, context))
                .collect(Collectors.toList());
        invoke(chain, 0, stage, context);
        emit(PipelineEvents.stageCompleted(stage), context);
        LOGGER.debug("Stage {} completed", stage);
    }

    private void invoke(List<MiddlewarePlugin> chain, int index, String stage, TranslationContext context) {
        if (index == chain.size()) {
            runHandlers(stage, context);
            return;
        }
        chain.get(index).handle(context, next -> invoke(chain, index + 1, stage, next));
    }

    private void runHandlers(String stage, TranslationContext context) {
        Set<String> requestedServices = requestedServices(context);
        for (ProviderPlugin provider : providers) {
            if (shouldProvide(provider, stage, requestedServices) && context.isEnabledForTenant(provider.name())) {
                LOGGER.debug("Running provider {} in stage {}", provider.name(), stage);
                provider.execute(context);
            }
        }
        for (StageHandler handler : handlers.getOrDefault(stage, List.of())) {
            handler.handle(context);
        }
        if (PipelineStages.OUTPUT.equals(stage)) {
            publishOutputs(context);
        }
    }

    private static boolean shouldProvide(ProviderPlugin provider, String stage, Set<String> requestedServices) {
        if (provider.when().contains(stage)) {
            return true;
        }
        return PipelineStages.TRANSLATION.equals(stage)
                && provider.provides().stream().anyMatch(requestedServices::contains);
    }

    private static Set<String> requestedServices(TranslationContext context) {
        return context.request().option(OPTION_SERVICES)
                .map(value -> value instanceof Iterable<?> iterable ? join(iterable) : value.toString())
                .map(value -> Arrays.stream(value.split(","))
                        .map(String::trim)
                        .filter(service -> !service.isEmpty())
                        .collect(Collectors.toSet()))
                .orElse(Set.of());
    }

    private static String join(Iterable<?> values) {
        List<String> parts = new ArrayList<>();
        values.forEach(value -> parts.add(String.valueOf(value)));
        return String.join(",", parts);
    }

    private void publishOutputs(TranslationContext context) {
        TranslationRequest request = context.request();
        for (String locale : request.targetLocales()) {
            for (String key : request.texts().keySet()) {
                if (context.isPublished(locale, key)) {
                    continue;
                }
                if (context.translation(locale, key).isEmpty()) {
                    if (!context.isUnresolved(locale, key)) {
                        context.markUnresolved(locale, key, "Key '%s' was not translated for %s".formatted(key, locale));
                    }
                    continue;
                }
                context.publish(locale, key);
            }
        }
    }

    private boolean isActive(MiddlewarePlugin plugin, TranslationContext context) {
        if (!context.isEnabledForTenant(plugin.name())) {
            LOGGER.debug("Plugin {} disabled for tenant {}", plugin.name(), context.request().tenantId().orElse(""));
            return false;
        }
        return !context.request().flag("skip_" + plugin.name());
    }

    private void emit(String event, TranslationContext context) {
        ContextView view = new ReadOnlyView(context);
        for (ObserverPlugin observer : observers) {
            if (context.request().flag("disable_" + observer.name()) || !context.isEnabledForTenant(observer.name())) {
                continue;
            }
            Consumer<ContextView> handler = observer.subscriptions().get(event);
            if (handler != null) {
                notify(observer.name(), event, handler, view);
            }
        }
        for (Consumer<ContextView> handler : eventHandlers.getOrDefault(event, List.of())) {
            notify("listener", event, handler, view);
        }
    }

    private static void notify(String source, String event, Consumer<ContextView> handler, ContextView view) {
        try {
            handler.accept(view);
        } catch (RuntimeException ex) {
            LOGGER.warn("Observer {} failed on {}: {}", source, event, ex.getMessage(), ex);
        }
    }

    private void runTerminators(TranslationContext context) {
        TranslationResult snapshot = context.snapshot();
        for (Plugin plugin : order) {
            if (plugin instanceof MiddlewarePlugin middlewarePlugin && context.isEnabledForTenant(plugin.name())) {
                terminate(plugin.name(), () -> middlewarePlugin.terminate(context, snapshot));
            }
        }
        for (Terminator terminator : terminators) {
            terminate("terminator", () -> terminator.terminate(context, snapshot));
        }
    }

    private static void terminate(String source, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException ex) {
            LOGGER.warn("Terminator {} failed: {}", source, ex.getMessage(), ex);
        }
    }

    private static <T> Map<String, List<T>> freeze(Map<String, List<T>> source) {
        Map<String, List<T>> copy = new LinkedHashMap<>();
        source.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Collects stages, handlers, services and listeners before the plugin order is resolved.
     */
    public static final class Builder {

        private final PluginRegistry registry;
        private final List<String> stages = new ArrayList<>(PipelineStages.common());
        private final Map<String, List<StageHandler>> handlers = new LinkedHashMap<>();
        private final Map<String, Function<TranslationContext, Object>> services = new LinkedHashMap<>();
        private final Map<String, List<Consumer<ContextView>>> eventHandlers = new LinkedHashMap<>();
        private final List<Terminator> terminators = new ArrayList<>();

        private Builder(PluginRegistry registry) {
            this.registry = Objects.requireNonNull(registry, "registry");
        }

        /**
         * Replaces the stage list. The essential stages are appended when missing.
         */
        public Builder stages(List<String> names) {
            Objects.requireNonNull(names, "names");
            stages.clear();
            for (String name : names) {
                addStage(name);
            }
            for (String essential : PipelineStages.essentials()) {
                if (!stages.contains(essential)) {
                    stages.add(essential);
                }
            }
            return this;
        }

        /**
         * Inserts a custom stage right after an existing one.
         */
        public Builder insertStageAfter(String existing, String name) {
            int index = stages.indexOf(existing);
            if (index < 0) {
                throw new IllegalArgumentException("Unknown stage '" + existing + "'");
            }
            if (stages.contains(name)) {
                throw new IllegalArgumentException("Stage '" + name + "' already exists");
            }
            stages.add(index + 1, requireStageName(name));
            return this;
        }

        public Builder handler(String stage, StageHandler handler) {
            Objects.requireNonNull(handler, "handler");
            if (!stages.contains(stage)) {
                throw new IllegalArgumentException("Unknown stage '" + stage + "'");
            }
            handlers.computeIfAbsent(stage, key -> new ArrayList<>()).add(handler);
            return this;
        }

        public Builder service(String name, Function<TranslationContext, Object> service) {
            services.put(requireStageName(name), Objects.requireNonNull(service, "service"));
            return this;
        }

        public Builder on(String event, Consumer<ContextView> handler) {
            eventHandlers.computeIfAbsent(Objects.requireNonNull(event, "event"), key -> new ArrayList<>())
                    .add(Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder terminator(Terminator terminator) {
            terminators.add(Objects.requireNonNull(terminator, "terminator"));
            return this;
        }

        /**
         * Resolves the plugin order and seals the registry.
         *
         * @throws ai.catalog.translator.plugin.CircularDependencyException when plugin
         *         dependencies form a cycle
         */
        public TranslationPipeline build() {
            return new TranslationPipeline(this);
        }

        private void addStage(String name) {
            if (!stages.contains(requireStageName(name))) {
                stages.add(name);
            }
        }

        private static String requireStageName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be blank");
            }
            return name;
        }
    }

    /**
     * Keeps observers from casting the view back to the mutable context.
     */
    private static final class ReadOnlyView implements ContextView {

        private final ContextView context;

        ReadOnlyView(ContextView context) {
            this.context = context;
        }

        @Override
        public TranslationRequest request() {
            return context.request();
        }

        @Override
        public String currentStage() {
            return context.currentStage();
        }

        @Override
        public Map<String, Map<String, String>> translations() {
            return context.translations();
        }

        @Override
        public List<String> warnings() {
            return context.warnings();
        }

        @Override
        public List<String> errors() {
            return context.errors();
        }

        @Override
        public TokenUsage tokenUsage() {
            return context.tokenUsage();
        }

        @Override
        public Duration elapsed() {
            return context.elapsed();
        }

        @Override
        public Optional<Object> pluginValue(String pluginName, String key) {
            return context.pluginValue(pluginName, key);
        }
    }
}
