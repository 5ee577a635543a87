package ai.catalog.translator.plugins;

import ai.catalog.translator.model.TokenUsage;
import ai.catalog.translator.pipeline.ContextView;
import ai.catalog.translator.pipeline.ObserverPlugin;
import ai.catalog.translator.pipeline.PipelineEvents;
import ai.catalog.translator.pipeline.PipelineStages;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs run and stage progress.
 */
public class ProgressLoggingObserver implements ObserverPlugin {

    public static final String NAME = "progress_logger";

    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressLoggingObserver.class);

    private final List<String> stages;

    public ProgressLoggingObserver() {
        this(PipelineStages.common());
    }

    public ProgressLoggingObserver(List<String> stages) {
        this.stages = List.copyOf(Objects.requireNonNull(stages, "stages"));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Map<String, Consumer<ContextView>> subscriptions() {
        Map<String, Consumer<ContextView>> subscriptions = new LinkedHashMap<>();
        subscriptions.put(PipelineEvents.TRANSLATION_STARTED, this::started);
        for (String stage : stages) {
            subscriptions.put(PipelineEvents.stageCompleted(stage), view ->
                    LOGGER.debug("Stage {} done after {} ms", stage, view.elapsed().toMillis()));
        }
        subscriptions.put(PipelineEvents.TRANSLATION_COMPLETED, this::completed);
        subscriptions.put(PipelineEvents.TRANSLATION_FAILED, this::failed);
        return subscriptions;
    }

    private void started(ContextView view) {
        LOGGER.info("Started: {} key(s), {} -> {}", view.request().texts().size(),
                view.request().sourceLocale(), String.join(", ", view.request().targetLocales()));
    }

    private void completed(ContextView view) {
        int translated = view.translations().values().stream().mapToInt(Map::size).sum();
        TokenUsage usage = view.tokenUsage();
        LOGGER.info("Completed in {} ms: {} translation(s), {} warning(s), tokens in={} out={} total={}",
                view.elapsed().toMillis(), translated, view.warnings().size(),
                usage.inputTokens(), usage.outputTokens(), usage.totalTokens());
        view.warnings().forEach(warning -> LOGGER.warn("  {}", warning));
    }

    private void failed(ContextView view) {
        LOGGER.error("Failed during stage {} after {} ms: {}", view.currentStage(), view.elapsed().toMillis(),
                String.join("; ", view.errors()));
    }
}
