package ai.catalog.translator.pipeline;

import ai.catalog.translator.model.TokenUsage;
import ai.catalog.translator.model.TranslationRequest;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of a {@link TranslationContext}, handed to observers.
 */
public interface ContextView {

    TranslationRequest request();

    String currentStage();

    Map<String, Map<String, String>> translations();

    List<String> warnings();

    List<String> errors();

    TokenUsage tokenUsage();

    Duration elapsed();

    Optional<Object> pluginValue(String pluginName, String key);
}
