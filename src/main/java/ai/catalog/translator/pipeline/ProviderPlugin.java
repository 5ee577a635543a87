package ai.catalog.translator.pipeline;

import ai.catalog.translator.plugin.Plugin;
import java.util.List;

/**
 * Offers named services. The pipeline runs a provider during the stages listed in {@link #when()},
 * or whenever the request option {@code services} names one of its services, and exposes every
 * service through {@link TranslationPipeline#executeService(String, TranslationContext)}.
 */
public interface ProviderPlugin extends Plugin {

    List<String> provides();

    default List<String> when() {
        return List.of(PipelineStages.TRANSLATION);
    }

    Object execute(TranslationContext context);
}
