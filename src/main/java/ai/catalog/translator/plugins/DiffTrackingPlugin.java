package ai.catalog.translator.plugins;

import ai.catalog.translator.catalog.CatalogSource;
import ai.catalog.translator.catalog.CatalogTransformer;
import ai.catalog.translator.model.SourceText;
import ai.catalog.translator.pipeline.MiddlewarePlugin;
import ai.catalog.translator.pipeline.Next;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.TranslationContext;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves keys that already have a translation in the target catalog from that catalog instead of
 * sending them to a backend.
 *
 * <p>Cached keys are recorded per locale. A key cached for every target locale is also removed
 * from the working texts; when nothing is left the stage stops without calling onward.
 */
public class DiffTrackingPlugin implements MiddlewarePlugin {

    public static final String NAME = "diff_tracking";
    public static final String CACHED_COUNT = "cached";

    private static final Logger LOGGER = LoggerFactory.getLogger(DiffTrackingPlugin.class);

    private final CatalogSource catalogs;

    public DiffTrackingPlugin(CatalogSource catalogs) {
        this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 95;
    }

    @Override
    public List<String> stages() {
        return List.of(PipelineStages.DIFF_DETECTION);
    }

    @Override
    public void handle(TranslationContext context, Next next) {
        Map<String, SourceText> texts = context.texts();
        Map<String, SourceText> needed = new LinkedHashMap<>();
        int cached = 0;
        for (String locale : context.request().targetLocales()) {
            Optional<CatalogTransformer> catalog = catalogs.open(locale);
            Map<String, String> existing = catalog.map(CatalogTransformer::flatten).orElse(Map.of());
            int cachedForLocale = 0;
            for (Map.Entry<String, SourceText> entry : texts.entrySet()) {
                String key = entry.getKey();
                if (catalog.isPresent() && catalog.get().isTranslated(key) && existing.containsKey(key)) {
                    context.markCached(locale, key, existing.get(key));
                    cachedForLocale++;
                } else {
                    needed.put(key, entry.getValue());
                }
            }
            cached += cachedForLocale;
            LOGGER.info("{}: {} of {} key(s) already translated", locale, cachedForLocale, texts.size());
        }
        context.pluginData(NAME).put(CACHED_COUNT, cached);

        if (needed.isEmpty()) {
            context.replaceTexts(Map.of());
            LOGGER.info("All keys already translated for {}; skipping translation", context.request().targetLocales());
            return;
        }
        Map<String, SourceText> ordered = new LinkedHashMap<>();
        texts.forEach((key, text) -> {
            if (needed.containsKey(key)) {
                ordered.put(key, text);
            }
        });
        context.replaceTexts(ordered);
        next.proceed(context);
    }
}
