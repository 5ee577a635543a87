package ai.catalog.translator.plugins;

import ai.catalog.translator.catalog.CatalogSource;
import ai.catalog.translator.catalog.CatalogTransformer;
import ai.catalog.translator.model.SourceText;
import ai.catalog.translator.pipeline.MiddlewarePlugin;
import ai.catalog.translator.pipeline.Next;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.TranslationContext;
import ai.catalog.translator.plugin.PluginConfig;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Attaches approved translations from other locales' catalogs to the working texts, so the prompt
 * shows how a key already reads elsewhere.
 *
 * <p>Reference locales are the {@code reference_locales} option, or every target locale when it
 * is empty. A reference already on a text is kept. At most {@code max_context_items} texts receive
 * references; short texts (UI labels, buttons) are served first.
 */
public class TranslationContextPlugin implements MiddlewarePlugin {

    public static final String NAME = "translation_context";
    public static final String REFERENCED_KEYS = "referenced_keys";

    static final int DEFAULT_MAX_CONTEXT_ITEMS = 100;
    private static final int SHORT_TEXT_LENGTH = 50;

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationContextPlugin.class);

    private final CatalogSource catalogs;

    public TranslationContextPlugin(CatalogSource catalogs) {
        this.catalogs = Objects.requireNonNull(catalogs, "catalogs");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 80;
    }

    @Override
    public List<String> stages() {
        return List.of(PipelineStages.PREPARATION);
    }

    @Override
    public Map<String, Object> defaultConfig() {
        return Map.of("max_context_items", DEFAULT_MAX_CONTEXT_ITEMS);
    }

    @Override
    public void handle(TranslationContext context, Next next) {
        PluginConfig config = context.configFor(NAME);
        Map<String, Map<String, String>> approved = approvedTranslations(context, config);
        if (!approved.isEmpty()) {
            attach(context, approved, Math.max(0, config.getInt("max_context_items", DEFAULT_MAX_CONTEXT_ITEMS)));
        }
        next.proceed(context);
    }

    private Map<String, Map<String, String>> approvedTranslations(TranslationContext context, PluginConfig config) {
        Set<String> locales = new LinkedHashSet<>(config.getStrings("reference_locales"));
        if (locales.isEmpty()) {
            locales.addAll(context.request().targetLocales());
        }
        locales.remove(context.request().sourceLocale());

        Map<String, Map<String, String>> approved = new LinkedHashMap<>();
        for (String locale : locales) {
            Optional<CatalogTransformer> catalog = catalogs.open(locale);
            if (catalog.isEmpty()) {
                continue;
            }
            Map<String, String> entries = new LinkedHashMap<>();
            catalog.get().flatten().forEach((key, value) -> {
                if (catalog.get().isTranslated(key) && !value.isBlank()) {
                    entries.put(key, value);
                }
            });
            if (!entries.isEmpty()) {
                approved.put(locale, entries);
            }
        }
        return approved;
    }

    private static void attach(TranslationContext context, Map<String, Map<String, String>> approved, int maxItems) {
        Map<String, SourceText> texts = context.texts();
        List<String> candidates = new ArrayList<>();
        texts.forEach((key, text) -> {
            if (approved.values().stream().anyMatch(entries -> entries.containsKey(key))) {
                candidates.add(key);
            }
        });
        List<String> chosen = prioritize(candidates, texts, maxItems);
        Set<String> chosenKeys = new HashSet<>(chosen);

        Map<String, SourceText> updated = new LinkedHashMap<>();
        texts.forEach((key, text) -> {
            if (!chosenKeys.contains(key)) {
                updated.put(key, text);
                return;
            }
            Map<String, String> references = new LinkedHashMap<>();
            approved.forEach((locale, entries) -> {
                String value = entries.get(key);
                if (value != null) {
                    references.put(locale, value);
                }
            });
            references.putAll(text.references());
            updated.put(key, new SourceText(text.text(), text.context(), references));
        });
        context.replaceTexts(updated);
        context.pluginData(NAME).put(REFERENCED_KEYS, List.copyOf(chosen));
        LOGGER.debug("Attached references from {} to {} of {} text(s)", approved.keySet(), chosen.size(), texts.size());
    }

    static List<String> prioritize(List<String> keys, Map<String, SourceText> texts, int maxItems) {
        List<String> chosen = new ArrayList<>();
        for (String key : keys) {
            if (chosen.size() >= maxItems) {
                break;
            }
            if (texts.get(key).text().length() < SHORT_TEXT_LENGTH) {
                chosen.add(key);
            }
        }
        for (String key : keys) {
            if (chosen.size() >= maxItems) {
                break;
            }
            if (!chosen.contains(key)) {
                chosen.add(key);
            }
        }
        return chosen;
    }
}
