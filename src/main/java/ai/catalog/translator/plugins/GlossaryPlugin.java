package ai.catalog.translator.plugins;

import ai.catalog.translator.catalog.RuleProvider;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.ProviderPlugin;
import ai.catalog.translator.pipeline.TranslationContext;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Looks up glossary and style rules for every target locale. The rules end up in the prompt's
 * additional rules.
 */
public class GlossaryPlugin implements ProviderPlugin {

    public static final String NAME = "glossary";
    public static final String SERVICE = "glossary.rules";
    public static final String RULES = "rules";

    private final RuleProvider rules;

    public GlossaryPlugin(RuleProvider rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
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
        return List.of(PipelineStages.PREPARATION);
    }

    /**
     * @return rules per target locale, also stored as plugin data
     */
    @Override
    public Map<String, List<String>> execute(TranslationContext context) {
        Map<String, List<String>> byLocale = new LinkedHashMap<>();
        List<String> extra = context.configFor(NAME).getStrings("rules");
        for (String locale : context.request().targetLocales()) {
            List<String> localeRules = new ArrayList<>(rules.rulesFor(locale));
            localeRules.addAll(extra);
            byLocale.put(locale, List.copyOf(localeRules));
        }
        context.pluginData(NAME).put(RULES, Map.copyOf(byLocale));
        return byLocale;
    }

    @SuppressWarnings("unchecked")
    static List<String> rulesFor(TranslationContext context, String locale) {
        return context.pluginValue(NAME, RULES, Map.class)
                .map(map -> (List<String>) map.getOrDefault(locale, List.of()))
                .orElse(List.of());
    }
}
