package ai.catalog.translator.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Serves rules from a fixed table. Rules under {@code "*"} apply to every locale and come first;
 * a regional locale such as {@code pt-BR} also receives the rules of its language ({@code pt}).
 */
public class StaticRuleProvider implements RuleProvider {

    public static final String ALL_LOCALES = "*";

    private final Map<String, List<String>> rules;

    public StaticRuleProvider(Map<String, List<String>> rules) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        if (rules != null) {
            rules.forEach((locale, entries) -> copy.put(normalize(locale), List.copyOf(entries)));
        }
        this.rules = copy;
    }

    public static StaticRuleProvider empty() {
        return new StaticRuleProvider(Map.of());
    }

    @Override
    public List<String> rulesFor(String locale) {
        String normalized = normalize(locale);
        List<String> result = new ArrayList<>(rules.getOrDefault(ALL_LOCALES, List.of()));
        int separator = normalized.indexOf('-');
        if (separator > 0) {
            result.addAll(rules.getOrDefault(normalized.substring(0, separator), List.of()));
        }
        result.addAll(rules.getOrDefault(normalized, List.of()));
        return List.copyOf(result);
    }

    private static String normalize(String locale) {
        return locale.trim().replace('_', '-').toLowerCase(Locale.ROOT);
    }
}
