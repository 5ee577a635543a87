package ai.catalog.translator.prompt;

import ai.catalog.translator.model.SourceText;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fills prompt templates for one locale and one chunk of strings.
 */
public class PromptBuilder {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final PromptTemplates templates;

    public PromptBuilder(PromptTemplates templates) {
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    public Prompt build(String sourceLocale,
                        String targetLocale,
                        Map<String, SourceText> texts,
                        List<String> rules,
                        Optional<String> filename,
                        Optional<String> keyPrefix) {
        Map<String, String> variables = new LinkedHashMap<>();
        variables.put("sourceLanguage", languageName(sourceLocale));
        variables.put("targetLanguage", languageName(targetLocale));
        variables.put("additionalRules", formatRules(rules));
        variables.put("filename", filename.orElse("unknown"));
        List<String> keys = new ArrayList<>();
        texts.keySet().forEach(key -> keys.add(prefixed(key, keyPrefix)));
        variables.put("keys", String.join(", ", keys));
        variables.put("strings", formatStrings(texts, keyPrefix));
        return new Prompt(fill(templates.system(), variables), fill(templates.user(), variables));
    }

    /**
     * English display name for a locale code, or the code itself when the JDK does not know it.
     */
    static String languageName(String code) {
        Locale locale = Locale.forLanguageTag(code.replace('_', '-'));
        String language = locale.getDisplayLanguage(Locale.ENGLISH);
        if (language.isEmpty() || language.equalsIgnoreCase(locale.getLanguage())) {
            return code;
        }
        String country = locale.getDisplayCountry(Locale.ENGLISH);
        return country.isEmpty() ? language : language + " (" + country + ")";
    }

    private static String formatRules(List<String> rules) {
        if (rules == null || rules.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder();
        for (String rule : rules) {
            builder.append("- ").append(rule).append('\n');
        }
        return builder.toString().stripTrailing();
    }

    static String formatStrings(Map<String, SourceText> texts, Optional<String> keyPrefix) {
        StringBuilder builder = new StringBuilder();
        texts.forEach((key, text) -> {
            builder.append("  - `").append(prefixed(key, keyPrefix)).append("`: \"\"\"").append(text.text()).append("\"\"\"\n");
            text.context().ifPresent(context -> builder.append("    context: ").append(context).append('\n'));
            text.references().forEach((locale, reference) ->
                    builder.append("    reference (").append(locale).append("): \"\"\"").append(reference).append("\"\"\"\n"));
        });
        return builder.toString().stripTrailing();
    }

    private static String prefixed(String key, Optional<String> keyPrefix) {
        return keyPrefix.map(prefix -> prefix + "." + key).orElse(key);
    }

    /**
     * Single pass, so placeholder-like text inside substituted values stays as it is.
     */
    private static String fill(String template, Map<String, String> variables) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder filled = new StringBuilder();
        while (matcher.find()) {
            String value = variables.get(matcher.group(1));
            matcher.appendReplacement(filled, Matcher.quoteReplacement(value == null ? matcher.group() : value));
        }
        matcher.appendTail(filled);
        return filled.toString();
    }
}
