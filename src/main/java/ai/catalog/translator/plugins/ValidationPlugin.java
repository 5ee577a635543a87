package ai.catalog.translator.plugins;

import ai.catalog.translator.model.SourceText;
import ai.catalog.translator.pipeline.MiddlewarePlugin;
import ai.catalog.translator.pipeline.Next;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.TranslationContext;
import ai.catalog.translator.plugin.PluginConfig;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares every translation with its source once the rest of the validation stage has run and
 * reports what went missing. Issues are warnings, or errors in strict mode; translations are
 * never changed.
 */
public class ValidationPlugin implements MiddlewarePlugin {

    public static final String NAME = "validation";
    public static final String ISSUES = "issues";

    private static final Logger LOGGER = LoggerFactory.getLogger(ValidationPlugin.class);

    private static final Pattern HTML_TAG = Pattern.compile("<[^>]+>");
    private static final Pattern COLON_VARIABLE = Pattern.compile(":\\w+");
    private static final Pattern MUSTACHE_VARIABLE = Pattern.compile("\\{\\{[^}]+}}");
    private static final Pattern DOLLAR_VARIABLE = Pattern.compile("\\$\\w+");
    private static final Pattern PRINTF = Pattern.compile("%[sdifFeEgGxXobBcpn]");
    private static final Pattern NAMED_PLACEHOLDER = Pattern.compile("[{\\[][\\w\\s]+[}\\]]");
    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"{}|\\\\^`\\[\\]]+", Pattern.CASE_INSENSITIVE);
    private static final Pattern EMAIL = Pattern.compile("[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}");
    private static final Pattern NUMBER = Pattern.compile("\\d+([.,]\\d+)?");

    private static final Map<String, Double> LENGTH_ADJUSTMENTS = Map.of(
            "de", 1.3,
            "fr", 1.2,
            "es", 1.1,
            "ru", 1.2,
            "zh", 0.7,
            "ja", 0.8,
            "ko", 0.9);

    static final List<String> CHECKS = List.of("html", "variables", "placeholders", "length", "urls", "emails", "numbers");

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return -100;
    }

    @Override
    public List<String> stages() {
        return List.of(PipelineStages.VALIDATION);
    }

    @Override
    public Map<String, Object> defaultConfig() {
        return Map.of(
                "checks", List.of("all"),
                "min_length_ratio", 0.5,
                "max_length_ratio", 2.0,
                "strict_mode", false);
    }

    @Override
    public void handle(TranslationContext context, Next next) {
        next.proceed(context);
        PluginConfig config = context.configFor(NAME);
        Set<String> checks = enabledChecks(config);
        boolean strict = config.getBoolean("strict_mode", false);
        Map<String, SourceText> texts = context.texts();
        Map<String, Map<String, List<String>>> found = new LinkedHashMap<>();

        context.translations().forEach((locale, translations) -> translations.forEach((key, translation) -> {
            SourceText source = texts.get(key);
            if (source == null || context.isCached(locale, key)) {
                return;
            }
            List<String> issues = validate(source.text(), translation, locale, checks, config);
            if (issues.isEmpty()) {
                return;
            }
            found.computeIfAbsent(locale, ignored -> new LinkedHashMap<>()).put(key, issues);
            String message = "Validation issues for '%s' in locale '%s': %s".formatted(key, locale, String.join(", ", issues));
            LOGGER.debug(message);
            if (strict) {
                context.addError(message);
            } else {
                context.addWarning(message);
            }
        }));
        context.pluginData(NAME).put(ISSUES, found);
    }

    private static Set<String> enabledChecks(PluginConfig config) {
        List<String> configured = config.getStrings("checks");
        if (configured.isEmpty() || configured.contains("all")) {
            return Set.copyOf(CHECKS);
        }
        return configured.stream()
                .map(check -> check.trim().toLowerCase(Locale.ROOT))
                .filter(CHECKS::contains)
                .collect(Collectors.toSet());
    }

    /**
     * @return issue types in check order, empty when the translation looks sound
     */
    static List<String> validate(String original, String translation, String locale, Set<String> checks, PluginConfig config) {
        List<String> issues = new ArrayList<>();
        if (checks.contains("html")) {
            List<String> originalTags = matches(HTML_TAG, original);
            List<String> translatedTags = matches(HTML_TAG, translation);
            if (originalTags.size() != translatedTags.size()) {
                issues.add("html_tag_count");
            }
            if (!missing(tagNames(originalTags), tagNames(translatedTags)).isEmpty()) {
                issues.add("html_tags_missing");
            }
        }
        if (checks.contains("variables")) {
            addIfMissing(issues, "colon_variables", COLON_VARIABLE, original, translation);
            addIfMissing(issues, "mustache_variables", MUSTACHE_VARIABLE, original, translation);
            addIfMissing(issues, "dollar_variables", DOLLAR_VARIABLE, original, translation);
        }
        if (checks.contains("placeholders")) {
            if (matches(PRINTF, original).size() != matches(PRINTF, translation).size()) {
                issues.add("printf_placeholders");
            }
            addIfMissing(issues, "named_placeholders", NAMED_PLACEHOLDER, original, translation);
        }
        if (checks.contains("length")) {
            lengthIssue(original, translation, locale, config).ifPresent(issues::add);
        }
        if (checks.contains("urls")) {
            addIfMissing(issues, "urls_missing", URL, original, translation);
        }
        if (checks.contains("emails")) {
            addIfMissing(issues, "emails_missing", EMAIL, original, translation);
        }
        if (checks.contains("numbers")) {
            List<String> originalNumbers = normalizeNumbers(matches(NUMBER, original));
            List<String> translatedNumbers = normalizeNumbers(matches(NUMBER, translation));
            if (!missing(originalNumbers, translatedNumbers).isEmpty()) {
                issues.add("numbers_mismatch");
            }
        }
        return issues;
    }

    private static Optional<String> lengthIssue(String original, String translation, String locale, PluginConfig config) {
        int originalLength = original.codePointCount(0, original.length());
        if (originalLength == 0) {
            return Optional.empty();
        }
        double ratio = (double) translation.codePointCount(0, translation.length()) / originalLength;
        double adjustment = adjustmentFor(locale);
        double min = config.getDouble("min_length_ratio", 0.5) * adjustment;
        double max = config.getDouble("max_length_ratio", 2.0) * adjustment;
        if (ratio < min) {
            return Optional.of("length_too_short");
        }
        if (ratio > max) {
            return Optional.of("length_too_long");
        }
        return Optional.empty();
    }

    static double adjustmentFor(String locale) {
        String language = locale.length() < 2 ? locale : locale.substring(0, 2);
        return LENGTH_ADJUSTMENTS.getOrDefault(language.toLowerCase(Locale.ROOT), 1.0);
    }

    private static void addIfMissing(List<String> issues, String type, Pattern pattern, String original, String translation) {
        if (!missing(matches(pattern, original), matches(pattern, translation)).isEmpty()) {
            issues.add(type);
        }
    }

    private static List<String> missing(List<String> expected, List<String> actual) {
        return expected.stream().filter(value -> !actual.contains(value)).collect(Collectors.toList());
    }

    private static List<String> matches(Pattern pattern, String text) {
        List<String> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            found.add(matcher.group());
        }
        return found;
    }

    // "<a href='x'>" and "</a>" both name the tag "a"
    private static List<String> tagNames(List<String> tags) {
        return tags.stream()
                .map(tag -> tag.replaceAll("(?s)^</?\\s*([\\w-]+).*$", "$1").toLowerCase(Locale.ROOT))
                .collect(Collectors.toList());
    }

    private static List<String> normalizeNumbers(List<String> numbers) {
        return numbers.stream().map(number -> number.replace(',', '.')).collect(Collectors.toList());
    }
}
