package ai.catalog.translator.plugins;

import ai.catalog.translator.model.SourceText;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.ProviderPlugin;
import ai.catalog.translator.pipeline.TranslationContext;
import ai.catalog.translator.plugin.PluginConfig;
import java.util.ArrayList;
import java.util.Collections;
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
 * Picks a translation style and turns it into prompt rules for every target locale: the style's
 * general instruction, the language's form of address for that style, and an optional custom
 * instruction.
 *
 * <p>The style comes from the request option {@code style}, then the plugin option {@code style},
 * then, when {@code adapt_to_content} is on, from the request's {@code domain} metadata or the
 * wording of the texts, and finally from {@code default_style}. Unknown names are ignored.
 */
public class StylePlugin implements ProviderPlugin {

    public static final String NAME = "style";
    public static final String SERVICE = "style.configuration";
    public static final String APPLIED_STYLE = "applied_style";
    public static final String RULES = "rules";
    public static final String METADATA_DOMAIN = "domain";

    private static final Logger LOGGER = LoggerFactory.getLogger(StylePlugin.class);

    private static final Map<String, String> STYLES = orderedMap(
            "formal", "Use formal, professional language appropriate for business communication.",
            "casual", "Use casual, friendly language as if speaking to a friend.",
            "technical", "Use precise technical terminology and maintain accuracy of technical concepts.",
            "marketing", "Use engaging, persuasive language that appeals to emotions and drives action.",
            "legal", "Use precise legal terminology and formal structure appropriate for legal documents.",
            "medical", "Use accurate medical terminology while maintaining clarity for the intended audience.",
            "academic", "Use academic language with an appropriate citation style and scholarly tone.",
            "creative", "Use creative, expressive language that captures emotion and imagery.");

    // Formal and casual register per language; other styles use the formal register.
    private static final Map<String, List<String>> REGISTERS = Map.of(
            "ko", List.of("Use 존댓말 (Korean honorific level). Formality level: highest.",
                    "Use 반말 (Korean honorific level). Formality level: informal."),
            "ja", List.of("Use 敬語 (Japanese speech level). Keigo level: sonkeigo.",
                    "Use タメ口 (Japanese speech level). Keigo level: none."),
            "zh", List.of("Translate with honorifics.", "Translate without honorifics."),
            "es", List.of("Use 'usted' for second-person address.", "Use 'tú' for second-person address."),
            "fr", List.of("Use 'vous' for second-person address.", "Use 'tu' for second-person address."),
            "de", List.of("Use 'Sie' for second-person address.", "Use 'du' for second-person address."),
            "pt", List.of("Use 'você' for second-person address.", "Use 'tu' for second-person address."),
            "ru", List.of("Use 'Вы' for second-person address.", "Use 'ты' for second-person address."),
            "hi", List.of("Use 'आप' for second-person address.", "Use 'तुम' for second-person address."),
            "ar", List.of("Use 'حضرتك' for addressing.", "Use 'انت' for addressing."));

    private static final Map<String, Pattern> CONTENT_PATTERNS = orderedPatterns(
            "legal", "\\b(whereas|hereby|pursuant|liability|agreement|contract)\\b",
            "medical", "\\b(patient|diagnosis|treatment|symptom|medication|clinical)\\b",
            "technical", "\\b(API|function|database|algorithm|implementation|protocol)\\b",
            "marketing", "\\b(buy now|limited offer|exclusive|discount|free|guaranteed)\\b",
            "academic", "\\b(research|study|hypothesis|methodology|conclusion|citation)\\b",
            "casual", "\\b(hey|gonna|wanna|yeah|cool|awesome)\\b");

    private static final Set<String> DOMAIN_STYLES = Set.of("legal", "medical", "technical", "marketing", "academic");

    private static final Pattern INFORMAL_MARKERS = Pattern.compile("[!?]{2,}|:\\)|;\\)|\\bLOL\\b|\\bOMG\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 90;
    }

    @Override
    public List<String> provides() {
        return List.of(SERVICE);
    }

    @Override
    public List<String> when() {
        return List.of(PipelineStages.PREPARATION);
    }

    @Override
    public Map<String, Object> defaultConfig() {
        return Map.of("default_style", "formal", "adapt_to_content", true);
    }

    /**
     * @return style rules per target locale, also stored as plugin data
     */
    @Override
    public Map<String, List<String>> execute(TranslationContext context) {
        PluginConfig config = context.configFor(NAME);
        String style = determineStyle(context, config);
        Optional<String> custom = config.get("custom_prompt")
                .map(Object::toString)
                .filter(prompt -> !prompt.isBlank());

        Map<String, List<String>> byLocale = new LinkedHashMap<>();
        for (String locale : context.request().targetLocales()) {
            byLocale.put(locale, rulesFor(style, locale, custom));
        }
        Map<String, Object> data = context.pluginData(NAME);
        data.put(APPLIED_STYLE, style);
        data.put(RULES, Map.copyOf(byLocale));
        LOGGER.info("Applied style '{}' to {}{}", style, context.request().targetLocales(), custom.isPresent() ? " with custom prompt" : "");
        return byLocale;
    }

    static List<String> rulesFor(String style, String locale, Optional<String> custom) {
        List<String> rules = new ArrayList<>();
        rules.add(STYLES.get(style));
        List<String> registers = REGISTERS.get(languageOf(locale));
        if (registers != null) {
            rules.add(registers.get("casual".equals(style) ? 1 : 0));
        }
        custom.ifPresent(rules::add);
        return List.copyOf(rules);
    }

    @SuppressWarnings("unchecked")
    static List<String> rulesFor(TranslationContext context, String locale) {
        return context.pluginValue(NAME, RULES, Map.class)
                .map(map -> (List<String>) map.getOrDefault(locale, List.of()))
                .orElse(List.of());
    }

    private static String determineStyle(TranslationContext context, PluginConfig config) {
        TranslationRequest request = context.request();
        Optional<String> requested = known(request.option("style"));
        if (requested.isPresent()) {
            return requested.get();
        }
        Optional<String> configured = known(config.get("style"));
        if (configured.isPresent()) {
            return configured.get();
        }
        if (config.getBoolean("adapt_to_content", true)) {
            Optional<String> detected = detect(request.metadata(METADATA_DOMAIN), context.texts().values().stream()
                    .map(SourceText::text)
                    .collect(Collectors.joining(" ")));
            if (detected.isPresent()) {
                LOGGER.debug("Detected style {} from content", detected.get());
                return detected.get();
            }
        }
        String fallback = config.getString("default_style", "formal");
        return isKnown(fallback) ? fallback : "formal";
    }

    static Optional<String> detect(Optional<String> domain, String texts) {
        Optional<String> domainStyle = domain.map(value -> value.trim().toLowerCase(Locale.ROOT)).filter(DOMAIN_STYLES::contains);
        if (domainStyle.isPresent()) {
            return domainStyle;
        }
        for (Map.Entry<String, Pattern> pattern : CONTENT_PATTERNS.entrySet()) {
            if (pattern.getValue().matcher(texts).find()) {
                return Optional.of(pattern.getKey());
            }
        }
        Matcher informal = INFORMAL_MARKERS.matcher(texts);
        int markers = 0;
        while (informal.find()) {
            markers++;
        }
        return markers > 2 ? Optional.of("casual") : Optional.empty();
    }

    private static Optional<String> known(Optional<Object> value) {
        Optional<String> style = value.map(Object::toString).map(String::trim).filter(name -> !name.isEmpty());
        if (style.isPresent() && !isKnown(style.get())) {
            LOGGER.warn("Ignoring unknown style '{}'; known styles are {}", style.get(), STYLES.keySet());
            return Optional.empty();
        }
        return style;
    }

    private static boolean isKnown(String style) {
        return STYLES.containsKey(style);
    }

    private static String languageOf(String locale) {
        String language = locale.split("[-_]", 2)[0];
        return language.toLowerCase(Locale.ROOT);
    }

    private static Map<String, String> orderedMap(String... entries) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int index = 0; index < entries.length; index += 2) {
            map.put(entries[index], entries[index + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, Pattern> orderedPatterns(String... entries) {
        Map<String, Pattern> map = new LinkedHashMap<>();
        for (int index = 0; index < entries.length; index += 2) {
            map.put(entries[index], Pattern.compile(entries[index + 1], Pattern.CASE_INSENSITIVE));
        }
        return Collections.unmodifiableMap(map);
    }
}
