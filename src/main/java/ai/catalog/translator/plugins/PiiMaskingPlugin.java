package ai.catalog.translator.plugins;

import ai.catalog.translator.model.SourceText;
import ai.catalog.translator.pipeline.MiddlewarePlugin;
import ai.catalog.translator.pipeline.Next;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.TranslationContext;
import ai.catalog.translator.plugin.PluginConfig;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replaces personal data in source texts with tokens such as {@code __PII_EMAIL_1__} before
 * translation, and puts the original values back into the translations during post-processing.
 * Identical values share one token.
 */
public class PiiMaskingPlugin implements MiddlewarePlugin {

    public static final String NAME = "pii_masking";
    public static final String MASK_MAP = "mask_map";
    public static final String ORIGINAL_TEXTS = "original_texts";

    private static final Logger LOGGER = LoggerFactory.getLogger(PiiMaskingPlugin.class);

    private static final List<Rule> RULES = List.of(
            new Rule("mask_ssn", "SSN", Pattern.compile("\\b\\d{3}-\\d{2}-\\d{4}\\b"), value -> true),
            new Rule("mask_credit_cards", "CARD", Pattern.compile("\\b(?:\\d[ -]*?){13,19}\\b"), PiiMaskingPlugin::passesLuhn),
            new Rule("mask_ips", "IP", Pattern.compile("\\b(?:(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\.){3}(?:25[0-5]|2[0-4][0-9]|[01]?[0-9][0-9]?)\\b"), value -> true),
            new Rule("mask_ips", "IPV6", Pattern.compile("\\b(?:[A-Fa-f0-9]{1,4}:){7}[A-Fa-f0-9]{1,4}\\b"), value -> true),
            new Rule("mask_emails", "EMAIL", Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), value -> true),
            new Rule("mask_phones", "PHONE", Pattern.compile("\\(\\d{3}\\)\\s*\\d{3}-\\d{4}"), value -> true),
            new Rule("mask_phones", "PHONE", Pattern.compile("\\+\\d{1,3}[-.\\s]?\\d{1,4}[-.\\s]?\\d{1,4}[-.\\s]?\\d{1,9}"), value -> true),
            new Rule("mask_phones", "PHONE", Pattern.compile("\\b\\d{3}[-.\\s]\\d{3}[-.\\s]\\d{4}\\b"), value -> true),
            new Rule("mask_urls", "URL", Pattern.compile("https?://[^\\s<>\"]+"), value -> true));

    @Override
    public String name() {
        return NAME;
    }

    /**
     * Runs after token chunking has merged split texts during post-processing.
     */
    @Override
    public int priority() {
        return 10;
    }

    @Override
    public Map<String, Object> defaultConfig() {
        return Map.of(
                "mask_emails", true,
                "mask_phones", true,
                "mask_credit_cards", true,
                "mask_ssn", true,
                "mask_ips", true,
                "mask_urls", false);
    }

    @Override
    public List<String> stages() {
        return List.of(PipelineStages.PRE_PROCESS, PipelineStages.POST_PROCESS);
    }

    @Override
    public void handle(TranslationContext context, Next next) {
        if (PipelineStages.PRE_PROCESS.equals(context.currentStage())) {
            mask(context);
        } else {
            restore(context);
        }
        next.proceed(context);
    }

    private void mask(TranslationContext context) {
        PluginConfig config = context.configFor(NAME);
        Masker masker = new Masker();
        Map<String, SourceText> original = context.texts();
        Map<String, SourceText> masked = new LinkedHashMap<>();
        original.forEach((key, text) -> masked.put(key, text.withText(masker.mask(text.text(), config))));
        context.replaceTexts(masked);
        Map<String, Object> data = context.pluginData(NAME);
        data.put(MASK_MAP, Map.copyOf(masker.tokens));
        data.put(ORIGINAL_TEXTS, original);
        LOGGER.debug("Masked {} value(s) in {} text(s)", masker.tokens.size(), masked.size());
    }

    @SuppressWarnings("unchecked")
    private void restore(TranslationContext context) {
        Map<String, String> tokens = context.pluginValue(NAME, MASK_MAP, Map.class).orElse(Map.of());
        if (!tokens.isEmpty()) {
            int restored = 0;
            for (Map.Entry<String, Map<String, String>> locale : context.translations().entrySet()) {
                for (Map.Entry<String, String> entry : locale.getValue().entrySet()) {
                    String value = unmask(entry.getValue(), tokens);
                    if (!value.equals(entry.getValue())) {
                        context.putTranslation(locale.getKey(), entry.getKey(), value,
                                context.providerOf(locale.getKey(), entry.getKey()).orElse(null));
                        restored++;
                    }
                }
            }
            LOGGER.debug("Restored masked values in {} translation(s)", restored);
        }
        context.pluginValue(NAME, ORIGINAL_TEXTS, Map.class)
                .ifPresent(original -> restoreTexts(context, (Map<String, SourceText>) original));
    }

    private static void restoreTexts(TranslationContext context, Map<String, SourceText> original) {
        Map<String, SourceText> restored = new LinkedHashMap<>();
        context.texts().keySet().forEach(key -> {
            if (original.containsKey(key)) {
                restored.put(key, original.get(key));
            }
        });
        context.replaceTexts(restored);
    }

    static String unmask(String text, Map<String, String> tokens) {
        String result = text;
        for (Map.Entry<String, String> token : tokens.entrySet()) {
            if (result.contains(token.getKey())) {
                result = result.replace(token.getKey(), token.getValue());
            }
        }
        return result;
    }

    static boolean passesLuhn(String candidate) {
        String digits = candidate.replaceAll("\\D", "");
        if (digits.length() < 13 || digits.length() > 19) {
            return false;
        }
        int sum = 0;
        boolean doubled = false;
        for (int index = digits.length() - 1; index >= 0; index--) {
            int digit = digits.charAt(index) - '0';
            if (doubled) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubled = !doubled;
        }
        return sum % 10 == 0;
    }

    private record Rule(String option, String type, Pattern pattern, Predicate<String> validator) {
    }

    /**
     * Token table of one request.
     */
    private static final class Masker {

        private final Map<String, String> tokens = new LinkedHashMap<>();
        private final Map<String, String> byValue = new LinkedHashMap<>();
        private int counter;

        String mask(String text, PluginConfig config) {
            String result = text;
            for (Rule rule : RULES) {
                if (config.getBoolean(rule.option(), false)) {
                    result = apply(result, rule);
                }
            }
            return result;
        }

        private String apply(String text, Rule rule) {
            Matcher matcher = rule.pattern().matcher(text);
            StringBuilder masked = new StringBuilder();
            while (matcher.find()) {
                String value = matcher.group();
                String replacement = rule.validator().test(value) ? tokenFor(rule.type(), value) : value;
                matcher.appendReplacement(masked, Matcher.quoteReplacement(replacement));
            }
            matcher.appendTail(masked);
            return masked.toString();
        }

        private String tokenFor(String type, String value) {
            String existing = byValue.get(value);
            if (existing != null) {
                return existing;
            }
            counter++;
            String token = "__PII_" + type + "_" + counter + "__";
            tokens.put(token, value);
            byValue.put(value, token);
            return token;
        }
    }
}
