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
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups keys into chunks that fit a token budget and splits single oversized texts into
 * sentence-aligned parts named {@code key_part_N}. Parts are merged back during post-processing.
 */
public class TokenChunkingPlugin implements MiddlewarePlugin {

    public static final String NAME = "token_chunking";
    public static final String PARTS = "parts";
    public static final int DEFAULT_MAX_TOKENS_PER_CHUNK = 2000;

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenChunkingPlugin.class);
    private static final double BUFFER = 0.9;
    private static final int OVERHEAD_TOKENS = 20;
    private static final double SCRIPT_COVERAGE = 0.3;
    private static final Pattern SENTENCE_BREAK = Pattern.compile("(?<=[.!?])\\s+");
    private static final Map<Script, Double> MULTIPLIERS = Map.of(
            Script.CJK, 1.5,
            Script.ARABIC, 0.8,
            Script.CYRILLIC, 0.7,
            Script.DEVANAGARI, 1.0,
            Script.THAI, 1.2,
            Script.LATIN, 0.25);

    enum Script {
        CJK,
        ARABIC,
        CYRILLIC,
        DEVANAGARI,
        THAI,
        LATIN
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public Map<String, Object> defaultConfig() {
        return Map.of("max_tokens_per_chunk", DEFAULT_MAX_TOKENS_PER_CHUNK);
    }

    @Override
    public List<String> stages() {
        return List.of(PipelineStages.CHUNKING, PipelineStages.POST_PROCESS);
    }

    @Override
    public void handle(TranslationContext context, Next next) {
        if (PipelineStages.CHUNKING.equals(context.currentStage())) {
            chunk(context);
        } else {
            merge(context);
        }
        next.proceed(context);
    }

    private void chunk(TranslationContext context) {
        PluginConfig config = context.configFor(NAME);
        int budget = (int) (config.getInt("max_tokens_per_chunk", DEFAULT_MAX_TOKENS_PER_CHUNK) * BUFFER);
        Map<String, SourceText> texts = context.texts();
        Map<String, SourceText> working = new LinkedHashMap<>();
        Map<String, List<String>> parts = new LinkedHashMap<>();
        List<List<String>> chunks = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentTokens = 0;

        for (Map.Entry<String, SourceText> entry : texts.entrySet()) {
            String key = entry.getKey();
            SourceText text = entry.getValue();
            int tokens = estimateTokens(text.text());
            if (tokens > budget) {
                if (!current.isEmpty()) {
                    chunks.add(current);
                    current = new ArrayList<>();
                    currentTokens = 0;
                }
                List<String> pieces = split(text.text(), budget);
                List<String> partKeys = new ArrayList<>();
                for (int index = 0; index < pieces.size(); index++) {
                    String partKey = key + "_part_" + index;
                    partKeys.add(partKey);
                    working.put(partKey, text.withText(pieces.get(index)));
                    chunks.add(List.of(partKey));
                    inheritCache(context, key, partKey);
                }
                parts.put(key, partKeys);
                continue;
            }
            if (currentTokens + tokens > budget && !current.isEmpty()) {
                chunks.add(current);
                current = new ArrayList<>();
                currentTokens = 0;
            }
            current.add(key);
            currentTokens += tokens;
            working.put(key, text);
        }
        if (!current.isEmpty()) {
            chunks.add(current);
        }

        context.replaceTexts(working);
        context.setChunks(chunks);
        context.pluginData(NAME).put(PARTS, Map.copyOf(parts));
        LOGGER.debug("Split {} text(s) into {} chunk(s) with budget {}", texts.size(), chunks.size(), budget);
    }

    private static void inheritCache(TranslationContext context, String key, String partKey) {
        for (String locale : context.request().targetLocales()) {
            if (context.isCached(locale, key)) {
                context.markCached(locale, partKey, "");
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void merge(TranslationContext context) {
        Optional<Map> stored = context.pluginValue(NAME, PARTS, Map.class);
        if (stored.isEmpty() || stored.get().isEmpty()) {
            return;
        }
        Map<String, List<String>> parts = stored.get();
        Map<String, SourceText> texts = context.texts();
        Map<String, SourceText> restored = new LinkedHashMap<>();
        Map<String, String> partOwner = new LinkedHashMap<>();
        parts.forEach((key, partKeys) -> partKeys.forEach(partKey -> partOwner.put(partKey, key)));
        texts.forEach((key, text) -> {
            String owner = partOwner.get(key);
            if (owner == null) {
                restored.put(key, text);
            } else if (!restored.containsKey(owner)) {
                restored.put(owner, text.withText(joinSources(parts.get(owner), texts)));
            }
        });

        for (String locale : context.request().targetLocales()) {
            for (Map.Entry<String, List<String>> entry : parts.entrySet()) {
                String key = entry.getKey();
                if (!context.isCached(locale, key)) {
                    mergeLocale(context, locale, key, entry.getValue());
                }
                entry.getValue().forEach(partKey -> context.removeTranslation(locale, partKey));
            }
        }
        context.replaceTexts(restored);
    }

    private static void mergeLocale(TranslationContext context, String locale, String key, List<String> partKeys) {
        StringBuilder merged = new StringBuilder();
        String provider = null;
        for (String partKey : partKeys) {
            Optional<String> value = context.translation(locale, partKey);
            if (value.isEmpty()) {
                context.addWarning("Part %s of key '%s' was not translated for %s".formatted(partKey, key, locale));
                return;
            }
            merged.append(' ').append(value.get());
            if (provider == null) {
                provider = context.providerOf(locale, partKey).orElse(null);
            }
        }
        context.putTranslation(locale, key, merged.toString().trim(), provider);
    }

    private static String joinSources(List<String> partKeys, Map<String, SourceText> texts) {
        List<String> pieces = new ArrayList<>();
        partKeys.forEach(partKey -> {
            SourceText text = texts.get(partKey);
            if (text != null) {
                pieces.add(text.text());
            }
        });
        return String.join(" ", pieces);
    }

    static List<String> split(String text, int budget) {
        String[] sentences = SENTENCE_BREAK.split(text);
        if (sentences.length <= 1) {
            sentences = text.split("\n");
        }
        List<String> pieces = new ArrayList<>();
        List<String> current = new ArrayList<>();
        int currentTokens = 0;
        for (String sentence : sentences) {
            if (sentence.isBlank()) {
                continue;
            }
            int tokens = estimateTokens(sentence);
            if (currentTokens + tokens > budget && !current.isEmpty()) {
                pieces.add(String.join(" ", current));
                current = new ArrayList<>();
                currentTokens = 0;
            }
            current.add(sentence);
            currentTokens += tokens;
        }
        if (!current.isEmpty()) {
            pieces.add(String.join(" ", current));
        }
        return pieces;
    }

    static int estimateTokens(String text) {
        int characters = text.codePointCount(0, text.length());
        return (int) (characters * MULTIPLIERS.get(detectScript(text))) + OVERHEAD_TOKENS;
    }

    static Script detectScript(String text) {
        Map<Script, Integer> counts = new LinkedHashMap<>();
        text.codePoints().forEach(codePoint -> {
            Script script = scriptOf(codePoint);
            if (script != Script.LATIN) {
                counts.merge(script, 1, Integer::sum);
            }
        });
        int length = text.codePointCount(0, text.length());
        return counts.entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .filter(top -> top.getValue() >= length * SCRIPT_COVERAGE)
                .map(Map.Entry::getKey)
                .orElse(Script.LATIN);
    }

    private static Script scriptOf(int codePoint) {
        if ((codePoint >= 0x4E00 && codePoint <= 0x9FFF)
                || (codePoint >= 0x3040 && codePoint <= 0x30FF)
                || (codePoint >= 0xAC00 && codePoint <= 0xD7AF)) {
            return Script.CJK;
        }
        if ((codePoint >= 0x0600 && codePoint <= 0x06FF) || (codePoint >= 0x0750 && codePoint <= 0x077F)) {
            return Script.ARABIC;
        }
        if (codePoint >= 0x0400 && codePoint <= 0x04FF) {
            return Script.CYRILLIC;
        }
        if (codePoint >= 0x0900 && codePoint <= 0x097F) {
            return Script.DEVANAGARI;
        }
        if (codePoint >= 0x0E00 && codePoint <= 0x0E7F) {
            return Script.THAI;
        }
        return Script.LATIN;
    }
}
