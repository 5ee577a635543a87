package ai.catalog.translator.translate;

import ai.catalog.translator.model.LocalizedItem;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Verified output of one backend unit: usable items keyed by source key (prefix removed), the
 * source keys the reply did not cover, warnings about unexpected keys, and the attempts consumed.
 */
public record BatchResult(String provider, List<LocalizedItem> items, Set<String> missingKeys, List<String> warnings, int attempts) {

    public BatchResult {
        items = List.copyOf(items);
        missingKeys = Collections.unmodifiableSet(new LinkedHashSet<>(missingKeys));
        warnings = List.copyOf(warnings);
    }

    public Map<String, String> translations() {
        Map<String, String> translations = new LinkedHashMap<>();
        items.forEach(item -> translations.put(item.key(), item.text()));
        return translations;
    }
}
