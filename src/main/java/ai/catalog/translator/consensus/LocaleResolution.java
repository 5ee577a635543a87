package ai.catalog.translator.consensus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of a locale: chosen text and its provider per key, keys nobody translated, and the
 * warnings collected on the way.
 */
public record LocaleResolution(String locale,
                               Map<String, String> translations,
                               Map<String, String> providers,
                               Set<String> unresolvedKeys,
                               List<String> warnings,
                               LocaleState state) {

    public LocaleResolution {
        translations = Collections.unmodifiableMap(new LinkedHashMap<>(translations));
        providers = Collections.unmodifiableMap(new LinkedHashMap<>(providers));
        unresolvedKeys = Collections.unmodifiableSet(new LinkedHashSet<>(unresolvedKeys));
        warnings = List.copyOf(warnings);
    }
}
