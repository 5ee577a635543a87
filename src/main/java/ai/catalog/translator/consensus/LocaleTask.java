package ai.catalog.translator.consensus;

import ai.catalog.translator.model.ProviderConfig;
import ai.catalog.translator.translate.BackendRequest;
import ai.catalog.translator.translate.TokenUsageAccumulator;
import ai.catalog.translator.translate.TranslationListener;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Work for one target locale.
 *
 * @param sources  source text per key, in source order; the judge prompt quotes these
 * @param requests builds the backend calls (one per chunk) for a provider; each request's
 *                 entries name the keys it covers
 */
public record LocaleTask(String locale,
                         Map<String, String> sources,
                         Optional<String> keyPrefix,
                         Function<ProviderConfig, List<BackendRequest>> requests,
                         TokenUsageAccumulator usage,
                         TranslationListener listener) {

    public LocaleTask {
        Objects.requireNonNull(locale, "locale");
        sources = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(sources, "sources")));
        keyPrefix = keyPrefix == null ? Optional.empty() : keyPrefix;
        Objects.requireNonNull(requests, "requests");
        usage = usage == null ? new TokenUsageAccumulator() : usage;
        listener = listener == null ? TranslationListener.NO_OP : listener;
    }
}
