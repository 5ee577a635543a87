package ai.catalog.translator.config;

import ai.catalog.translator.consensus.ExecutionMode;
import ai.catalog.translator.model.ProviderConfig;
import ai.catalog.translator.plugins.MultiProviderPlugin;
import ai.catalog.translator.plugins.TokenChunkingPlugin;
import ai.catalog.translator.translate.RetryPolicy;
import ai.catalog.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path source,
        String sourceLocale,
        List<String> targetLocales,
        Path outputDirectory,
        TranslationMode translationMode,
        LogFormat logFormat,
        Optional<String> tenant,
        List<ProviderConfig> providers,
        ProviderConfig judge,
        ExecutionMode executionMode,
        int consensusThreshold,
        boolean fallbackOnFailure,
        RetryPolicy retryPolicy,
        Duration timeout,
        int maxTokensPerChunk,
        String ollamaBaseUrl,
        Secrets secrets
) {

    public Config {
        Objects.requireNonNull(source, "source");
        sourceLocale = requireNonBlank(sourceLocale, "sourceLocale");
        Objects.requireNonNull(targetLocales, "targetLocales");
        if (targetLocales.isEmpty()) {
            throw new IllegalArgumentException("targetLocales must not be empty");
        }
        targetLocales = List.copyOf(targetLocales);
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        tenant = tenant == null ? Optional.empty() : tenant.filter(value -> !value.isBlank());
        Objects.requireNonNull(providers, "providers");
        if (providers.isEmpty()) {
            throw new IllegalArgumentException("providers must not be empty");
        }
        providers = List.copyOf(providers);
        Objects.requireNonNull(judge, "judge");
        Objects.requireNonNull(executionMode, "executionMode");
        if (consensusThreshold < 1) {
            throw new IllegalArgumentException("consensusThreshold must be at least 1");
        }
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (maxTokensPerChunk < 1) {
            throw new IllegalArgumentException("maxTokensPerChunk must be at least 1");
        }
        ollamaBaseUrl = requireNonBlank(ollamaBaseUrl, "ollamaBaseUrl");
        secrets = Objects.requireNonNull(secrets, "secrets");
    }

    /**
     * Per-plugin configuration handed to the pipeline with every request.
     */
    public Map<String, Map<String, Object>> pluginConfigs() {
        Map<String, Object> multiProvider = new LinkedHashMap<>();
        multiProvider.put("providers", providers.stream().map(Config::asEntry).collect(Collectors.toList()));
        multiProvider.put("judge", judge.label());
        multiProvider.put("judge_temperature", judge.temperature());
        multiProvider.put("execution_mode", executionMode.name().toLowerCase(Locale.ROOT));
        multiProvider.put("consensus_threshold", consensusThreshold);
        multiProvider.put("fallback_on_failure", fallbackOnFailure);
        multiProvider.put("retry_attempts", retryPolicy.maxAttempts());
        multiProvider.put("initial_backoff_millis", retryPolicy.initialBackoff().toMillis());
        multiProvider.put("max_backoff_millis", retryPolicy.maxBackoff().toMillis());
        multiProvider.put("retry_jitter_factor", retryPolicy.jitterFactor());
        multiProvider.put("timeout_seconds", timeout.toSeconds());
        return Map.of(
                MultiProviderPlugin.NAME, Map.copyOf(multiProvider),
                TokenChunkingPlugin.NAME, Map.of("max_tokens_per_chunk", maxTokensPerChunk));
    }

    private static Map<String, Object> asEntry(ProviderConfig provider) {
        return Map.of(
                "vendor", provider.vendor(),
                "model", provider.model(),
                "temperature", provider.temperature(),
                "max_tokens", provider.maxTokens());
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
