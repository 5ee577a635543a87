package ai.catalog.translator.config;

import ai.catalog.translator.cli.CliArguments;
import ai.catalog.translator.consensus.ConsensusSettings;
import ai.catalog.translator.consensus.ExecutionMode;
import ai.catalog.translator.model.ProviderConfig;
import ai.catalog.translator.plugins.TokenChunkingPlugin;
import ai.catalog.translator.translate.RetryPolicy;
import ai.catalog.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_PROVIDERS = "TRANSLATOR_PROVIDERS";
    static final String ENV_JUDGE = "TRANSLATOR_JUDGE";
    static final String ENV_EXECUTION_MODE = "TRANSLATOR_EXECUTION_MODE";
    static final String ENV_CONSENSUS_THRESHOLD = "TRANSLATOR_CONSENSUS_THRESHOLD";
    static final String ENV_FALLBACK_ON_FAILURE = "TRANSLATOR_FALLBACK_ON_FAILURE";
    static final String ENV_RETRIES = "TRANSLATOR_RETRIES";
    static final String ENV_INITIAL_BACKOFF_MILLIS = "TRANSLATOR_INITIAL_BACKOFF_MILLIS";
    static final String ENV_MAX_BACKOFF_MILLIS = "TRANSLATOR_MAX_BACKOFF_MILLIS";
    static final String ENV_RETRY_JITTER_FACTOR = "TRANSLATOR_RETRY_JITTER_FACTOR";
    static final String ENV_TIMEOUT_SECONDS = "TRANSLATOR_TIMEOUT_SECONDS";
    static final String ENV_MAX_TOKENS_PER_CHUNK = "TRANSLATOR_MAX_TOKENS_PER_CHUNK";
    static final String ENV_TEMPERATURE = "TRANSLATOR_TEMPERATURE";
    static final String ENV_TRANSLATION_MODE = "TRANSLATOR_TRANSLATION_MODE";
    static final String ENV_OLLAMA_BASE_URL = "OLLAMA_BASE_URL";
    static final String ENV_OPENAI_API_KEY = "OPENAI_API_KEY";
    static final String ENV_ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    static final String ENV_GEMINI_API_KEY = "GEMINI_API_KEY";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final String DEFAULT_SOURCE_LOCALE = "en";
    private static final String DEFAULT_PROVIDER = "openai:gpt-4o";
    private static final String DEFAULT_OLLAMA_BASE_URL = "http://localhost:11434";
    private static final int DEFAULT_TIMEOUT_SECONDS = 30;
    private static final double DEFAULT_TEMPERATURE = 0.3;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path source = Objects.requireNonNull(arguments.source(), "--source must be provided");
        String sourceLocale = isNotBlank(arguments.sourceLocale()) ? arguments.sourceLocale().trim() : DEFAULT_SOURCE_LOCALE;
        List<String> targetLocales = arguments.targetLocales().stream()
                .flatMap(value -> Arrays.stream(value.split(",")))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toCollection(LinkedHashSet::new))
                .stream()
                .collect(Collectors.toList());
        if (targetLocales.isEmpty()) {
            throw new IllegalArgumentException("at least one --target-locale must be provided");
        }
        if (targetLocales.contains(sourceLocale)) {
            throw new IllegalArgumentException("target locales must differ from the source locale " + sourceLocale);
        }
        Path outputDirectory = arguments.outputDirectory() != null
                ? arguments.outputDirectory()
                : Optional.ofNullable(source.toAbsolutePath().getParent()).orElse(Path.of("."));

        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        double temperature = environmentReader.get(ENV_TEMPERATURE)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> parseDouble(ENV_TEMPERATURE, value))
                .orElse(DEFAULT_TEMPERATURE);

        List<String> providerSpecs = !arguments.providers().isEmpty()
                ? arguments.providers()
                : environmentReader.get(ENV_PROVIDERS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::splitList)
                .orElse(List.of(DEFAULT_PROVIDER));
        List<ProviderConfig> providers = providerSpecs.stream()
                .flatMap(value -> splitList(value).stream())
                .map(value -> ProviderConfig.parse(value, temperature))
                .collect(Collectors.toList());

        ProviderConfig judge = environmentReader.get(ENV_JUDGE)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> ProviderConfig.parse(value.trim(), ConsensusSettings.DEFAULT_JUDGE.temperature()))
                .orElse(ConsensusSettings.DEFAULT_JUDGE);
        ExecutionMode executionMode = environmentReader.get(ENV_EXECUTION_MODE)
                .map(ExecutionMode::from)
                .orElse(ExecutionMode.PARALLEL);
        int consensusThreshold = readInt(ENV_CONSENSUS_THRESHOLD, ConsensusSettings.DEFAULT_CONSENSUS_THRESHOLD);
        boolean fallbackOnFailure = environmentReader.get(ENV_FALLBACK_ON_FAILURE)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(true);

        RetryPolicy retryPolicy = new RetryPolicy(
                readInt(ENV_RETRIES, RetryPolicy.DEFAULT.maxAttempts()),
                Duration.ofMillis(readInt(ENV_INITIAL_BACKOFF_MILLIS, (int) RetryPolicy.DEFAULT.initialBackoff().toMillis())),
                Duration.ofMillis(readInt(ENV_MAX_BACKOFF_MILLIS, (int) RetryPolicy.DEFAULT.maxBackoff().toMillis())),
                environmentReader.get(ENV_RETRY_JITTER_FACTOR)
                        .filter(ConfigLoader::isNotBlank)
                        .map(value -> parseDouble(ENV_RETRY_JITTER_FACTOR, value))
                        .orElse(RetryPolicy.DEFAULT.jitterFactor()));
        Duration timeout = Duration.ofSeconds(readInt(ENV_TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS));
        int maxTokensPerChunk = readInt(ENV_MAX_TOKENS_PER_CHUNK, TokenChunkingPlugin.DEFAULT_MAX_TOKENS_PER_CHUNK);

        String ollamaBaseUrl = environmentReader.get(ENV_OLLAMA_BASE_URL)
                .filter(ConfigLoader::isNotBlank)
                .orElse(DEFAULT_OLLAMA_BASE_URL);
        Secrets secrets = new Secrets(
                environmentReader.get(ENV_OPENAI_API_KEY),
                environmentReader.get(ENV_ANTHROPIC_API_KEY),
                environmentReader.get(ENV_GEMINI_API_KEY));

        return new Config(source, sourceLocale, targetLocales, outputDirectory, translationMode, logFormat,
                Optional.ofNullable(arguments.tenant()), providers, judge, executionMode, consensusThreshold,
                fallbackOnFailure, retryPolicy, timeout, maxTokensPerChunk, ollamaBaseUrl, secrets);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.get(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.PRODUCTION);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private int readInt(String key, int defaultValue) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parseNonNegativeInteger(key, value))
                .orElse(defaultValue);
    }

    private static int parseNonNegativeInteger(String key, String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(key + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static double parseDouble(String key, String raw) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a number: " + raw, ex);
        }
    }

    private static List<String> splitList(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
