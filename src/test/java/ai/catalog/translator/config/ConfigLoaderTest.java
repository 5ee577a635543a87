package ai.catalog.translator.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import ai.catalog.translator.cli.CliArguments;
import ai.catalog.translator.consensus.ExecutionMode;
import ai.catalog.translator.model.ProviderConfig;
import ai.catalog.translator.plugins.MultiProviderPlugin;
import ai.catalog.translator.plugins.TokenChunkingPlugin;
import ai.catalog.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--source", "catalogs/messages_en.properties",
                "--target-locale", "ko,ja",
                "--target-locale", "ko",
                "--output-dir", "out",
                "--provider", "openai:gpt-4o",
                "--provider", "ollama:llama3:8b",
                "--translation-mode", "dry-run",
                "--log-format", "json",
                "--tenant", "acme");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.source()).isEqualTo(Path.of("catalogs/messages_en.properties"));
        assertThat(config.sourceLocale()).isEqualTo("en");
        assertThat(config.targetLocales()).containsExactly("ko", "ja");
        assertThat(config.outputDirectory()).isEqualTo(Path.of("out"));
        assertThat(config.providers()).extracting(ProviderConfig::label).containsExactly("openai:gpt-4o", "ollama:llama3:8b");
        assertThat(config.translationMode()).isEqualTo(TranslationMode.DRY_RUN);
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.tenant()).contains("acme");
        assertThat(config.executionMode()).isEqualTo(ExecutionMode.PARALLEL);
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.ollamaBaseUrl()).isEqualTo("http://localhost:11434");
        assertThat(config.secrets().openAiApiKey()).isEmpty();
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        Map<String, String> envValues = new HashMap<>();
        envValues.put(ConfigLoader.ENV_PROVIDERS, "anthropic:claude-sonnet, gemini:gemini-2.0-flash");
        envValues.put(ConfigLoader.ENV_JUDGE, "openai:gpt-4o-mini");
        envValues.put(ConfigLoader.ENV_EXECUTION_MODE, "sequential");
        envValues.put(ConfigLoader.ENV_CONSENSUS_THRESHOLD, "3");
        envValues.put(ConfigLoader.ENV_FALLBACK_ON_FAILURE, "false");
        envValues.put(ConfigLoader.ENV_RETRIES, "4");
        envValues.put(ConfigLoader.ENV_TIMEOUT_SECONDS, "90");
        envValues.put(ConfigLoader.ENV_MAX_TOKENS_PER_CHUNK, "1500");
        envValues.put(ConfigLoader.ENV_TEMPERATURE, "0.7");
        envValues.put(ConfigLoader.ENV_TRANSLATION_MODE, "mock");
        envValues.put(ConfigLoader.ENV_OLLAMA_BASE_URL, "http://ollama:11434");
        envValues.put(ConfigLoader.ENV_ANTHROPIC_API_KEY, "anthropic-key");
        envValues.put(ConfigLoader.ENV_LOG_FORMAT, "text");
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--source", "messages.properties", "--source-locale", "de", "--target-locale", "fr");

        Config config = new ConfigLoader(EnvironmentReader.of(envValues)).load(cliArguments);

        assertThat(config.sourceLocale()).isEqualTo("de");
        assertThat(config.providers()).extracting(ProviderConfig::label)
                .containsExactly("anthropic:claude-sonnet", "gemini:gemini-2.0-flash");
        assertThat(config.providers()).allSatisfy(provider -> assertThat(provider.temperature()).isEqualTo(0.7));
        assertThat(config.judge().label()).isEqualTo("openai:gpt-4o-mini");
        assertThat(config.executionMode()).isEqualTo(ExecutionMode.SEQUENTIAL);
        assertThat(config.consensusThreshold()).isEqualTo(3);
        assertThat(config.fallbackOnFailure()).isFalse();
        assertThat(config.retryPolicy().maxAttempts()).isEqualTo(4);
        assertThat(config.timeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(config.maxTokensPerChunk()).isEqualTo(1500);
        assertThat(config.translationMode()).isEqualTo(TranslationMode.MOCK);
        assertThat(config.ollamaBaseUrl()).isEqualTo("http://ollama:11434");
        assertThat(config.secrets().anthropicApiKey()).contains("anthropic-key");
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void cliProvidersOverrideTheEnvironment() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--source", "messages.properties", "--target-locale", "ko", "--provider", "mock:test");

        Config config = new ConfigLoader(key -> ConfigLoader.ENV_PROVIDERS.equals(key)
                ? Optional.of("openai:gpt-4o")
                : Optional.empty()).load(cliArguments);

        assertThat(config.providers()).extracting(ProviderConfig::label).containsExactly("mock:test");
    }

    @Test
    void rejectsMissingOrSourceTargetLocales() {
        Throwable missing = catchThrowable(() -> new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "--source", "messages.properties")));
        Throwable same = catchThrowable(() -> new ConfigLoader(key -> Optional.empty())
                .load(CommandLine.populateCommand(new CliArguments(), "--source", "messages.properties", "--target-locale", "en")));

        assertThat(missing).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("--target-locale");
        assertThat(same).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("source locale");
    }

    @Test
    void rejectsNonNumericSettings() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--source", "messages.properties", "--target-locale", "ko");

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> ConfigLoader.ENV_RETRIES.equals(key)
                ? Optional.of("three")
                : Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessage(ConfigLoader.ENV_RETRIES + " must be an integer");
    }

    @Test
    @SuppressWarnings("unchecked")
    void exposesPluginConfigsForThePipeline() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "--source", "messages.properties", "--target-locale", "ko", "--provider", "mock:a");
        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        Map<String, Map<String, Object>> pluginConfigs = config.pluginConfigs();

        Map<String, Object> multiProvider = pluginConfigs.get(MultiProviderPlugin.NAME);
        assertThat((List<Map<String, Object>>) multiProvider.get("providers"))
                .singleElement()
                .satisfies(entry -> assertThat(entry).containsEntry("vendor", "mock").containsEntry("model", "a"));
        assertThat(multiProvider).containsEntry("execution_mode", "parallel").containsEntry("timeout_seconds", 30L);
        assertThat(pluginConfigs.get(TokenChunkingPlugin.NAME))
                .containsEntry("max_tokens_per_chunk", TokenChunkingPlugin.DEFAULT_MAX_TOKENS_PER_CHUNK);
    }
}
