package ai.catalog.translator.plugins;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import ai.catalog.translator.consensus.ConsensusSettings;
import ai.catalog.translator.consensus.ExecutionMode;
import ai.catalog.translator.consensus.LocaleFailedException;
import ai.catalog.translator.decode.ItemFormat;
import ai.catalog.translator.model.ProviderConfig;
import ai.catalog.translator.model.TranslationOutput;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.model.TranslationResult;
import ai.catalog.translator.pipeline.TranslationPipeline;
import ai.catalog.translator.pipeline.TranslationStream;
import ai.catalog.translator.plugin.PluginConfig;
import ai.catalog.translator.plugin.PluginRegistry;
import ai.catalog.translator.translate.BackendClient;
import ai.catalog.translator.translate.BackendResponse;
import ai.catalog.translator.translate.TranslationException;
import ai.catalog.translator.translate.UnconfiguredProviderException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MultiProviderPluginTest {

    private static final TranslationRequest REQUEST = TranslationRequest.of("en", List.of("ko", "ja"), Map.of("greeting", "Hello"));

    @Test
    @DisplayName("provider entries may be strings or maps; invalid ones are skipped with a warning")
    void readsProviderSettings() {
        List<String> warnings = new ArrayList<>();
        PluginConfig config = PluginConfig.of(Map.of(
                "providers", List.of("openai:gpt-4o", Map.of("vendor", "anthropic", "model", "claude-sonnet", "temperature", 0.2), "broken"),
                "judge", "openai:gpt-5",
                "execution_mode", "sequential",
                "consensus_threshold", 3,
                "fallback_on_failure", false));

        ConsensusSettings settings = MultiProviderPlugin.settingsFrom(config, warnings);

        assertThat(settings.providers()).extracting(ProviderConfig::label)
                .containsExactly("openai:gpt-4o", "anthropic:claude-sonnet");
        assertThat(settings.providers().get(1).temperature()).isEqualTo(0.2);
        assertThat(settings.judge().label()).isEqualTo("openai:gpt-5");
        assertThat(settings.executionMode()).isEqualTo(ExecutionMode.SEQUENTIAL);
        assertThat(settings.consensusThreshold()).isEqualTo(3);
        assertThat(settings.fallbackOnFailure()).isFalse();
        assertThat(warnings).containsExactly("Skipping provider 'broken' due to missing configuration");
    }

    @Test
    void requiresAtLeastOneProvider() {
        assertThatThrownBy(() -> MultiProviderPlugin.settingsFrom(PluginConfig.of(Map.of("providers", List.of("nope"))), new ArrayList<>()))
                .isInstanceOf(TranslationException.class)
                .hasMessageContaining("No providers configured");
    }

    @Test
    void translatesEveryTargetLocale() {
        TranslationResult result = run(provider -> (request, listener) ->
                BackendResponse.of(ItemFormat.renderItem("greeting", "[" + request.targetLocale() + "] 안녕")), "mock:a");

        assertThat(result.translation("ko", "greeting")).contains("[ko] 안녕");
        assertThat(result.translation("ja", "greeting")).contains("[ja] 안녕");
        assertThat(result.errors()).isEmpty();
    }

    @Test
    @DisplayName("with fallback enabled a failed locale becomes an error while other locales succeed")
    void failedLocaleIsReportedWhenFallbackIsEnabled() {
        TranslationResult result = run(provider -> japaneseFails(), "mock:a");

        assertThat(result.translation("ko", "greeting")).contains("안녕하세요");
        assertThat(result.translationsFor("ja")).isEmpty();
        assertThat(result.errors()).singleElement().satisfies(error -> assertThat(error).startsWith("Translation to ja failed"));
    }

    @Test
    void failedLocaleFailsTheRunWhenFallbackIsDisabled() {
        assertThatThrownBy(() -> run(provider -> japaneseFails(), Map.of(
                "providers", List.of("mock:a"), "fallback_on_failure", false)))
                .isInstanceOf(LocaleFailedException.class)
                .hasMessageContaining("ja");
    }

    @Test
    @DisplayName("an unconfigured provider fails before any backend call")
    void unconfiguredProviderFailsFast() {
        AtomicInteger calls = new AtomicInteger();
        Function<ProviderConfig, BackendClient> backends = provider -> {
            if (provider.vendor().equals("anthropic")) {
                throw new UnconfiguredProviderException("ANTHROPIC_API_KEY must be provided to use anthropic");
            }
            return (request, listener) -> {
                calls.incrementAndGet();
                return BackendResponse.of(ItemFormat.renderItem("greeting", "안녕하세요"));
            };
        };

        assertThatThrownBy(() -> run(backends, "mock:a", "anthropic:claude"))
                .isInstanceOf(UnconfiguredProviderException.class);
        assertThat(calls.get()).isZero();
    }

    @Test
    void judgeResolvesDisagreementBetweenProviders() {
        Function<ProviderConfig, BackendClient> backends = provider -> (request, listener) -> switch (provider.model()) {
            case "a" -> BackendResponse.of(ItemFormat.renderItem("greeting", "안녕"));
            case "b" -> BackendResponse.of(ItemFormat.renderItem("greeting", "안녕하세요"));
            default -> BackendResponse.of("1");
        };

        TranslationResult result = run(backends, Map.of("providers", List.of("mock:a", "mock:b"), "judge", "mock:judge"));

        assertThat(result.translation("ko", "greeting")).contains("안녕");
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    @DisplayName("a finished locale streams its outputs while slower locales are still translating")
    void publishesEachLocaleAsSoonAsItFinishes() {
        Function<ProviderConfig, BackendClient> backends = provider -> (request, listener) -> {
            if (request.targetLocale().equals("ja")) {
                pause(1_500);
            }
            return BackendResponse.of(ItemFormat.renderItem("greeting", "[" + request.targetLocale() + "] 안녕"));
        };
        try (MultiProviderPlugin plugin = new MultiProviderPlugin(backends)) {
            TranslationPipeline pipeline = TranslationPipeline.builder(new PluginRegistry().register(plugin)).build();
            long started = System.nanoTime();
            try (TranslationStream stream = pipeline.process(REQUEST.withPluginConfigs(
                    Map.of(MultiProviderPlugin.NAME, Map.of("providers", List.of("mock:a")))))) {
                TranslationOutput first = stream.next();
                long firstMillis = Duration.ofNanos(System.nanoTime() - started).toMillis();
                List<TranslationOutput> rest = new ArrayList<>();
                stream.forEachRemaining(rest::add);

                assertThat(first.locale()).isEqualTo("ko");
                assertThat(first.value()).isEqualTo("[ko] 안녕");
                assertThat(first.metadata()).containsEntry("provider", "mock:a");
                assertThat(firstMillis).isLessThan(1_000);
                assertThat(rest).extracting(TranslationOutput::locale).containsExactly("ja");
            }
        }
    }

    @Test
    void keysWithMaskedValuesArePublishedAfterTheyAreRestored() {
        TranslationRequest request = TranslationRequest.of("en", List.of("ko"), Map.of(
                "contact", "Mail jane@example.com",
                "greeting", "Hello"));
        BackendClient echo = (call, listener) -> BackendResponse.of(
                ItemFormat.renderItem("contact", "[ko] " + call.entries().get("contact"))
                        + ItemFormat.renderItem("greeting", "안녕"));
        try (MultiProviderPlugin plugin = new MultiProviderPlugin(provider -> echo)) {
            TranslationPipeline pipeline = TranslationPipeline.builder(new PluginRegistry()
                    .register(new PiiMaskingPlugin())
                    .register(plugin)).build();
            List<TranslationOutput> outputs = new ArrayList<>();
            try (TranslationStream stream = pipeline.process(request.withPluginConfigs(
                    Map.of(MultiProviderPlugin.NAME, Map.of("providers", List.of("mock:a")))))) {
                stream.forEachRemaining(outputs::add);
            }

            assertThat(outputs).extracting(TranslationOutput::key, TranslationOutput::value)
                    .containsExactly(tuple("greeting", "안녕"), tuple("contact", "[ko] Mail jane@example.com"));
        }
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static BackendClient japaneseFails() {
        return (request, listener) -> {
            if (request.targetLocale().equals("ja")) {
                throw new IllegalStateException("model overloaded");
            }
            return BackendResponse.of(ItemFormat.renderItem("greeting", "안녕하세요"));
        };
    }

    private static TranslationResult run(Function<ProviderConfig, BackendClient> backends, String... providers) {
        return run(backends, Map.of("providers", List.of(providers)));
    }

    private static TranslationResult run(Function<ProviderConfig, BackendClient> backends, Map<String, Object> config) {
        try (MultiProviderPlugin plugin = new MultiProviderPlugin(backends)) {
            TranslationPipeline pipeline = TranslationPipeline.builder(new PluginRegistry().register(plugin)).build();
            return pipeline.translate(REQUEST.withPluginConfigs(Map.of(MultiProviderPlugin.NAME, config)));
        }
    }
}
