package ai.catalog.translator.plugins;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import ai.catalog.translator.catalog.CatalogTransformer;
import ai.catalog.translator.decode.ItemFormat;
import ai.catalog.translator.model.TranslationOutput;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.model.TranslationResult;
import ai.catalog.translator.pipeline.TranslationPipeline;
import ai.catalog.translator.pipeline.TranslationStream;
import ai.catalog.translator.plugin.PluginRegistry;
import ai.catalog.translator.translate.BackendClient;
import ai.catalog.translator.translate.BackendResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DiffTrackingPluginTest {

    private final List<Map<String, String>> sentEntries = new CopyOnWriteArrayList<>();
    private final BackendClient backend = (request, listener) -> {
        sentEntries.add(request.entries());
        StringBuilder reply = new StringBuilder();
        request.entries().forEach((key, value) -> reply.append(ItemFormat.renderItem(key, value.toUpperCase(Locale.ROOT))));
        return BackendResponse.of(reply.toString());
    };

    @Test
    @DisplayName("only keys missing from the target catalog are sent; existing ones come back as cached outputs")
    void sendsOnlyUntranslatedKeys() {
        InMemoryCatalog korean = new InMemoryCatalog(Map.of("greeting", "안녕하세요", "farewell", ""));
        List<TranslationOutput> outputs = new ArrayList<>();

        try (MultiProviderPlugin multiProvider = new MultiProviderPlugin(provider -> backend)) {
            TranslationPipeline pipeline = pipeline(korean, multiProvider);
            try (TranslationStream stream = pipeline.process(request("ko"))) {
                stream.forEachRemaining(outputs::add);
                assertThat(stream.result().warnings()).isEmpty();
            }
        }

        assertThat(sentEntries).hasSize(1);
        assertThat(sentEntries.get(0)).containsOnlyKeys("farewell", "title");
        assertThat(outputs).filteredOn(TranslationOutput::cached)
                .extracting(TranslationOutput::key, TranslationOutput::value)
                .containsExactly(tuple("greeting", "안녕하세요"));
        assertThat(outputs).filteredOn(output -> !output.cached())
                .extracting(TranslationOutput::key)
                .containsExactly("farewell", "title");
    }

    @Test
    void skipsTheBackendWhenEverythingIsTranslated() {
        InMemoryCatalog korean = new InMemoryCatalog(Map.of("greeting", "안녕하세요", "farewell", "안녕히 가세요", "title", "제목"));

        TranslationResult result;
        try (MultiProviderPlugin multiProvider = new MultiProviderPlugin(provider -> backend)) {
            result = pipeline(korean, multiProvider).translate(request("ko"));
        }

        assertThat(sentEntries).isEmpty();
        assertThat(result.translationsFor("ko")).containsEntry("title", "제목").hasSize(3);
        assertThat(result.errors()).isEmpty();
    }

    @Test
    void keysAreSentForLocalesWithoutACatalog() {
        InMemoryCatalog korean = new InMemoryCatalog(Map.of("greeting", "안녕하세요", "farewell", "안녕히 가세요", "title", "제목"));
        TranslationRequest request = TranslationRequest.of("en", List.of("ko", "fr"), sources());

        TranslationResult result;
        try (MultiProviderPlugin multiProvider = new MultiProviderPlugin(provider -> backend)) {
            PluginRegistry registry = new PluginRegistry()
                    .register(new DiffTrackingPlugin(locale -> "ko".equals(locale) ? Optional.of(korean) : Optional.empty()))
                    .register(multiProvider);
            result = TranslationPipeline.builder(registry).build().translate(withProvider(request));
        }

        assertThat(sentEntries).hasSize(1);
        assertThat(sentEntries.get(0)).containsOnlyKeys("greeting", "farewell", "title");
        assertThat(result.translationsFor("fr")).containsEntry("greeting", "HELLO");
        assertThat(result.translationsFor("ko")).containsEntry("greeting", "안녕하세요");
    }

    private TranslationPipeline pipeline(InMemoryCatalog catalog, MultiProviderPlugin multiProvider) {
        PluginRegistry registry = new PluginRegistry()
                .register(new DiffTrackingPlugin(locale -> Optional.of(catalog)))
                .register(multiProvider);
        return TranslationPipeline.builder(registry).build();
    }

    private static TranslationRequest request(String locale) {
        return withProvider(TranslationRequest.of("en", List.of(locale), sources()));
    }

    private static TranslationRequest withProvider(TranslationRequest request) {
        return request.withPluginConfigs(Map.of(MultiProviderPlugin.NAME, Map.of("providers", List.of("stub:model"))));
    }

    private static Map<String, String> sources() {
        Map<String, String> sources = new LinkedHashMap<>();
        sources.put("greeting", "Hello");
        sources.put("farewell", "Goodbye");
        sources.put("title", "Title");
        return sources;
    }

    private static final class InMemoryCatalog implements CatalogTransformer {

        private final Map<String, String> entries;

        InMemoryCatalog(Map<String, String> entries) {
            this.entries = new LinkedHashMap<>(entries);
        }

        @Override
        public Map<String, String> flatten() {
            return Map.copyOf(entries);
        }

        @Override
        public boolean isTranslated(String key) {
            String value = entries.get(key);
            return value != null && !value.isBlank();
        }

        @Override
        public void updateString(String key, String value) {
            entries.put(key, value);
        }

        @Override
        public void save() {
        }
    }
}
