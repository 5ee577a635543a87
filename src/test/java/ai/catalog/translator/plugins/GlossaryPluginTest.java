package ai.catalog.translator.plugins;

import static org.assertj.core.api.Assertions.assertThat;

import ai.catalog.translator.catalog.StaticRuleProvider;
import ai.catalog.translator.decode.ItemFormat;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.pipeline.TranslationPipeline;
import ai.catalog.translator.plugin.PluginRegistry;
import ai.catalog.translator.translate.BackendResponse;
import ai.catalog.translator.translate.TranslationListener;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.Test;

class GlossaryPluginTest {

    @Test
    void rulesReachTheSystemPromptOfTheirLocale() {
        Map<String, String> systemPrompts = new ConcurrentHashMap<>();
        StaticRuleProvider rules = new StaticRuleProvider(Map.of(
                StaticRuleProvider.ALL_LOCALES, List.of("Keep 'Acme' untranslated"),
                "ko", List.of("Use formal speech")));
        TranslationRequest request = TranslationRequest.of("en", List.of("ko", "ja"), Map.of("greeting", "Hello Acme"))
                .withPluginConfigs(Map.of(
                        MultiProviderPlugin.NAME, Map.of("providers", List.of("mock:a")),
                        GlossaryPlugin.NAME, Map.of("rules", List.of("Never use emoji"))));

        try (MultiProviderPlugin multiProvider = new MultiProviderPlugin(provider -> (backendRequest, listener) -> {
            systemPrompts.put(backendRequest.targetLocale(), backendRequest.systemPrompt());
            return BackendResponse.of(ItemFormat.renderItem("greeting", "Acme"));
        })) {
            PluginRegistry registry = new PluginRegistry()
                    .register(new PromptPlugin())
                    .register(new GlossaryPlugin(rules))
                    .register(multiProvider);
            TranslationPipeline.builder(registry).build().translate(request, TranslationListener.NO_OP);
        }

        assertThat(systemPrompts.get("ko"))
                .contains("- Keep 'Acme' untranslated\n- Use formal speech\n- Never use emoji")
                .contains("to Korean");
        assertThat(systemPrompts.get("ja"))
                .contains("- Keep 'Acme' untranslated\n- Never use emoji")
                .doesNotContain("formal speech");
    }

    @Test
    void reportsGeneratedPromptsToTheListener() {
        List<String> prompts = Collections.synchronizedList(new ArrayList<>());
        TranslationListener listener = new TranslationListener() {
            @Override
            public void onPromptGenerated(PromptType type, String prompt) {
                prompts.add(type + ":" + prompt);
            }
        };
        TranslationRequest request = TranslationRequest.of("en", List.of("ko", "ja"), Map.of("greeting", "Hello"))
                .withPluginConfigs(Map.of(MultiProviderPlugin.NAME, Map.of("providers", List.of("mock:a"))));

        try (MultiProviderPlugin multiProvider = new MultiProviderPlugin(provider -> (backendRequest, backendListener) ->
                BackendResponse.of(ItemFormat.renderItem("greeting", "Hi")))) {
            PluginRegistry registry = new PluginRegistry()
                    .register(new PromptPlugin())
                    .register(new GlossaryPlugin(StaticRuleProvider.empty()))
                    .register(multiProvider);
            TranslationPipeline.builder(registry).build().translate(request, listener);
        }

        assertThat(prompts).hasSize(4);
        assertThat(prompts).filteredOn(prompt -> prompt.startsWith("SYSTEM:")).hasSize(2);
        assertThat(prompts).filteredOn(prompt -> prompt.startsWith("USER:"))
                .hasSize(2)
                .allSatisfy(prompt -> assertThat(prompt).contains("greeting"));
    }
}
