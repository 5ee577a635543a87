package ai.catalog.translator.plugins;

import static org.assertj.core.api.Assertions.assertThat;

import ai.catalog.translator.catalog.StaticRuleProvider;
import ai.catalog.translator.decode.ItemFormat;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.pipeline.PipelineEvents;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.TranslationPipeline;
import ai.catalog.translator.plugin.PluginRegistry;
import ai.catalog.translator.translate.BackendResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StylePluginTest {

    @Test
    @DisplayName("style rules come before glossary rules in each locale's system prompt")
    void styleRulesReachTheSystemPrompt() {
        Map<String, String> systemPrompts = new ConcurrentHashMap<>();
        TranslationRequest request = TranslationRequest.of("en", List.of("ko", "de-AT"), Map.of("greeting", "Hello"))
                .withOptions(Map.of("style", "casual"))
                .withPluginConfigs(Map.of(
                        MultiProviderPlugin.NAME, Map.of("providers", List.of("mock:a")),
                        GlossaryPlugin.NAME, Map.of("rules", List.of("Never use emoji"))));

        try (MultiProviderPlugin multiProvider = new MultiProviderPlugin(provider -> (backendRequest, listener) -> {
            systemPrompts.put(backendRequest.targetLocale(), backendRequest.systemPrompt());
            return BackendResponse.of(ItemFormat.renderItem("greeting", "Hi"));
        })) {
            PluginRegistry registry = new PluginRegistry()
                    .register(new PromptPlugin())
                    .register(new StylePlugin())
                    .register(new GlossaryPlugin(StaticRuleProvider.empty()))
                    .register(multiProvider);
            TranslationPipeline.builder(registry).build().translate(request);
        }

        assertThat(systemPrompts.get("ko")).contains(
                "- Use casual, friendly language as if speaking to a friend.\n"
                        + "- Use 반말 (Korean honorific level). Formality level: informal.\n"
                        + "- Never use emoji");
        assertThat(systemPrompts.get("de-AT")).contains("- Use 'du' for second-person address.");
    }

    @Test
    void formalStylesUseTheFormalRegisterAndAppendTheCustomPrompt() {
        assertThat(StylePlugin.rulesFor("legal", "ja", Optional.of("Keep article numbers")))
                .containsExactly(
                        "Use precise legal terminology and formal structure appropriate for legal documents.",
                        "Use 敬語 (Japanese speech level). Keigo level: sonkeigo.",
                        "Keep article numbers");
        assertThat(StylePlugin.rulesFor("formal", "it", Optional.empty()))
                .containsExactly("Use formal, professional language appropriate for business communication.");
    }

    @Test
    void detectsTheStyleFromDomainMetadataBeforeWording() {
        assertThat(StylePlugin.detect(Optional.of("Medical"), "Sign the contract")).contains("medical");
        assertThat(StylePlugin.detect(Optional.empty(), "Sign the contract")).contains("legal");
        assertThat(StylePlugin.detect(Optional.empty(), "Call the API")).contains("technical");
        assertThat(StylePlugin.detect(Optional.empty(), "Wow!! Really?? Yes!! :)")).contains("casual");
        assertThat(StylePlugin.detect(Optional.empty(), "Save changes")).isEmpty();
    }

    @Test
    void unknownStylesFallBackToTheDefault() {
        Map<String, Object> applied = new ConcurrentHashMap<>();
        TranslationRequest request = TranslationRequest.of("en", List.of("fr"), Map.of("save", "Save changes"))
                .withOptions(Map.of("style", "pirate"))
                .withPluginConfigs(Map.of(StylePlugin.NAME, Map.of("default_style", "casual")));
        PluginRegistry registry = new PluginRegistry().register(new StylePlugin());

        TranslationPipeline.builder(registry)
                .on(PipelineEvents.stageCompleted(PipelineStages.PREPARATION), view -> view.pluginValue(StylePlugin.NAME, StylePlugin.APPLIED_STYLE)
                        .ifPresent(style -> applied.put("style", style)))
                .build()
                .translate(request);

        assertThat(applied).containsEntry("style", "casual");
    }
}
