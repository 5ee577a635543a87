package ai.catalog.translator.plugins;

import static org.assertj.core.api.Assertions.assertThat;

import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.model.TranslationResult;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.TranslationPipeline;
import ai.catalog.translator.plugin.PluginConfig;
import ai.catalog.translator.plugin.PluginRegistry;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ValidationPluginTest {

    private static final Set<String> ALL = Set.copyOf(ValidationPlugin.CHECKS);
    private static final PluginConfig DEFAULTS = PluginConfig.of(new ValidationPlugin().defaultConfig());

    @Test
    void soundTranslationHasNoIssues() {
        assertThat(ValidationPlugin.validate("Hello <b>{name}</b>, you have 3 messages",
                "안녕하세요 <b>{name}</b>님, 메시지가 3개 있습니다", "ko", ALL, DEFAULTS)).isEmpty();
    }

    @Test
    void reportsMissingMarkup() {
        List<String> issues = ValidationPlugin.validate("Hello <b>{name}</b>, you have 3 messages",
                "Hallo {name}, du hast 3 Nachrichten", "de", ALL, DEFAULTS);

        assertThat(issues).containsExactly("html_tag_count", "html_tags_missing");
    }

    @Test
    void reportsMissingVariablesAndPlaceholders() {
        assertThat(ValidationPlugin.validate("Welcome :user, {{count}} items cost $price", "환영합니다 :user",
                "ko", Set.of("variables"), DEFAULTS)).containsExactly("mustache_variables", "dollar_variables");
        assertThat(ValidationPlugin.validate("%s has %d items", "%s 항목", "ko", Set.of("placeholders"), DEFAULTS))
                .containsExactly("printf_placeholders");
        assertThat(ValidationPlugin.validate("Hi [name]", "안녕", "ko", Set.of("placeholders"), DEFAULTS))
                .containsExactly("named_placeholders");
    }

    @Test
    void reportsMissingLinksAndAddresses() {
        assertThat(ValidationPlugin.validate("See https://example.com or mail help@example.com", "참조하세요",
                "ko", Set.of("urls", "emails"), DEFAULTS)).containsExactly("urls_missing", "emails_missing");
    }

    @Test
    @DisplayName("numbers match regardless of decimal separator")
    void comparesNumbers() {
        assertThat(ValidationPlugin.validate("Version 2.5", "Version 2,5", "de", Set.of("numbers"), DEFAULTS)).isEmpty();
        assertThat(ValidationPlugin.validate("Version 2.5", "Version 3", "de", Set.of("numbers"), DEFAULTS))
                .containsExactly("numbers_mismatch");
    }

    @Test
    @DisplayName("length bounds are scaled per target language")
    void checksLengthRatio() {
        assertThat(ValidationPlugin.validate("Hi", "Hallo, wie geht es dir heute", "de", Set.of("length"), DEFAULTS))
                .containsExactly("length_too_long");
        assertThat(ValidationPlugin.validate("Configuration settings", "設定", "ja", Set.of("length"), DEFAULTS))
                .containsExactly("length_too_short");
        assertThat(ValidationPlugin.adjustmentFor("de-AT")).isEqualTo(1.3);
        assertThat(ValidationPlugin.adjustmentFor("pt")).isEqualTo(1.0);
    }

    @Test
    void issuesBecomeWarningsOrErrorsInStrictMode() {
        TranslationRequest request = TranslationRequest.of("en", List.of("ko"), Map.of("visit", "Visit https://example.com"));
        TranslationPipeline pipeline = TranslationPipeline.builder(new PluginRegistry().register(new ValidationPlugin()))
                .handler(PipelineStages.TRANSLATION, context -> context.putTranslation("ko", "visit", "방문하세요 여기", "stub"))
                .build();
        String expected = "Validation issues for 'visit' in locale 'ko': urls_missing";

        TranslationResult lenient = pipeline.translate(request.withPluginConfigs(
                Map.of(ValidationPlugin.NAME, Map.of("checks", List.of("urls")))));
        TranslationResult strict = pipeline.translate(request.withPluginConfigs(
                Map.of(ValidationPlugin.NAME, Map.of("checks", List.of("urls"), "strict_mode", true))));

        assertThat(lenient.warnings()).containsExactly(expected);
        assertThat(lenient.errors()).isEmpty();
        assertThat(strict.errors()).containsExactly(expected);
        assertThat(strict.translation("ko", "visit")).contains("방문하세요 여기");
    }

    @Test
    void cachedTranslationsAreNotValidated() {
        TranslationPipeline pipeline = TranslationPipeline.builder(new PluginRegistry().register(new ValidationPlugin()))
                .handler(PipelineStages.TRANSLATION, context -> context.markCached("ko", "visit", "방문"))
                .build();

        TranslationResult result = pipeline.translate(
                TranslationRequest.of("en", List.of("ko"), Map.of("visit", "Visit https://example.com")));

        assertThat(result.warnings()).isEmpty();
    }
}
