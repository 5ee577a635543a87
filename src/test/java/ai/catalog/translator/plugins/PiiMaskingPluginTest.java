package ai.catalog.translator.plugins;

import static org.assertj.core.api.Assertions.assertThat;

import ai.catalog.translator.model.SourceText;
import ai.catalog.translator.model.TranslationRequest;
import ai.catalog.translator.model.TranslationResult;
import ai.catalog.translator.pipeline.PipelineStages;
import ai.catalog.translator.pipeline.TranslationContext;
import ai.catalog.translator.pipeline.TranslationPipeline;
import ai.catalog.translator.plugin.PluginRegistry;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PiiMaskingPluginTest {

    private final Map<String, String> sentTexts = new ConcurrentHashMap<>();

    @Test
    @DisplayName("personal data never reaches the translation stage and is restored in the result")
    void masksBeforeTranslationAndRestoresAfterwards() {
        TranslationResult result = pipeline().translate(
                TranslationRequest.of("en", List.of("ko"), Map.of("contact", "Write to jane@example.com or jane@example.com")));

        assertThat(sentTexts.get("contact")).isEqualTo("Write to __PII_EMAIL_1__ or __PII_EMAIL_1__");
        assertThat(result.translation("ko", "contact")).contains("[ko] Write to jane@example.com or jane@example.com");
    }

    @Test
    void masksCardNumbersOnlyWhenTheChecksumIsValid() {
        pipeline().translate(TranslationRequest.of("en", List.of("ko"), Map.of(
                "valid", "Card 4111 1111 1111 1111 on file",
                "invalid", "Order 1234567890123 shipped")));

        assertThat(sentTexts.get("valid")).isEqualTo("Card __PII_CARD_1__ on file");
        assertThat(sentTexts.get("invalid")).isEqualTo("Order 1234567890123 shipped");
    }

    @Test
    void urlsAreMaskedOnlyWhenEnabled() {
        TranslationRequest request = TranslationRequest.of("en", List.of("ko"), Map.of("docs", "See https://example.com/docs"));

        pipeline().translate(request);
        assertThat(sentTexts.get("docs")).isEqualTo("See https://example.com/docs");

        pipeline().translate(request.withPluginConfigs(Map.of(PiiMaskingPlugin.NAME, Map.of("mask_urls", true))));
        assertThat(sentTexts.get("docs")).isEqualTo("See __PII_URL_1__");
    }

    @Test
    void masksPhoneNumbersAndSocialSecurityNumbers() {
        pipeline().translate(TranslationRequest.of("en", List.of("ko"), Map.of(
                "support", "Call (555) 123-4567, SSN 123-45-6789")));

        assertThat(sentTexts.get("support")).doesNotContain("555").doesNotContain("6789").contains("__PII_PHONE_").contains("__PII_SSN_");
    }

    @Test
    void luhnChecksum() {
        assertThat(PiiMaskingPlugin.passesLuhn("4111-1111-1111-1111")).isTrue();
        assertThat(PiiMaskingPlugin.passesLuhn("4111-1111-1111-1112")).isFalse();
        assertThat(PiiMaskingPlugin.passesLuhn("4111")).isFalse();
    }

    @Test
    void unmaskReplacesEveryOccurrence() {
        String restored = PiiMaskingPlugin.unmask("__PII_EMAIL_1__ / __PII_EMAIL_1__", Map.of("__PII_EMAIL_1__", "a@b.io"));

        assertThat(restored).isEqualTo("a@b.io / a@b.io");
    }

    private TranslationPipeline pipeline() {
        return TranslationPipeline.builder(new PluginRegistry().register(new PiiMaskingPlugin()))
                .handler(PipelineStages.TRANSLATION, this::translate)
                .build();
    }

    private void translate(TranslationContext context) {
        for (Map.Entry<String, SourceText> entry : context.texts().entrySet()) {
            sentTexts.put(entry.getKey(), entry.getValue().text());
            context.putTranslation("ko", entry.getKey(), "[ko] " + entry.getValue().text(), "stub");
        }
    }
}
