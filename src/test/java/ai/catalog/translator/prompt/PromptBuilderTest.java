package ai.catalog.translator.prompt;

import static org.assertj.core.api.Assertions.assertThat;

import ai.catalog.translator.model.SourceText;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class PromptBuilderTest {

    private static final PromptTemplates TEMPLATES = new PromptTemplates(
            "{sourceLanguage} -> {targetLanguage}\n{additionalRules}",
            "File: {filename}\nKeys: {keys}\n{strings}\n{unknown}");

    @Test
    void fillsTemplatesWithLanguagesRulesAndStrings() {
        Map<String, SourceText> texts = new LinkedHashMap<>();
        texts.put("title", SourceText.of("Settings"));
        texts.put("save", new SourceText("Save", Optional.of("button label"), Map.of("de", "Speichern")));

        Prompt prompt = new PromptBuilder(TEMPLATES).build("en", "pt-BR", texts, List.of("Use você"),
                Optional.of("messages.properties"), Optional.of("home"));

        assertThat(prompt.system()).isEqualTo("English -> Portuguese (Brazil)\n- Use você");
        assertThat(prompt.user()).isEqualTo("File: messages.properties\n"
                + "Keys: home.title, home.save\n"
                + "  - `home.title`: \"\"\"Settings\"\"\"\n"
                + "  - `home.save`: \"\"\"Save\"\"\"\n"
                + "    context: button label\n"
                + "    reference (de): \"\"\"Speichern\"\"\"\n"
                + "{unknown}");
    }

    @Test
    void substitutedValuesAreNotExpandedAgain() {
        Prompt prompt = new PromptBuilder(TEMPLATES).build("en", "ko", Map.of("k", SourceText.of("Hi {filename}")),
                List.of(), Optional.empty(), Optional.empty());

        assertThat(prompt.user()).contains("`k`: \"\"\"Hi {filename}\"\"\"").startsWith("File: unknown");
    }

    @Test
    void unknownLocaleCodesAreKeptAsTheyAre() {
        assertThat(PromptBuilder.languageName("ko")).isEqualTo("Korean");
        assertThat(PromptBuilder.languageName("xx")).isEqualTo("xx");
    }

    @Test
    void bundledTemplatesLoadFromTheClasspath() {
        PromptTemplates templates = PromptTemplates.loadDefault();

        assertThat(templates.system()).contains("{targetLanguage}").contains("<item>");
        assertThat(templates.user()).contains("{strings}");
    }
}
