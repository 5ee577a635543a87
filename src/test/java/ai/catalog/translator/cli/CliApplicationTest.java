package ai.catalog.translator.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ai.catalog.translator.catalog.PropertiesCatalogTransformer;
import ai.catalog.translator.config.ConfigLoader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CliApplicationTest {

    @TempDir
    Path tempDir;

    @Test
    void translatesMissingKeysIntoLocaleCatalogs() throws IOException {
        Path source = tempDir.resolve("messages_en.properties");
        Files.writeString(source, "greeting=Hello\nfarewell=Goodbye\n", StandardCharsets.UTF_8);
        Path output = tempDir.resolve("out");
        Files.createDirectories(output);
        Files.writeString(output.resolve("messages_ko.properties"), "greeting=안녕하세요\n", StandardCharsets.UTF_8);

        int exitCode = application().run(new String[] {
                "--source", source.toString(),
                "--target-locale", "ko,ja",
                "--output-dir", output.toString(),
                "--provider", "mock:test",
                "--translation-mode", "mock"
        });

        assertThat(exitCode).isZero();
        assertThat(PropertiesCatalogTransformer.read(output.resolve("messages_ko.properties")))
                .containsExactly(Map.entry("farewell", "[ko] Goodbye"), Map.entry("greeting", "안녕하세요"));
        assertThat(PropertiesCatalogTransformer.read(output.resolve("messages_ja.properties")))
                .containsExactly(Map.entry("farewell", "[ja] Goodbye"), Map.entry("greeting", "[ja] Hello"));
    }

    @Test
    void rejectsMissingSourceAsInvalidInput() {
        int exitCode = application().run(new String[] {"--target-locale", "ko"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void rejectsUnknownTranslationMode() {
        int exitCode = application().run(new String[] {"--source", "messages.properties", "--target-locale", "ko",
                "--translation-mode", "staging"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void rejectsTargetEqualToSourceLocale() throws IOException {
        Path source = tempDir.resolve("messages.properties");
        Files.writeString(source, "greeting=Hello\n", StandardCharsets.UTF_8);

        int exitCode = application().run(new String[] {"--source", source.toString(), "--target-locale", "en"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void derivesBaseNameWithoutSourceLocale() {
        assertThat(CliApplication.baseName(Path.of("i18n/messages_en.properties"), "en")).isEqualTo("messages");
        assertThat(CliApplication.baseName(Path.of("messages.properties"), "en")).isEqualTo("messages");
        assertThat(CliApplication.baseName(Path.of("_en.properties"), "en")).isEqualTo("_en");
    }

    private static CliApplication application() {
        return new CliApplication(new ConfigLoader(key -> Optional.empty()));
    }
}
