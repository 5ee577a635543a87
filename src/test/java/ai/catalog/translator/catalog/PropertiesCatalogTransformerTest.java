package ai.catalog.translator.catalog;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PropertiesCatalogTransformerTest {

    @TempDir
    Path tempDir;

    @Test
    void readsUtf8EntriesAndTreatsBlankValuesAsUntranslated() throws IOException {
        Path file = tempDir.resolve("messages_ko.properties");
        Files.writeString(file, "greeting=안녕하세요\nfarewell=\n", StandardCharsets.UTF_8);

        PropertiesCatalogTransformer catalog = new PropertiesCatalogTransformer(file);

        assertThat(catalog.flatten()).containsEntry("greeting", "안녕하세요").containsEntry("farewell", "");
        assertThat(catalog.isTranslated("greeting")).isTrue();
        assertThat(catalog.isTranslated("farewell")).isFalse();
        assertThat(catalog.isTranslated("missing")).isFalse();
    }

    @Test
    void savesUpdatesAndCreatesMissingDirectories() {
        Path file = tempDir.resolve("out").resolve("messages_ja.properties");
        PropertiesCatalogTransformer catalog = new PropertiesCatalogTransformer(file);

        catalog.updateString("greeting", "こんにちは");
        catalog.save();

        assertThat(PropertiesCatalogTransformer.read(file)).containsExactly(Map.entry("greeting", "こんにちは"));
    }

    @Test
    void missingFileReadsAsEmpty() {
        assertThat(PropertiesCatalogTransformer.read(tempDir.resolve("absent.properties"))).isEmpty();
    }
}
