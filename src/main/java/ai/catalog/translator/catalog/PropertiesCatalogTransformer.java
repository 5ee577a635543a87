package ai.catalog.translator.catalog;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code .properties} catalog read and written as UTF-8. A key counts as translated when it has a
 * non-blank value.
 */
public class PropertiesCatalogTransformer implements CatalogTransformer {

    private static final Logger LOGGER = LoggerFactory.getLogger(PropertiesCatalogTransformer.class);

    private final Path file;
    private final Map<String, String> entries = new LinkedHashMap<>();
    private boolean dirty;

    public PropertiesCatalogTransformer(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        if (Files.exists(file)) {
            entries.putAll(read(file));
        }
    }

    /**
     * Reads a catalog file; a missing file is an empty catalog.
     */
    public static Map<String, String> read(Path file) {
        if (!Files.exists(file)) {
            return Map.of();
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to read catalog " + file, ex);
        }
        Map<String, String> result = new LinkedHashMap<>();
        properties.stringPropertyNames().stream().sorted().forEach(key -> result.put(key, properties.getProperty(key)));
        return result;
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized Map<String, String> flatten() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @Override
    public synchronized boolean isTranslated(String key) {
        String value = entries.get(key);
        return value != null && !value.isBlank();
    }

    @Override
    public synchronized void updateString(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        if (!value.equals(entries.put(key, value))) {
            dirty = true;
        }
    }

    @Override
    public synchronized void save() {
        if (!dirty && Files.exists(file)) {
            return;
        }
        Properties properties = new Properties();
        properties.putAll(entries);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                properties.store(writer, null);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write catalog " + file, ex);
        }
        dirty = false;
        LOGGER.info("Wrote {} entries to {}", entries.size(), file);
    }
}
