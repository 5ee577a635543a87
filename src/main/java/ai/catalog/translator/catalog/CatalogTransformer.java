package ai.catalog.translator.catalog;

import java.util.Map;

/**
 * A target-locale catalog file seen as a flat key to text map, whatever its on-disk format.
 */
public interface CatalogTransformer {

    /**
     * Current contents, keys in file order.
     */
    Map<String, String> flatten();

    boolean isTranslated(String key);

    void updateString(String key, String value);

    /**
     * Writes pending updates back to the underlying file.
     */
    void save();
}
