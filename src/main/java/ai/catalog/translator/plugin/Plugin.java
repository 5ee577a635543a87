package ai.catalog.translator.plugin;

import java.util.List;
import java.util.Map;

/**
 * A named unit of pipeline behavior. Concrete plugins take one of three roles (middleware,
 * provider, observer); this type carries what the registry needs to order and configure them.
 */
public interface Plugin {

    /**
     * Unique name within a registry.
     */
    String name();

    /**
     * Higher values run first within a stage.
     */
    default int priority() {
        return 0;
    }

    /**
     * Names of plugins that must be booted before this one.
     */
    default List<String> dependencies() {
        return List.of();
    }

    default Map<String, Object> defaultConfig() {
        return Map.of();
    }
}
