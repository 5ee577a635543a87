package ai.catalog.translator.plugin;

/**
 * A plugin declares a dependency that is not registered.
 */
public class MissingDependencyException extends RuntimeException {

    public MissingDependencyException(String plugin, String dependency) {
        super("Plugin '%s' depends on '%s', which is not registered".formatted(plugin, dependency));
    }
}
