package ai.catalog.translator.plugin;

import java.util.List;

/**
 * Plugin dependencies form a cycle. The cycle starts and ends with the same plugin name.
 */
public class CircularDependencyException extends RuntimeException {

    private final List<String> cycle;

    public CircularDependencyException(List<String> cycle) {
        super("Circular dependency detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
