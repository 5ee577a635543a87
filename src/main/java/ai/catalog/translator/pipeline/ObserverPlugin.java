package ai.catalog.translator.pipeline;

import ai.catalog.translator.plugin.Plugin;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Reacts to lifecycle events through a read-only view of the context.
 */
public interface ObserverPlugin extends Plugin {

    /**
     * Event name to handler.
     */
    Map<String, Consumer<ContextView>> subscriptions();
}
