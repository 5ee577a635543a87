package ai.catalog.translator.plugin;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds plugins by name, orders them by their declared dependencies and keeps per-tenant
 * overrides.
 *
 * <p>Registration is closed once {@link #seal()} has been called (pipelines do this when they are
 * constructed); afterwards the plugin set and its order are read-only and safe to share between
 * concurrent requests. Tenant overrides stay mutable and never touch the registered instances or
 * their global configuration.
 */
public class PluginRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<String, Plugin> plugins = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> globalConfigs = new HashMap<>();
    private final Map<String, Map<String, TenantOverride>> tenantOverrides = new ConcurrentHashMap<>();
    private volatile boolean sealed;

    public PluginRegistry register(Plugin plugin) {
        return register(plugin, Map.of());
    }

    public synchronized PluginRegistry register(Plugin plugin, Map<String, Object> config) {
        Objects.requireNonNull(plugin, "plugin");
        if (sealed) {
            throw new IllegalStateException("Plugin registry is sealed; cannot register " + plugin.name());
        }
        String name = requireNonBlank(plugin.name(), "plugin name");
        if (plugins.containsKey(name)) {
            throw new IllegalArgumentException("Plugin '" + name + "' is already registered");
        }
        plugins.put(name, plugin);
        globalConfigs.put(name, config == null ? Map.of() : Map.copyOf(config));
        LOGGER.debug("Registered plugin {} (priority {}, depends on {})", name, plugin.priority(), plugin.dependencies());
        return this;
    }

    public synchronized void seal() {
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    public synchronized Optional<Plugin> get(String name) {
        return Optional.ofNullable(plugins.get(name));
    }

    public synchronized boolean has(String name) {
        return plugins.containsKey(name);
    }

    public synchronized Collection<Plugin> all() {
        return List.copyOf(plugins.values());
    }

    /**
     * Orders plugins so that every plugin follows all of its dependencies. Plugins without
     * constraints between them keep registration order.
     *
     * @throws CircularDependencyException naming the cycle when no such order exists
     * @throws MissingDependencyException when a dependency is not registered
     */
    public synchronized List<Plugin> resolveOrder() {
        List<Plugin> ordered = new ArrayList<>(plugins.size());
        Set<String> visited = new HashSet<>();
        Set<String> visiting = new LinkedHashSet<>();
        for (String name : plugins.keySet()) {
            visit(name, visited, visiting, ordered);
        }
        return Collections.unmodifiableList(ordered);
    }

    private void visit(String name, Set<String> visited, Set<String> visiting, List<Plugin> ordered) {
        if (visited.contains(name)) {
            return;
        }
        if (visiting.contains(name)) {
            List<String> path = new ArrayList<>(visiting);
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(name), path.size()));
            cycle.add(name);
            throw new CircularDependencyException(cycle);
        }
        Plugin plugin = plugins.get(name);
        visiting.add(name);
        for (String dependency : plugin.dependencies()) {
            if (!plugins.containsKey(dependency)) {
                throw new MissingDependencyException(name, dependency);
            }
            visit(dependency, visited, visiting, ordered);
        }
        visiting.remove(name);
        visited.add(name);
        ordered.add(plugin);
    }

    public void enableForTenant(String tenantId, String pluginName) {
        enableForTenant(tenantId, pluginName, Map.of());
    }

    public void enableForTenant(String tenantId, String pluginName, Map<String, Object> config) {
        requireRegistered(pluginName);
        overridesFor(tenantId).put(pluginName, new TenantOverride(true, config));
    }

    public void disableForTenant(String tenantId, String pluginName) {
        requireRegistered(pluginName);
        overridesFor(tenantId).compute(pluginName, (key, existing) ->
                new TenantOverride(false, existing == null ? Map.of() : existing.config()));
    }

    public void configureForTenant(String tenantId, String pluginName, Map<String, Object> config) {
        requireRegistered(pluginName);
        overridesFor(tenantId).compute(pluginName, (key, existing) ->
                new TenantOverride(existing == null || existing.enabled(), config));
    }

    /**
     * Plugins are enabled for every tenant unless explicitly disabled.
     */
    public boolean isEnabledForTenant(String tenantId, String pluginName) {
        if (tenantId == null) {
            return true;
        }
        TenantOverride override = tenantOverrides.getOrDefault(tenantId, Map.of()).get(pluginName);
        return override == null || override.enabled();
    }

    /**
     * Effective configuration: plugin defaults, then global registration config, then the tenant's
     * override.
     */
    public PluginConfig configFor(String pluginName, Optional<String> tenantId) {
        Plugin plugin;
        Map<String, Object> global;
        synchronized (this) {
            plugin = plugins.get(pluginName);
            global = globalConfigs.getOrDefault(pluginName, Map.of());
        }
        if (plugin == null) {
            throw new IllegalArgumentException("Plugin '" + pluginName + "' is not registered");
        }
        PluginConfig config = PluginConfig.of(plugin.defaultConfig()).merge(global);
        if (tenantId != null && tenantId.isPresent()) {
            TenantOverride override = tenantOverrides.getOrDefault(tenantId.get(), Map.of()).get(pluginName);
            if (override != null) {
                config = config.merge(override.config());
            }
        }
        return config;
    }

    private Map<String, TenantOverride> overridesFor(String tenantId) {
        return tenantOverrides.computeIfAbsent(requireNonBlank(tenantId, "tenantId"), key -> new ConcurrentHashMap<>());
    }

    private void requireRegistered(String pluginName) {
        if (!has(pluginName)) {
            throw new IllegalArgumentException("Plugin '" + pluginName + "' is not registered");
        }
    }

    private static String requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }

    private record TenantOverride(boolean enabled, Map<String, Object> config) {

        private TenantOverride {
            config = config == null ? Map.of() : Map.copyOf(config);
        }
    }
}
