package com.metagov.plugin;

import com.metagov.errors.PluginNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of plugin descriptors keyed by plugin type name. Filled during the startup registration
 * pass, then {@link #freeze() frozen}; lookups after that are plain table reads.
 */
public final class PluginRegistry {

    private static final Logger log = LoggerFactory.getLogger(PluginRegistry.class);

    private final Map<String, PluginDescriptor> descriptors = new ConcurrentHashMap<>();
    private volatile boolean frozen;

    /**
     * Registers a descriptor.
     *
     * @throws IllegalArgumentException if a plugin with the same name is already registered
     * @throws IllegalStateException    if the registry is frozen
     */
    public void register(PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (frozen) {
            throw new IllegalStateException("Plugin registry is frozen; cannot register " + descriptor.getName());
        }
        if (descriptors.putIfAbsent(descriptor.getName(), descriptor) != null) {
            throw new IllegalArgumentException("Plugin already registered: " + descriptor.getName());
        }
        log.info("Registered plugin {}", descriptor);
    }

    /**
     * Registers the provider's descriptor.
     *
     * @throws IllegalArgumentException if the provider's name and descriptor name differ, or on duplicate
     */
    public void register(PluginProvider provider) {
        Objects.requireNonNull(provider, "provider");
        PluginDescriptor descriptor = Objects.requireNonNull(provider.getDescriptor(), "descriptor");
        if (!descriptor.getName().equals(provider.getPluginName())) {
            throw new IllegalArgumentException("Provider " + provider.getClass().getName() + " declares plugin "
                    + provider.getPluginName() + " but its descriptor is named " + descriptor.getName());
        }
        register(descriptor);
    }

    /** Ends the registration pass; later registrations fail. */
    public void freeze() {
        frozen = true;
        log.info("Plugin registry frozen with {} plugin(s): {}", descriptors.size(), descriptors.keySet());
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Optional<PluginDescriptor> find(String name) {
        return Optional.ofNullable(name != null ? descriptors.get(name) : null);
    }

    /**
     * @throws PluginNotFoundException if no plugin has the name
     */
    public PluginDescriptor get(String name) {
        return find(name).orElseThrow(() ->
                new PluginNotFoundException(name, "Plugin '" + name + "' is not registered"));
    }

    public boolean contains(String name) {
        return name != null && descriptors.containsKey(name);
    }

    /** Registered plugin names, sorted. */
    public List<String> names() {
        List<String> names = new ArrayList<>(descriptors.keySet());
        Collections.sort(names);
        return names;
    }

    /** {@link PluginDescriptor#describe()} of every registered plugin, sorted by name. */
    public List<Map<String, Object>> describeAll() {
        List<Map<String, Object>> out = new ArrayList<>();
        for (String name : names()) {
            out.add(descriptors.get(name).describe());
        }
        return out;
    }

    public int size() {
        return descriptors.size();
    }
}
