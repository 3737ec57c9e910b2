package com.metagov.plugin;

import com.metagov.community.Community;
import com.metagov.errors.PluginInternalException;
import com.metagov.errors.PluginNotFoundException;
import com.metagov.events.EventEmitter;
import com.metagov.identity.IdentityResolutionEngine;
import com.metagov.schema.Parameters;
import com.metagov.state.KeyValueStateStore;
import com.metagov.state.StateStoreRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Creates, updates and deletes per-community plugin instances. Each instance owns a private state
 * store created with it and deleted with it. Enable and disable on one (plugin, community, community
 * platform id) tuple are serialized.
 */
public final class PluginInstanceManager {

    private static final Logger log = LoggerFactory.getLogger(PluginInstanceManager.class);

    private record InstanceKey(long communityId, String pluginName, String communityPlatformId) {
    }

    private final PluginRegistry registry;
    private final StateStoreRepository stateStores;
    private final EventEmitter events;
    private final IdentityResolutionEngine identity;

    private final Map<Long, PluginInstance> byId = new ConcurrentHashMap<>();
    private final Map<InstanceKey, Long> byKey = new ConcurrentHashMap<>();
    private final Map<InstanceKey, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final List<Consumer<PluginInstance>> deletionListeners = new CopyOnWriteArrayList<>();

    public PluginInstanceManager(PluginRegistry registry, StateStoreRepository stateStores, EventEmitter events,
                                 IdentityResolutionEngine identity) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.stateStores = Objects.requireNonNull(stateStores, "stateStores");
        this.events = events;
        this.identity = identity;
    }

    /**
     * Creates the instance, or updates its config when one already exists for the tuple. The
     * descriptor's initializer runs after creation only; if it fails the new instance and its state
     * are removed and the failure is rethrown.
     *
     * @throws PluginNotFoundException if the plugin type is not registered
     * @throws com.metagov.errors.InvalidParametersException if the config does not match the config schema
     */
    public PluginInstance enable(String pluginName, Community community, Map<String, Object> config) {
        Objects.requireNonNull(community, "community");
        PluginDescriptor descriptor = registry.get(pluginName);
        Parameters cfg = Parameters.coerce(config, descriptor.getConfigSchema(), pluginName + " config");
        String cpid = descriptor.getCommunityPlatformIdKey() != null
                ? cfg.getString(descriptor.getCommunityPlatformIdKey()) : null;
        InstanceKey key = new InstanceKey(community.getId(), pluginName, cpid);

        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            Long existingId = byKey.get(key);
            if (existingId != null) {
                PluginInstance updated = byId.get(existingId).withConfig(cfg.asMap());
                byId.put(existingId, updated);
                log.info("Updated config of {}", updated);
                return updated;
            }
            KeyValueStateStore state = stateStores.create();
            PluginInstance created = new PluginInstance(ids.incrementAndGet(), pluginName, descriptor.getAuthType(),
                    community, cpid, cfg.asMap(), state.getId());
            byId.put(created.getId(), created);
            byKey.put(key, created.getId());
            try {
                descriptor.getInitializer().initialize(contextFor(created));
            } catch (Exception e) {
                byKey.remove(key);
                byId.remove(created.getId());
                stateStores.delete(state.getId());
                log.warn("Initialize failed for {}; instance removed: {}", created, e.getMessage());
                throw asRuntime(e, "Failed to initialize " + created);
            }
            log.info("Enabled {}", created);
            return created;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Looks up an instance. With an id, the instance must also match the plugin name and community.
     * Without one, the (plugin, community, cpid) tuple is matched; when no cpid is given and no instance
     * has a null cpid, the only instance of the type in the community is returned.
     *
     * @throws PluginNotFoundException if the type is unregistered or nothing matches
     * @throws IllegalStateException   if no cpid is given and several instances match
     */
    public PluginInstance get(String pluginName, Community community, String communityPlatformId, Long id) {
        registry.get(pluginName);
        Objects.requireNonNull(community, "community");
        if (id != null) {
            PluginInstance instance = byId.get(id);
            if (instance == null || !instance.getPluginName().equals(pluginName)
                    || instance.getCommunity().getId() != community.getId()) {
                throw notFound(pluginName, community, "id " + id);
            }
            return instance;
        }
        Long exact = byKey.get(new InstanceKey(community.getId(), pluginName, communityPlatformId));
        if (exact != null) {
            return byId.get(exact);
        }
        if (communityPlatformId != null) {
            throw notFound(pluginName, community, "community platform id " + communityPlatformId);
        }
        List<PluginInstance> candidates = byId.values().stream()
                .filter(p -> p.getPluginName().equals(pluginName) && p.getCommunity().getId() == community.getId())
                .collect(Collectors.toList());
        if (candidates.isEmpty()) {
            throw notFound(pluginName, community, null);
        }
        if (candidates.size() > 1) {
            throw new IllegalStateException("Several " + pluginName + " plugins are enabled for '" + community
                    + "'; a community platform id is required");
        }
        return candidates.get(0);
    }

    public PluginInstance get(String pluginName, Community community) {
        return get(pluginName, community, null, null);
    }

    public Optional<PluginInstance> findById(long id) {
        return Optional.ofNullable(byId.get(id));
    }

    /**
     * Deletes the instance. Deletion listeners (processes) run first, the state store goes last.
     *
     * @throws PluginNotFoundException if nothing matches
     */
    public PluginInstance disable(String pluginName, Community community, String communityPlatformId, Long id) {
        PluginInstance instance = get(pluginName, community, communityPlatformId, id);
        InstanceKey key = keyOf(instance);
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            delete(instance);
        } finally {
            lock.unlock();
        }
        return instance;
    }

    /** Deletes every instance of the community. */
    public void deleteCommunity(Community community) {
        for (PluginInstance instance : list(community)) {
            delete(instance);
        }
    }

    private void delete(PluginInstance instance) {
        if (byId.get(instance.getId()) == null) {
            return;
        }
        for (Consumer<PluginInstance> listener : deletionListeners) {
            listener.accept(instance);
        }
        byKey.remove(keyOf(instance));
        byId.remove(instance.getId());
        stateStores.delete(instance.getStateId());
        log.info("Disabled {}", instance);
    }

    /** Instances of the community, oldest first. */
    public List<PluginInstance> list(Community community) {
        return byId.values().stream()
                .filter(p -> p.getCommunity().getId() == community.getId())
                .sorted(Comparator.comparingLong(PluginInstance::getId))
                .collect(Collectors.toList());
    }

    public List<PluginInstance> listAll() {
        List<PluginInstance> out = new ArrayList<>(byId.values());
        out.sort(Comparator.comparingLong(PluginInstance::getId));
        return out;
    }

    /** Registers a listener invoked for every deleted instance, before its state is removed. */
    public void addDeletionListener(Consumer<PluginInstance> listener) {
        if (listener != null) {
            deletionListeners.add(listener);
        }
    }

    /** Context handed to plugin code running on behalf of the instance. */
    public PluginContext contextFor(PluginInstance instance) {
        PluginInstance current = byId.getOrDefault(instance.getId(), instance);
        return new PluginContext(current, stateStores.get(current.getStateId()), events, identity);
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    private static InstanceKey keyOf(PluginInstance instance) {
        return new InstanceKey(instance.getCommunity().getId(), instance.getPluginName(),
                instance.getCommunityPlatformId());
    }

    private static PluginNotFoundException notFound(String pluginName, Community community, String detail) {
        String msg = "Plugin '" + pluginName + "' is not enabled for '" + community + "'"
                + (detail != null ? " (" + detail + ")" : "");
        return new PluginNotFoundException(pluginName, msg);
    }

    static RuntimeException asRuntime(Exception e, String message) {
        if (e instanceof RuntimeException) {
            return (RuntimeException) e;
        }
        return new PluginInternalException(message + ": " + e.getMessage(), e);
    }
}
