package com.metagov.plugin;

import com.metagov.community.Community;
import com.metagov.events.EventEmitter;
import com.metagov.events.PlatformEvent;
import com.metagov.identity.IdentityResolutionEngine;
import com.metagov.identity.LinkOptions;
import com.metagov.identity.LinkedAccount;
import com.metagov.state.KeyValueStateStore;

import java.util.Map;
import java.util.Objects;

/**
 * What plugin code may touch: its instance and config, its private state store, the driver event
 * channel and the identity engine scoped to this instance.
 */
public final class PluginContext {

    private final PluginInstance instance;
    private final KeyValueStateStore state;
    private final EventEmitter events;
    private final IdentityResolutionEngine identity;

    public PluginContext(PluginInstance instance, KeyValueStateStore state, EventEmitter events,
                         IdentityResolutionEngine identity) {
        this.instance = Objects.requireNonNull(instance, "instance");
        this.state = Objects.requireNonNull(state, "state");
        this.events = events;
        this.identity = identity;
    }

    public PluginInstance getInstance() {
        return instance;
    }

    public Community getCommunity() {
        return instance.getCommunity();
    }

    public Map<String, Object> getConfig() {
        return instance.getConfig();
    }

    /** Config value as string; null when absent. */
    public String getConfigValue(String key) {
        Object v = instance.getConfig().get(key);
        return v != null ? v.toString() : null;
    }

    public KeyValueStateStore getState() {
        return state;
    }

    /**
     * Emits a domain event with this plugin as source. Delivery failures are logged by the emitter.
     *
     * @return the event, or null when no emitter is wired
     */
    public PlatformEvent sendEventToDriver(String eventType, Map<String, Object> data, Map<String, Object> initiator) {
        if (events == null) {
            return null;
        }
        return events.emit(instance.getCommunity().getSlug(), instance.getPluginName(), eventType, data, initiator);
    }

    /** Links or upgrades a platform account found by this plugin; see {@link IdentityResolutionEngine#addLinkedAccount}. */
    public LinkedAccount addLinkedAccount(String platformIdentifier, LinkOptions options) {
        if (identity == null) {
            throw new IllegalStateException("Identity engine is not available to " + instance);
        }
        return identity.addLinkedAccount(instance, platformIdentifier, options);
    }
}
