package com.metagov.plugin;

/**
 * SPI for pluggable integrations. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.metagov.plugin.PluginProvider) or registered explicitly at startup. Each
 * provider contributes one plugin type; no core changes are required for new plugins.
 */
public interface PluginProvider {

    /** Plugin type name (e.g. "poll"). Must match {@link PluginDescriptor#getName()}. */
    String getPluginName();

    /**
     * Descriptor for the plugin. Typically built from env (e.g. a base url) in the provider constructor.
     */
    PluginDescriptor getDescriptor();

    /**
     * Whether this provider should be registered. Override to skip registration when env is unset.
     */
    default boolean isEnabled() {
        return true;
    }
}
