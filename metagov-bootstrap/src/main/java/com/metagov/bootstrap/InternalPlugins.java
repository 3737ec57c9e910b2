package com.metagov.bootstrap;

import com.metagov.config.MetagovConfig;
import com.metagov.plugin.PluginManager;
import com.metagov.plugin.poll.PollPluginProvider;

/**
 * Plugins shipped with the core. Registered explicitly so a failure aborts startup; other plugins
 * come in through {@link PluginManager#discover(ClassLoader)}.
 */
public final class InternalPlugins {

    private InternalPlugins() {
    }

    public static PluginManager createPluginManager(MetagovConfig config) {
        PluginManager manager = new PluginManager();
        manager.registerInternal(new PollPluginProvider(config));
        return manager;
    }
}
