package com.metagov.bootstrap;

import com.metagov.community.CommunityRepository;
import com.metagov.config.MetagovConfig;
import com.metagov.events.DriverEventForwarder;
import com.metagov.events.EventEmitter;
import com.metagov.identity.IdentityResolutionEngine;
import com.metagov.plugin.ActionDispatcher;
import com.metagov.plugin.PluginInstanceManager;
import com.metagov.plugin.PluginManager;
import com.metagov.plugin.PluginRegistry;
import com.metagov.process.GovernanceProcessEngine;
import com.metagov.process.ProcessUpdateSweep;
import com.metagov.state.StateStoreRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup for Metagov: runs the plugin registration pass once, freezes the registry and wires the
 * repositories, engines and event emitter into a {@link Metagov} runtime.
 */
public final class MetagovBootstrap {

    private static final Logger log = LoggerFactory.getLogger(MetagovBootstrap.class);

    private MetagovBootstrap() {
    }

    /** Loads configuration from environment and initializes. */
    public static Metagov initialize() {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(MetagovConfig.fromEnvironment());
    }

    /**
     * Registers internal plugins (failure is fatal) and, when enabled, plugins discovered on the
     * classpath (failures are logged and skipped), then builds the runtime.
     */
    public static Metagov initialize(MetagovConfig config) {
        PluginManager pluginManager = InternalPlugins.createPluginManager(config);
        if (config.isLoadDiscoveredPlugins()) {
            pluginManager.discover(MetagovBootstrap.class.getClassLoader());
        }
        PluginRegistry registry = new PluginRegistry();
        int count = pluginManager.registerAll(registry);
        registry.freeze();
        log.info("Bootstrap: registered {} plugin(s): {}", count, registry.names());

        DriverEventForwarder forwarder = null;
        if (config.getDriverEventReceiverUrl() != null) {
            forwarder = new DriverEventForwarder(config.getDriverEventReceiverUrl(), config.getEventTimeout());
            log.info("Bootstrap: forwarding events to {}", forwarder.getReceiverUri());
        } else {
            log.warn("Bootstrap: METAGOV_DRIVER_EVENT_RECEIVER_URL not set; events are not forwarded to the driver");
        }
        EventEmitter events = new EventEmitter(forwarder);
        MeterRegistry meters = new SimpleMeterRegistry();

        CommunityRepository communities = new CommunityRepository();
        StateStoreRepository stateStores = new StateStoreRepository();
        IdentityResolutionEngine identity = new IdentityResolutionEngine();
        PluginInstanceManager instances = new PluginInstanceManager(registry, stateStores, events, identity);
        ActionDispatcher dispatcher = new ActionDispatcher(registry, instances, meters);
        GovernanceProcessEngine processes = new GovernanceProcessEngine(instances, stateStores, meters,
                config.getProcessStartTimeout());
        ProcessUpdateSweep sweep = new ProcessUpdateSweep(processes, config.getSweepParallelism());

        communities.addDeletionListener(instances::deleteCommunity);
        communities.addDeletionListener(identity::deleteCommunity);

        log.info("Bootstrap: ready (start timeout {}s, sweep parallelism {})",
                config.getProcessStartTimeout().toSeconds(), config.getSweepParallelism());
        return new Metagov(config, registry, communities, stateStores, identity, instances, dispatcher,
                processes, sweep, events, meters);
    }
}
