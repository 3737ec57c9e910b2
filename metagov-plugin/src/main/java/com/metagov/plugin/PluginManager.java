package com.metagov.plugin;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Collects plugin providers: explicit internal registration (shipped with the core) and providers
 * discovered on the classpath via {@link ServiceLoader}. {@link #registerAll(PluginRegistry)} runs the
 * registration pass: internal failures are fatal, discovered failures are logged and skipped.
 */
public final class PluginManager {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final List<PluginProvider> internalProviders = new ArrayList<>();
    private final List<PluginProvider> discoveredProviders = new ArrayList<>();

    /** Registers an internal plugin. */
    public void registerInternal(PluginProvider provider) {
        if (provider != null) {
            internalProviders.add(provider);
        }
    }

    /**
     * Discovers providers visible to the class loader. Providers whose class is already registered
     * internally are skipped. A provider that fails to instantiate is logged and skipped.
     *
     * @param classLoader loader to search; null = thread context loader
     */
    public void discover(ClassLoader classLoader) {
        ClassLoader cl = classLoader != null ? classLoader : Thread.currentThread().getContextClassLoader();
        Iterator<PluginProvider> it = ServiceLoader.load(PluginProvider.class, cl).iterator();
        int n = 0;
        while (true) {
            PluginProvider provider;
            try {
                if (!it.hasNext()) {
                    break;
                }
                provider = it.next();
            } catch (ServiceConfigurationError e) {
                log.error("Plugin provider failed to load (skipping): {}", e.getMessage(), e);
                continue;
            }
            if (isInternal(provider.getClass())) {
                log.debug("Provider {} already registered internally", provider.getClass().getName());
                continue;
            }
            discoveredProviders.add(provider);
            n++;
        }
        if (n > 0) {
            log.info("Discovered {} plugin provider(s) on the classpath", n);
        }
    }

    private boolean isInternal(Class<?> type) {
        for (PluginProvider p : internalProviders) {
            if (p.getClass().equals(type)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Registers every enabled provider. Internal providers first; a failing internal provider aborts
     * startup. A failing discovered provider (bad descriptor, duplicate name) is logged and skipped.
     *
     * @return number of plugins registered
     */
    public int registerAll(PluginRegistry registry) {
        int n = 0;
        for (PluginProvider p : internalProviders) {
            if (!p.isEnabled()) {
                log.info("Internal plugin {} is disabled; skipping", p.getPluginName());
                continue;
            }
            registry.register(p);
            n++;
        }
        for (PluginProvider p : discoveredProviders) {
            try {
                if (!p.isEnabled()) {
                    log.info("Plugin {} is disabled; skipping", p.getPluginName());
                    continue;
                }
                registry.register(p);
                n++;
            } catch (RuntimeException e) {
                log.error("Plugin provider {} failed to register (skipping): {}",
                        p.getClass().getName(), e.getMessage(), e);
            }
        }
        return n;
    }

    public List<PluginProvider> getInternalProviders() {
        return new ArrayList<>(internalProviders);
    }

    public List<PluginProvider> getDiscoveredProviders() {
        return new ArrayList<>(discoveredProviders);
    }
}
