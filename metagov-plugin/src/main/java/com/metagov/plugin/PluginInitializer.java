package com.metagov.plugin;

/** One-time hook run right after an instance is created (never on re-enable). */
@FunctionalInterface
public interface PluginInitializer {

    PluginInitializer NO_OP = plugin -> { };

    void initialize(PluginContext plugin) throws Exception;
}
