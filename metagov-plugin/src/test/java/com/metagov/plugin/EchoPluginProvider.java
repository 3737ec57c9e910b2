package com.metagov.plugin;

import java.util.Map;

/** Discovered through META-INF/services in tests. */
public class EchoPluginProvider implements PluginProvider {

    @Override
    public String getPluginName() {
        return "echo";
    }

    @Override
    public PluginDescriptor getDescriptor() {
        return PluginDescriptor.builder("echo")
                .action(ActionDefinition.of("echo", (plugin, params) -> Map.of("echo", params)))
                .build();
    }
}
