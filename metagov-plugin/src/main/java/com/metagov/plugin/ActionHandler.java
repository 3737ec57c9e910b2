package com.metagov.plugin;

import java.util.Map;

/**
 * Body of a plugin action. Receives the calling instance's context and the (validated) parameters
 * and returns the action result, typically a map.
 */
@FunctionalInterface
public interface ActionHandler {

    Object handle(PluginContext plugin, Map<String, Object> parameters) throws Exception;
}
