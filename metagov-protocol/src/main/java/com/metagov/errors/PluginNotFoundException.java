package com.metagov.errors;

/** Thrown when a plugin type is not registered or no instance matches the lookup. */
public final class PluginNotFoundException extends NotFoundException {

    private final String pluginName;

    public PluginNotFoundException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
