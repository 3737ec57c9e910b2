package com.metagov.errors;

/** Thrown when the plugin type exists but does not declare the requested action. */
public final class UnknownActionException extends NotFoundException {

    private final String pluginName;
    private final String actionId;

    public UnknownActionException(String pluginName, String actionId) {
        super("No such action '" + actionId + "' for plugin '" + pluginName + "'");
        this.pluginName = pluginName;
        this.actionId = actionId;
    }

    public String getPluginName() {
        return pluginName;
    }

    public String getActionId() {
        return actionId;
    }
}
