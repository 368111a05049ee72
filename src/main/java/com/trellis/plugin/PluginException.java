package com.trellis.plugin;

/** Base class of plugin registration and lifecycle failures. */
public class PluginException extends RuntimeException {
    private final String pluginName;

    public PluginException(String pluginName, String message) {
        super(message);
        this.pluginName = pluginName;
    }

    public PluginException(String pluginName, String message, Throwable cause) {
        super(message, cause);
        this.pluginName = pluginName;
    }

    public String getPluginName() {
        return pluginName;
    }
}
