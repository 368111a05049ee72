package com.trellis.plugin;

/** Thrown when a plugin name is registered a second time. */
public class DuplicatePluginException extends PluginException {
    public DuplicatePluginException(String pluginName) {
        super(pluginName, "Plugin '" + pluginName + "' is already registered");
    }
}
