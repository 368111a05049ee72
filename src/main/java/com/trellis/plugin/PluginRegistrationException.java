package com.trellis.plugin;

/**
 * Thrown when {@code beforeRegister}, {@code register} or {@code afterRegister} fails. The plugin
 * is not recorded; routes, middleware and services it added before failing stay in place.
 */
public class PluginRegistrationException extends PluginException {
    public PluginRegistrationException(String pluginName, Throwable cause) {
        super(pluginName, "Failed to register plugin '" + pluginName + "': " + cause.getMessage(),
                cause);
    }
}
