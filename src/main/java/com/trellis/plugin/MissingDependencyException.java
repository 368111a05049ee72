package com.trellis.plugin;

/** Thrown when a plugin depends on a plugin that has not been registered yet. */
public class MissingDependencyException extends PluginException {
    private final String dependency;

    public MissingDependencyException(String pluginName, String dependency) {
        super(pluginName,
                "Plugin '" + pluginName + "' depends on '" + dependency + "' which is not registered");
        this.dependency = dependency;
    }

    public String getDependency() {
        return dependency;
    }
}
