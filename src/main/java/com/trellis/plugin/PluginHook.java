package com.trellis.plugin;

/** A lifecycle callback receiving the plugin's own context. */
@FunctionalInterface
public interface PluginHook {
    void run(PluginContext context) throws Exception;
}
