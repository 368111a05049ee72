package com.trellis.plugin;

import java.util.Collections;
import java.util.Map;

/**
 * Interface for plugins that can be registered with a Trellis application.
 * Plugins are self-contained feature bundles that add routes, middleware and services, and take
 * part in an ordered startup and shutdown sequence.
 *
 * <p>Hooks run in this order for a single plugin: {@code beforeRegister}, {@code register},
 * {@code afterRegister}, then {@code beforeStart}, {@code afterStart} when plugins are started and
 * {@code beforeStop}, {@code afterStop} when they are stopped.
 */
public interface Plugin {

    /**
     * Gets the metadata of the plugin.
     *
     * @return the metadata, whose name must be unique within a manager
     */
    PluginMetadata getMetadata();

    /**
     * Registers the plugin's routes, middleware and services.
     *
     * @param context the context scoped to this plugin
     * @throws Exception if registration fails
     */
    void register(PluginContext context) throws Exception;

    /**
     * Gets the default configuration. Registration options override these values.
     *
     * @return the default configuration
     */
    default Map<String, Object> getDefaultConfig() {
        return Collections.emptyMap();
    }

    default void beforeRegister(PluginContext context) throws Exception {
    }

    default void afterRegister(PluginContext context) throws Exception {
    }

    default void beforeStart(PluginContext context) throws Exception {
    }

    default void afterStart(PluginContext context) throws Exception {
    }

    default void beforeStop(PluginContext context) throws Exception {
    }

    default void afterStop(PluginContext context) throws Exception {
    }

    /**
     * Gets the name of the plugin.
     *
     * @return the plugin name
     */
    default String getName() {
        return getMetadata().getName();
    }

    /**
     * Starts building a plugin from lambdas.
     *
     * @param name    the plugin name
     * @param version the plugin version
     * @return the builder
     */
    static PluginBuilder builder(String name, String version) {
        return new PluginBuilder().name(name).version(version);
    }
}
