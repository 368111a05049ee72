package com.trellis.plugin;

import com.trellis.core.Trellis;
import com.trellis.middleware.MiddlewarePipeline;
import com.trellis.routing.Router;
import com.trellis.util.LogUtil;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registers plugins, validates their dependencies and drives their lifecycle hooks.
 *
 * <p>Registration order matters: a dependency must be registered before its dependents, there is
 * no deferred resolution. Start hooks run in registration order, stop hooks in reverse order.
 */
public class PluginManager {
    private static final Logger logger = LoggerFactory.getLogger(PluginManager.class);

    private final Trellis server;
    private final Router router;
    private final MiddlewarePipeline pipeline;
    private final ServiceRegistry services = new ServiceRegistry();
    private final Map<String, Registration> registrations = new LinkedHashMap<>();
    private boolean started;

    /**
     * Creates a plugin manager.
     *
     * @param server   the owning application, may be null for standalone use
     * @param router   the route table plugins add routes to
     * @param pipeline the pipeline plugins add middleware to
     */
    public PluginManager(Trellis server, Router router, MiddlewarePipeline pipeline) {
        this.server = server;
        this.router = router;
        this.pipeline = pipeline;
    }

    public void register(Plugin plugin) {
        register(plugin, null);
    }

    /**
     * Registers a plugin: duplicate check, dependency check, then {@code beforeRegister},
     * {@code register} and {@code afterRegister} against a fresh context.
     *
     * @param plugin  the plugin
     * @param options prefix and configuration overrides, may be null
     * @throws DuplicatePluginException    if the name is taken
     * @throws MissingDependencyException  if a dependency is not registered yet
     * @throws PluginRegistrationException if a registration hook fails
     */
    public synchronized void register(Plugin plugin, PluginRegistrationOptions options) {
        PluginMetadata metadata = plugin.getMetadata();
        String name = metadata.getName();

        if (registrations.containsKey(name)) {
            throw new DuplicatePluginException(name);
        }
        for (String dependency : metadata.getDependencies()) {
            Registration dep = registrations.get(dependency);
            if (dep == null || !dep.state.isRegistered()) {
                throw new MissingDependencyException(name, dependency);
            }
        }

        logger.info(LogUtil.plugin("Registering", name, metadata.getVersion()));
        PluginContext context = new PluginContext(metadata, server, router, pipeline, services,
                plugin.getDefaultConfig(), options);
        Registration registration = new Registration(plugin, context);
        registrations.put(name, registration);
        try {
            plugin.beforeRegister(context);
            plugin.register(context);
            plugin.afterRegister(context);
        } catch (Exception e) {
            registrations.remove(name);
            logger.error(LogUtil.error("Registration of plugin " + name + " failed"), e);
            throw new PluginRegistrationException(name, e);
        }
        registration.state = PluginState.REGISTERED;
        context.getLogger().debug("Plugin registered successfully");
    }

    /**
     * Runs every {@code beforeStart} hook in registration order, then every {@code afterStart}.
     *
     * @throws IllegalStateException   if already started
     * @throws LifecycleHookException  if a hook fails; later hooks do not run
     */
    public synchronized void start() {
        if (started) {
            throw new IllegalStateException("Plugin manager is already started");
        }
        List<Registration> order = new ArrayList<>(registrations.values());
        for (Registration registration : order) {
            registration.state = PluginState.STARTING;
            logger.info(LogUtil.plugin("Starting", registration.name(), null));
            runHook(registration, "beforeStart");
        }
        started = true;
        for (Registration registration : order) {
            runHook(registration, "afterStart");
            registration.state = PluginState.STARTED;
        }
        logger.info(LogUtil.success("Plugin manager started with " + order.size() + " plugins"));
    }

    /**
     * Runs every {@code beforeStop} hook in reverse registration order, then every
     * {@code afterStop}. Does nothing when not started.
     *
     * @throws LifecycleHookException if a hook fails; later hooks do not run
     */
    public synchronized void stop() {
        if (!started) {
            return;
        }
        List<Registration> order = new ArrayList<>(registrations.values());
        Collections.reverse(order);
        for (Registration registration : order) {
            registration.state = PluginState.STOPPING;
            logger.info(LogUtil.plugin("Stopping", registration.name(), null));
            runHook(registration, "beforeStop");
        }
        started = false;
        for (Registration registration : order) {
            runHook(registration, "afterStop");
            registration.state = PluginState.STOPPED;
        }
        logger.info("Plugin manager stopped");
    }

    private void runHook(Registration registration, String hook) {
        Plugin plugin = registration.plugin;
        PluginContext context = registration.context;
        try {
            switch (hook) {
                case "beforeStart":
                    plugin.beforeStart(context);
                    break;
                case "afterStart":
                    plugin.afterStart(context);
                    break;
                case "beforeStop":
                    plugin.beforeStop(context);
                    break;
                case "afterStop":
                    plugin.afterStop(context);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown hook: " + hook);
            }
        } catch (Exception e) {
            logger.error(LogUtil.error("Plugin " + registration.name() + " failed in " + hook), e);
            throw new LifecycleHookException(registration.name(), hook, e);
        }
    }

    public synchronized boolean isStarted() {
        return started;
    }

    /**
     * Gets a registered plugin by name.
     *
     * @param name the plugin name
     * @return the plugin or null
     */
    public synchronized Plugin getPlugin(String name) {
        Registration registration = registrations.get(name);
        return registration == null || !registration.state.isRegistered() ? null : registration.plugin;
    }

    public synchronized boolean hasPlugin(String name) {
        return getPlugin(name) != null;
    }

    /**
     * Gets all registered plugins in registration order.
     *
     * @return the plugins
     */
    public synchronized List<Plugin> getPlugins() {
        List<Plugin> plugins = new ArrayList<>();
        for (Registration registration : registrations.values()) {
            if (registration.state.isRegistered()) {
                plugins.add(registration.plugin);
            }
        }
        return plugins;
    }

    public synchronized List<PluginMetadata> getPluginMetadata() {
        List<PluginMetadata> metadata = new ArrayList<>();
        for (Plugin plugin : getPlugins()) {
            metadata.add(plugin.getMetadata());
        }
        return metadata;
    }

    /**
     * Gets the lifecycle state of a plugin.
     *
     * @param name the plugin name
     * @return the state, UNREGISTERED for unknown names
     */
    public synchronized PluginState getState(String name) {
        Registration registration = registrations.get(name);
        return registration == null ? PluginState.UNREGISTERED : registration.state;
    }

    /**
     * Gets a service by qualified key.
     *
     * @param qualifiedName {@code <plugin>:<service>}
     * @param <T>           the service type
     * @return the service or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getService(String qualifiedName) {
        return (T) services.get(qualifiedName);
    }

    public Map<String, Object> getServices() {
        return services.snapshot();
    }

    private static final class Registration {
        private final Plugin plugin;
        private final PluginContext context;
        private volatile PluginState state = PluginState.REGISTERING;

        private Registration(Plugin plugin, PluginContext context) {
            this.plugin = plugin;
            this.context = context;
        }

        private String name() {
            return plugin.getMetadata().getName();
        }
    }
}
