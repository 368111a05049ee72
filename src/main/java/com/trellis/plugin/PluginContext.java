package com.trellis.plugin;

import com.trellis.core.Trellis;
import com.trellis.http.HttpMethod;
import com.trellis.middleware.Middleware;
import com.trellis.middleware.MiddlewarePipeline;
import com.trellis.routing.Route;
import com.trellis.routing.Router;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A plugin's view of the application. Each plugin gets its own instance with private storage, a
 * logger named {@code trellis.plugin.<name>} and its registration prefix applied to routes and
 * scoped middleware.
 */
public class PluginContext {
    private final PluginMetadata metadata;
    private final Trellis server;
    private final Router router;
    private final MiddlewarePipeline pipeline;
    private final ServiceRegistry services;
    private final Map<String, Object> config;
    private final String prefix;
    private final Map<String, Object> storage = new ConcurrentHashMap<>();
    private final Logger logger;

    PluginContext(PluginMetadata metadata, Trellis server, Router router,
            MiddlewarePipeline pipeline, ServiceRegistry services, Map<String, Object> defaults,
            PluginRegistrationOptions options) {
        this.metadata = metadata;
        this.server = server;
        this.router = router;
        this.pipeline = pipeline;
        this.services = services;
        Map<String, Object> merged = new LinkedHashMap<>();
        if (defaults != null) {
            merged.putAll(defaults);
        }
        if (options != null) {
            merged.putAll(options.getConfig());
        }
        this.config = Collections.unmodifiableMap(merged);
        this.prefix = options == null ? null : options.getPrefix();
        this.logger = LoggerFactory.getLogger("trellis.plugin." + metadata.getName());
    }

    public PluginMetadata getMetadata() {
        return metadata;
    }

    public String getPluginName() {
        return metadata.getName();
    }

    /**
     * Gets the application the plugin is registered with.
     *
     * @return the application, null when the manager runs standalone
     */
    public Trellis getServer() {
        return server;
    }

    public Router getRouter() {
        return router;
    }

    /**
     * Gets the merged configuration: plugin defaults overridden by registration options.
     *
     * @return the read-only configuration
     */
    public Map<String, Object> getConfig() {
        return config;
    }

    @SuppressWarnings("unchecked")
    public <T> T getConfig(String key) {
        return (T) config.get(key);
    }

    /**
     * Gets storage private to this plugin.
     *
     * @return the mutable storage map
     */
    public Map<String, Object> getStorage() {
        return storage;
    }

    public Logger getLogger() {
        return logger;
    }

    public String getPrefix() {
        return prefix;
    }

    /**
     * Adds a route under the plugin's prefix.
     *
     * @param method      the HTTP method name
     * @param path        the route pattern, relative to the prefix
     * @param handler     the handler
     * @param middlewares route-specific middleware
     * @return the created route
     */
    public Route addRoute(String method, String path, Trellis.Handler handler,
            Middleware... middlewares) {
        return addRoute(HttpMethod.parse(method), path, handler, middlewares);
    }

    public Route addRoute(HttpMethod method, String path, Trellis.Handler handler,
            Middleware... middlewares) {
        String fullPath = prefix == null ? path : Router.joinPath(prefix, path);
        logger.debug("Adding route {} {}", method, fullPath);
        return router.register(method, fullPath, Arrays.asList(middlewares), handler);
    }

    /**
     * Adds a global middleware.
     *
     * @param middleware the middleware
     */
    public void addMiddleware(Middleware middleware) {
        pipeline.use(middleware);
    }

    /**
     * Adds a middleware scoped to a path under the plugin's prefix.
     *
     * @param path       the scope, relative to the prefix
     * @param middleware the middleware
     */
    public void addMiddleware(String path, Middleware middleware) {
        pipeline.use(prefix == null ? path : Router.joinPath(prefix, path), middleware);
    }

    /**
     * Exposes a service as {@code <plugin>:<name>}.
     *
     * @param name    the service name
     * @param service the service
     */
    public void registerService(String name, Object service) {
        services.register(metadata.getName(), name, service);
    }

    /**
     * Looks up a service. The exact key is tried first, then this plugin's own
     * {@code <plugin>:<name>}. Bare names of other plugins' services are not visible.
     *
     * @param name a qualified key or a bare name
     * @param <T>  the service type
     * @return the service or null
     */
    @SuppressWarnings("unchecked")
    public <T> T getService(String name) {
        if (services.contains(name)) {
            return (T) services.get(name);
        }
        return (T) services.get(ServiceRegistry.qualify(metadata.getName(), name));
    }
}
