package com.trellis.routing;

import com.trellis.core.Trellis;
import com.trellis.http.HttpMethod;
import com.trellis.middleware.Middleware;
import com.trellis.util.LogUtil;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Route table. Stores routes per HTTP method and matches incoming requests to the first route
 * registered for that method whose pattern fits the path.
 */
public class Router {
    private static final Logger logger = LoggerFactory.getLogger(Router.class);

    // Routes by HTTP method, in registration order
    private final Map<HttpMethod, List<Route>> routesByMethod;

    // All routes for introspection
    private final List<Route> allRoutes;

    /**
     * Creates a new Router instance.
     */
    public Router() {
        this.routesByMethod = Collections.synchronizedMap(new EnumMap<>(HttpMethod.class));
        this.allRoutes = new CopyOnWriteArrayList<>();
    }

    /**
     * Registers a route. The pattern is compiled once, here.
     *
     * @param method      the HTTP method
     * @param path        the route pattern
     * @param middlewares the route-specific middleware, may be empty
     * @param handler     the handler function
     * @return the created route
     */
    public Route register(HttpMethod method, String path, List<Middleware> middlewares,
            Trellis.Handler handler) {
        Route route = new Route(method, path, middlewares, handler);
        routesByMethod.computeIfAbsent(method, k -> new CopyOnWriteArrayList<>()).add(route);
        allRoutes.add(route);
        logger.debug("Registered route {}", LogUtil.route(method.name(), path));
        return route;
    }

    /**
     * Registers a route from a method name.
     *
     * @param method      the HTTP method name, case-insensitive
     * @param path        the route pattern
     * @param handler     the handler function
     * @param middlewares the route-specific middleware
     * @return the created route
     * @throws IllegalArgumentException if the method is not a supported verb
     */
    public Route addRoute(String method, String path, Trellis.Handler handler,
            Middleware... middlewares) {
        return register(HttpMethod.parse(method), path, Arrays.asList(middlewares), handler);
    }

    public Route get(String path, Trellis.Handler handler, Middleware... middlewares) {
        return register(HttpMethod.GET, path, Arrays.asList(middlewares), handler);
    }

    public Route post(String path, Trellis.Handler handler, Middleware... middlewares) {
        return register(HttpMethod.POST, path, Arrays.asList(middlewares), handler);
    }

    public Route put(String path, Trellis.Handler handler, Middleware... middlewares) {
        return register(HttpMethod.PUT, path, Arrays.asList(middlewares), handler);
    }

    public Route delete(String path, Trellis.Handler handler, Middleware... middlewares) {
        return register(HttpMethod.DELETE, path, Arrays.asList(middlewares), handler);
    }

    public Route patch(String path, Trellis.Handler handler, Middleware... middlewares) {
        return register(HttpMethod.PATCH, path, Arrays.asList(middlewares), handler);
    }

    public Route head(String path, Trellis.Handler handler, Middleware... middlewares) {
        return register(HttpMethod.HEAD, path, Arrays.asList(middlewares), handler);
    }

    public Route options(String path, Trellis.Handler handler, Middleware... middlewares) {
        return register(HttpMethod.OPTIONS, path, Arrays.asList(middlewares), handler);
    }

    /**
     * Finds the route for a request. Routes for the method are tried in registration order and the
     * first whose pattern matches wins. A path that only matches routes of other methods is not
     * found.
     *
     * @param method the HTTP method name as received
     * @param path   the request path without query string
     * @return the match or null if none matches
     * @throws IllegalArgumentException if a bound segment has a malformed percent escape
     */
    public RouteMatch match(String method, String path) {
        HttpMethod httpMethod = HttpMethod.lookup(method);
        if (httpMethod == null) {
            return null;
        }
        return match(httpMethod, path);
    }

    /**
     * Finds the route for a request.
     *
     * @param method the HTTP method
     * @param path   the request path without query string
     * @return the match or null if none matches
     */
    public RouteMatch match(HttpMethod method, String path) {
        List<Route> routes = routesByMethod.get(method);
        if (routes == null) {
            return null;
        }
        for (Route route : routes) {
            Map<String, String> params = route.match(path);
            if (params != null) {
                return new RouteMatch(route, params);
            }
        }
        return null;
    }

    /**
     * Copies every route of another router under a base path. Route middleware and handlers are
     * shared, patterns are prefixed.
     *
     * @param basePath the base path, e.g. {@code /api}
     * @param other    the router to mount
     */
    public void mount(String basePath, Router other) {
        for (Route route : other.getRoutes()) {
            register(route.getMethod(), joinPath(basePath, route.getPath()), route.getMiddleware(),
                    route.getHandler());
        }
    }

    /**
     * Gets all registered routes in registration order.
     *
     * @return the read-only route list
     */
    public List<Route> getRoutes() {
        return Collections.unmodifiableList(allRoutes);
    }

    /**
     * Joins a base path and a route pattern without doubling or dropping slashes.
     *
     * @param basePath the base path, may be null or empty
     * @param path     the route pattern
     * @return the combined pattern
     */
    public static String joinPath(String basePath, String path) {
        String base = basePath == null ? "" : basePath.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        if (!base.isEmpty() && !base.startsWith("/")) {
            base = "/" + base;
        }
        String suffix = path == null || path.isEmpty() ? "/" : path;
        if (!suffix.startsWith("/")) {
            suffix = "/" + suffix;
        }
        if (base.isEmpty()) {
            return suffix;
        }
        return suffix.equals("/") ? base : base + suffix;
    }
}
