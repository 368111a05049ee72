package com.trellis.routing;

import com.trellis.core.Trellis;
import com.trellis.middleware.Middleware;
import java.util.List;
import java.util.Map;

/** A resolved route together with the parameters extracted from the request path. */
public class RouteMatch {
    private final Route route;
    private final Map<String, String> params;

    public RouteMatch(Route route, Map<String, String> params) {
        this.route = route;
        this.params = params;
    }

    public Route getRoute() {
        return route;
    }

    public Trellis.Handler getHandler() {
        return route.getHandler();
    }

    /**
     * Gets the extracted path parameters.
     *
     * @return the read-only parameter map
     */
    public Map<String, String> getParams() {
        return params;
    }

    public List<Middleware> getMiddleware() {
        return route.getMiddleware();
    }
}
