package com.trellis.routing;

import com.trellis.core.Trellis;
import com.trellis.http.HttpMethod;
import com.trellis.middleware.Middleware;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/** Represents a route in the application. Immutable once registered. */
public class Route {
  private final HttpMethod method;
  private final String path;
  private final PathPattern pattern;
  private final List<Middleware> middleware;
  private final Trellis.Handler handler;

  /**
   * Creates a new route.
   *
   * @param method the HTTP method
   * @param path the route pattern
   * @param middleware the route-specific middleware, in execution order
   * @param handler the handler function
   */
  public Route(HttpMethod method, String path, List<Middleware> middleware, Trellis.Handler handler) {
    if (method == null) {
      throw new IllegalArgumentException("Route method must not be null");
    }
    if (handler == null) {
      throw new IllegalArgumentException("Route handler must not be null");
    }
    this.method = method;
    this.path = path;
    this.pattern = PathPattern.compile(path);
    this.middleware =
        middleware == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(middleware));
    this.handler = handler;
  }

  /**
   * Gets the HTTP method of the route.
   *
   * @return the method
   */
  public HttpMethod getMethod() {
    return method;
  }

  /**
   * Gets the pattern the route was registered with.
   *
   * @return the path pattern
   */
  public String getPath() {
    return path;
  }

  public PathPattern getPattern() {
    return pattern;
  }

  /**
   * Gets the middleware list for this route.
   *
   * @return the read-only middleware list
   */
  public List<Middleware> getMiddleware() {
    return middleware;
  }

  public Trellis.Handler getHandler() {
    return handler;
  }

  /**
   * Matches a request path against this route's pattern. The method is not checked.
   *
   * @param requestPath the request path
   * @return the parameters or null if the path does not match
   */
  public Map<String, String> match(String requestPath) {
    return pattern.match(requestPath);
  }

  @Override
  public String toString() {
    return method + " " + path;
  }
}
