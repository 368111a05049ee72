package com.trellis.core;

import com.trellis.http.Context;
import com.trellis.http.FinalResponse;
import com.trellis.http.HttpMethod;
import com.trellis.http.Request;
import com.trellis.middleware.Middleware;
import com.trellis.middleware.MiddlewarePipeline;
import com.trellis.middleware.Next;
import com.trellis.plugin.Plugin;
import com.trellis.plugin.PluginManager;
import com.trellis.plugin.PluginRegistrationOptions;
import com.trellis.routing.RouteCache;
import com.trellis.routing.RouteMatch;
import com.trellis.routing.Router;
import com.trellis.util.ConsoleColors;
import com.trellis.util.LogUtil;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.HeaderValues;
import io.undertow.util.HttpString;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The main application class for the Trellis framework. Owns the route table, the route cache,
 * the middleware pipeline and the plugin manager, and exposes a fluent API for defining routes.
 *
 * <p>{@link #handle(Request)} is the single dispatch entry point. The Undertow listener started
 * by {@link #listen()} and the mock harness both funnel requests through it.
 */
public class Trellis {
  private static final Logger logger = LoggerFactory.getLogger(Trellis.class);

  private static final int HTTP_BAD_REQUEST = 400;
  private static final int HTTP_NOT_FOUND = 404;
  private static final int HTTP_INTERNAL_SERVER_ERROR = 500;

  private final TrellisConfig config;
  private final Router router;
  private final RouteCache routeCache;
  private final MiddlewarePipeline pipeline;
  private final PluginManager pluginManager;
  private final Map<String, Object> locals;
  private Undertow server;

  /** Creates a new Trellis application with default configuration. */
  public Trellis() {
    this(new TrellisConfig());
  }

  /**
   * Creates a new Trellis application.
   *
   * @param config the configuration
   */
  public Trellis(TrellisConfig config) {
    this.config = config;
    this.router = new Router();
    this.routeCache = new RouteCache(config.getRouteCacheCapacity());
    this.pipeline = new MiddlewarePipeline();
    this.pluginManager = new PluginManager(this, router, pipeline);
    this.locals = new HashMap<>();
  }

  /**
   * Sets the host for the server.
   *
   * @param host the host to bind to
   * @return this instance for method chaining
   */
  public Trellis host(String host) {
    config.host(host);
    return this;
  }

  /**
   * Sets the port for the server.
   *
   * @param port the port to listen on, 0 for an ephemeral port
   * @return this instance for method chaining
   */
  public Trellis port(int port) {
    config.port(port);
    return this;
  }

  /**
   * Adds a global middleware to the application.
   *
   * @param middleware the middleware to add
   * @return this instance for method chaining
   */
  public Trellis use(Middleware middleware) {
    pipeline.use(middleware);
    return this;
  }

  /**
   * Adds a middleware that runs for paths under a scope.
   *
   * @param path the scope path
   * @param middleware the middleware to add
   * @return this instance for method chaining
   */
  public Trellis use(String path, Middleware middleware) {
    pipeline.use(path, middleware);
    return this;
  }

  /**
   * Registers a plugin with the application.
   *
   * @param plugin the plugin to register
   * @return this instance for method chaining
   */
  public Trellis register(Plugin plugin) {
    pluginManager.register(plugin);
    return this;
  }

  public Trellis register(Plugin plugin, PluginRegistrationOptions options) {
    pluginManager.register(plugin, options);
    return this;
  }

  public Trellis startPlugins() {
    pluginManager.start();
    return this;
  }

  public Trellis stopPlugins() {
    pluginManager.stop();
    return this;
  }

  /**
   * Gets a plugin by name.
   *
   * @param name the name of the plugin
   * @return the plugin or null if not found
   */
  public Plugin getPlugin(String name) {
    return pluginManager.getPlugin(name);
  }

  public boolean hasPlugin(String name) {
    return pluginManager.hasPlugin(name);
  }

  /**
   * Sets a value in the application locals.
   *
   * @param key the key
   * @param value the value
   * @return this instance for method chaining
   */
  public Trellis set(String key, Object value) {
    locals.put(key, value);
    return this;
  }

  /**
   * Gets a value from the application locals.
   *
   * @param key the key
   * @param <T> the type of the value
   * @return the value or null if not present
   */
  @SuppressWarnings("unchecked")
  public <T> T get(String key) {
    return (T) locals.get(key);
  }

  public Trellis get(String path, Handler handler, Middleware... middlewares) {
    return route(HttpMethod.GET, path, handler, middlewares);
  }

  public Trellis post(String path, Handler handler, Middleware... middlewares) {
    return route(HttpMethod.POST, path, handler, middlewares);
  }

  public Trellis put(String path, Handler handler, Middleware... middlewares) {
    return route(HttpMethod.PUT, path, handler, middlewares);
  }

  public Trellis delete(String path, Handler handler, Middleware... middlewares) {
    return route(HttpMethod.DELETE, path, handler, middlewares);
  }

  public Trellis patch(String path, Handler handler, Middleware... middlewares) {
    return route(HttpMethod.PATCH, path, handler, middlewares);
  }

  public Trellis head(String path, Handler handler, Middleware... middlewares) {
    return route(HttpMethod.HEAD, path, handler, middlewares);
  }

  public Trellis options(String path, Handler handler, Middleware... middlewares) {
    return route(HttpMethod.OPTIONS, path, handler, middlewares);
  }

  /**
   * Adds a route for a method given by name.
   *
   * @param method the HTTP method, case-insensitive
   * @param path the route path
   * @param handler the handler function
   * @param middlewares route-specific middleware
   * @return this instance for method chaining
   */
  public Trellis route(String method, String path, Handler handler, Middleware... middlewares) {
    return route(HttpMethod.parse(method), path, handler, middlewares);
  }

  public Trellis route(
      HttpMethod method, String path, Handler handler, Middleware... middlewares) {
    router.register(method, path, Arrays.asList(middlewares), handler);
    return this;
  }

  /**
   * Mounts another application under a base path. Its routes are copied with the prefix and its
   * global middleware is added as middleware scoped to the base path.
   *
   * @param basePath the base path
   * @param app the application to mount
   * @return this instance for method chaining
   */
  public Trellis mount(String basePath, Trellis app) {
    router.mount(basePath, app.getRouter());
    String scope = Router.joinPath(basePath, "/");
    for (Middleware middleware : app.pipeline.getGlobalMiddleware()) {
      pipeline.use(scope, middleware);
    }
    logger.info("Mounted {} routes under {}", app.getRouter().getRoutes().size(), scope);
    return this;
  }

  /**
   * Dispatches a request: resolves the route (through the cache), runs the middleware pipeline
   * around the handler and returns the finalized response. Never throws; unmatched requests get
   * 404 and uncaught exceptions 500.
   *
   * @param request the request
   * @return the response
   */
  public FinalResponse handle(Request request) {
    RouteMatch match;
    try {
      match = resolve(request.getMethod(), request.getPath());
    } catch (IllegalArgumentException e) {
      logger.debug("Malformed request path {}: {}", request.getPath(), e.getMessage());
      return FinalResponse.text(HTTP_BAD_REQUEST, "Bad Request");
    }

    Context ctx = new Context(request);
    Next terminal;
    List<Middleware> routeMiddleware;
    if (match == null) {
      logger.debug("No route for {} {}", request.getMethod(), request.getPath());
      routeMiddleware = Collections.emptyList();
      terminal = () -> ctx.response().status(HTTP_NOT_FOUND).text("Not Found").finish();
    } else {
      RouteMatch resolved = match;
      request.setPathParams(resolved.getParams());
      routeMiddleware = resolved.getMiddleware();
      terminal =
          () -> {
            resolved.getHandler().handle(ctx);
            return ctx.response().finish();
          };
    }

    try {
      return pipeline.execute(ctx, routeMiddleware, terminal);
    } catch (Exception e) {
      logger.error("Unhandled exception processing {} {}", request.getMethod(), request.getPath(), e);
      return FinalResponse.text(HTTP_INTERNAL_SERVER_ERROR, "Internal Server Error");
    }
  }

  private RouteMatch resolve(String methodName, String path) {
    HttpMethod method = HttpMethod.lookup(methodName);
    if (method == null) {
      return null;
    }
    if (!config.isRouteCacheEnabled()) {
      return router.match(method, path);
    }
    String key = RouteCache.key(method.name(), path);
    RouteCache.CacheEntry entry = routeCache.get(key);
    if (entry != null) {
      logger.debug("Route cache hit for {}", key);
      return new RouteMatch(entry.getRoute(), entry.getParams());
    }
    RouteMatch match = router.match(method, path);
    if (match != null) {
      routeCache.set(key, match.getRoute(), match.getParams());
    }
    return match;
  }

  /** Starts plugins, then the HTTP listener. */
  public void listen() {
    listen(null);
  }

  /**
   * Starts plugins, then the HTTP listener, then runs the callback.
   *
   * @param callback the function to call when the server has started, may be null
   */
  public void listen(Runnable callback) {
    if (server != null) {
      throw new IllegalStateException("Server is already listening");
    }
    pluginManager.start();

    Undertow undertow =
        Undertow.builder()
            .addHttpListener(config.getPort(), config.getHost())
            .setHandler(new TrellisHttpHandler())
            // keep escapes in the path, the router decodes parameter values itself
            .setServerOption(UndertowOptions.DECODE_URL, false)
            .setServerOption(UndertowOptions.ALWAYS_SET_DATE, true)
            .build();
    try {
      undertow.start();
    } catch (RuntimeException e) {
      logger.error("Failed to start listener on {}:{}", config.getHost(), config.getPort(), e);
      try {
        pluginManager.stop();
      } catch (RuntimeException stopFailure) {
        e.addSuppressed(stopFailure);
      }
      throw e;
    }
    server = undertow;

    logger.info(
        LogUtil.success("Trellis server listening on ")
            + ConsoleColors.paint(ConsoleColors.CYAN, config.getHost() + ":" + getPort()));

    if (callback != null) {
      callback.run();
    }
  }

  /**
   * Stops plugins, then the listener. The listener is released even when a plugin stop hook
   * fails; the hook failure is rethrown afterwards.
   */
  public void stop() {
    try {
      pluginManager.stop();
    } finally {
      if (server != null) {
        server.stop();
        server = null;
        logger.info("Trellis server stopped");
      }
    }
  }

  /**
   * Gets the port the listener is bound to, or the configured port when not listening.
   *
   * @return the port
   */
  public int getPort() {
    if (server != null && !server.getListenerInfo().isEmpty()) {
      InetSocketAddress address = (InetSocketAddress) server.getListenerInfo().get(0).getAddress();
      return address.getPort();
    }
    return config.getPort();
  }

  public TrellisConfig getConfig() {
    return config;
  }

  public Router getRouter() {
    return router;
  }

  public RouteCache getRouteCache() {
    return routeCache;
  }

  public MiddlewarePipeline getPipeline() {
    return pipeline;
  }

  public PluginManager getPluginManager() {
    return pluginManager;
  }

  /** Functional interface for route handlers. */
  @FunctionalInterface
  public interface Handler {
    void handle(Context ctx) throws Exception;
  }

  /** Bridges Undertow exchanges to {@link #handle(Request)}. */
  private class TrellisHttpHandler implements HttpHandler {

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
      // Handlers may block, so leave the IO thread
      if (exchange.isInIoThread()) {
        exchange.dispatch(this);
        return;
      }
      exchange.startBlocking();

      Request.Builder builder =
          Request.builder(exchange.getRequestMethod().toString(), exchange.getRequestPath());
      String query = exchange.getQueryString();
      if (query != null && !query.isEmpty()) {
        builder.query(query);
      }
      for (HeaderValues values : exchange.getRequestHeaders()) {
        String name = values.getHeaderName().toString();
        for (String value : values) {
          builder.header(name, value);
        }
      }
      builder.body(exchange.getInputStream().readAllBytes());

      FinalResponse response = handle(builder.build());

      exchange.setStatusCode(response.getStatus());
      for (String name : response.getHeaders().names()) {
        HttpString headerName = new HttpString(name);
        for (String value : response.getHeaderValues(name)) {
          exchange.getResponseHeaders().add(headerName, value);
        }
      }
      exchange.getResponseSender().send(ByteBuffer.wrap(response.getBody()));
    }
  }
}
