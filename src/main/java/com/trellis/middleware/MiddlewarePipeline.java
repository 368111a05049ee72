package com.trellis.middleware;

import com.trellis.http.Context;
import com.trellis.http.FinalResponse;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Ordered composition of global, path-scoped and route middleware around a terminal step.
 *
 * <p>For a request the chain is: global middleware in registration order, then every scoped
 * middleware whose scope covers the path, broader scopes first, then the route's own middleware,
 * then the terminal step. Exceptions propagate unchanged.
 */
public class MiddlewarePipeline {
    private final List<Middleware> globalMiddleware = new CopyOnWriteArrayList<>();
    private final List<ScopedMiddleware> scopedMiddleware = new CopyOnWriteArrayList<>();

    /**
     * Adds a global middleware.
     *
     * @param middleware the middleware
     */
    public void use(Middleware middleware) {
        if (middleware == null) {
            throw new IllegalArgumentException("Middleware must not be null");
        }
        globalMiddleware.add(middleware);
    }

    /**
     * Adds a middleware that only runs for paths under a scope.
     *
     * @param scope      the path prefix, e.g. {@code /api}; {@code /} covers every path
     * @param middleware the middleware
     */
    public void use(String scope, Middleware middleware) {
        if (middleware == null) {
            throw new IllegalArgumentException("Middleware must not be null");
        }
        scopedMiddleware.add(new ScopedMiddleware(normalizeScope(scope), middleware));
    }

    /**
     * Selects the scoped middleware applying to a path, ordered by ascending scope length. Equal
     * lengths keep registration order.
     *
     * @param path the request path
     * @return the matching middleware
     */
    public List<Middleware> scopedFor(String path) {
        List<ScopedMiddleware> matching = new ArrayList<>();
        for (ScopedMiddleware scoped : scopedMiddleware) {
            if (scoped.covers(path)) {
                matching.add(scoped);
            }
        }
        // List.sort is stable
        matching.sort(Comparator.comparingInt(s -> s.scope.length()));
        List<Middleware> result = new ArrayList<>(matching.size());
        for (ScopedMiddleware scoped : matching) {
            result.add(scoped.middleware);
        }
        return result;
    }

    /**
     * Runs the full chain for a request.
     *
     * @param ctx             the request context
     * @param routeMiddleware the matched route's middleware, may be empty
     * @param terminal        the innermost step
     * @return the final response
     * @throws Exception whatever a middleware or the terminal step throws
     */
    public FinalResponse execute(Context ctx, List<Middleware> routeMiddleware, Next terminal)
            throws Exception {
        List<Middleware> chain = new ArrayList<>(globalMiddleware);
        chain.addAll(scopedFor(ctx.request().getPath()));
        if (routeMiddleware != null) {
            chain.addAll(routeMiddleware);
        }
        return run(ctx, chain, terminal);
    }

    /**
     * Runs an explicit chain around a terminal step.
     *
     * @param ctx      the request context
     * @param chain    the middleware in execution order
     * @param terminal the innermost step
     * @return the final response
     * @throws Exception whatever a middleware or the terminal step throws
     */
    public static FinalResponse run(Context ctx, List<Middleware> chain, Next terminal)
            throws Exception {
        return new Chain(ctx, chain, terminal).proceedFrom(0);
    }

    public List<Middleware> getGlobalMiddleware() {
        return Collections.unmodifiableList(globalMiddleware);
    }

    private static String normalizeScope(String scope) {
        if (scope == null || scope.isEmpty() || scope.equals("/")) {
            return "/";
        }
        String normalized = scope.startsWith("/") ? scope : "/" + scope;
        while (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    private static final class ScopedMiddleware {
        private final String scope;
        private final Middleware middleware;

        private ScopedMiddleware(String scope, Middleware middleware) {
            this.scope = scope;
            this.middleware = middleware;
        }

        private boolean covers(String path) {
            if (scope.equals("/")) {
                return true;
            }
            return path.equals(scope) || path.startsWith(scope + "/");
        }
    }

    private static final class Chain {
        private final Context ctx;
        private final List<Middleware> chain;
        private final Next terminal;

        private Chain(Context ctx, List<Middleware> chain, Next terminal) {
            this.ctx = ctx;
            this.chain = chain;
            this.terminal = terminal;
        }

        private FinalResponse proceedFrom(int index) throws Exception {
            FinalResponse response;
            if (index < chain.size()) {
                response = chain.get(index).handle(ctx, () -> proceedFrom(index + 1));
            } else {
                response = terminal.proceed();
            }
            // null means "whatever the builder holds", finalized implicitly
            return response != null ? response : ctx.response().finish();
        }
    }
}
