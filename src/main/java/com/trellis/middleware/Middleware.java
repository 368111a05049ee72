package com.trellis.middleware;

import com.trellis.http.Context;
import com.trellis.http.FinalResponse;

/**
 * Interface for middleware components.
 * Middleware wraps the rest of the chain: code before {@link Next#proceed()} runs on the way in,
 * code after it runs on the way out and may replace the response it returned.
 */
@FunctionalInterface
public interface Middleware {
    /**
     * Processes the request context.
     *
     * @param ctx  the context containing the request and response
     * @param next the continuation running the remaining chain; not calling it short-circuits
     * @return the response, or null to fall back to whatever the response builder holds
     * @throws Exception if an error occurs during processing
     */
    FinalResponse handle(Context ctx, Next next) throws Exception;
}
