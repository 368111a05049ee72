package com.trellis.middleware;

import com.trellis.http.FinalResponse;

/** Continuation that runs the remainder of a middleware chain. */
@FunctionalInterface
public interface Next {
    /**
     * Runs the remaining middleware and the handler.
     *
     * @return the response produced downstream, never null
     * @throws Exception if a downstream middleware or the handler fails
     */
    FinalResponse proceed() throws Exception;
}
