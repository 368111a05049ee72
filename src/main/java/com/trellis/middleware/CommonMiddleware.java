package com.trellis.middleware;

import com.trellis.http.FinalResponse;
import com.trellis.http.HttpException;
import com.trellis.http.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Collection of common middleware implementations.
 */
public class CommonMiddleware {
    private static final Logger logger = LoggerFactory.getLogger(CommonMiddleware.class);

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private CommonMiddleware() {
    }

    /**
     * Creates a logging middleware that logs each request with its status and duration.
     *
     * @return the middleware
     */
    public static Middleware requestLogger() {
        return (ctx, next) -> {
            long startTime = System.currentTimeMillis();
            String requestId = UUID.randomUUID().toString().substring(0, 8);

            ctx.request().setAttribute("requestId", requestId);
            ctx.request().setAttribute("startTime", startTime);

            logger.info("[{}] {} {} started", requestId, ctx.request().getMethod(), ctx.request().getPath());
            try {
                FinalResponse response = next.proceed();
                logger.info("[{}] {} {} completed with status {} in {}ms",
                        requestId, ctx.request().getMethod(), ctx.request().getPath(),
                        response.getStatus(), System.currentTimeMillis() - startTime);
                return response;
            } catch (Exception e) {
                logger.info("[{}] {} {} failed after {}ms: {}",
                        requestId, ctx.request().getMethod(), ctx.request().getPath(),
                        System.currentTimeMillis() - startTime, e.toString());
                throw e;
            }
        };
    }

    /**
     * Creates a middleware that echoes or assigns a request id header on the response.
     *
     * @return the middleware
     */
    public static Middleware requestId() {
        return (ctx, next) -> {
            String requestId = ctx.header(REQUEST_ID_HEADER);
            if (requestId == null || requestId.isEmpty()) {
                requestId = UUID.randomUUID().toString();
            }
            ctx.request().setAttribute("requestId", requestId);
            return next.proceed().withHeader(REQUEST_ID_HEADER, requestId);
        };
    }

    /**
     * Creates an error handling middleware with exception details hidden.
     *
     * @return the middleware
     */
    public static Middleware errorHandler() {
        return errorHandler(false);
    }

    /**
     * Creates an error handling middleware that converts exceptions thrown further down the chain
     * into JSON error responses. {@link HttpException} keeps its status,
     * {@link IllegalArgumentException} becomes 400, {@link SecurityException} 403 and everything else
     * 500.
     *
     * @param dev whether to include the exception class and message
     * @return the middleware
     */
    public static Middleware errorHandler(boolean dev) {
        return (ctx, next) -> {
            try {
                return next.proceed();
            } catch (Exception e) {
                return toErrorResponse(e, dev);
            }
        };
    }

    /**
     * Maps an exception to a JSON error response. The response is built fresh since the request's
     * own builder may already be sent.
     *
     * @param e   the exception
     * @param dev whether to include exception details
     * @return the error response
     */
    public static FinalResponse toErrorResponse(Exception e, boolean dev) {
        int statusCode = 500;
        String message = "Internal Server Error";

        if (e instanceof HttpException) {
            HttpException httpException = (HttpException) e;
            statusCode = httpException.getStatus();
            message = httpException.isExpose() && httpException.getMessage() != null
                    ? httpException.getMessage()
                    : HttpException.reasonPhrase(statusCode);
        } else if (e instanceof IllegalArgumentException) {
            statusCode = 400;
            message = "Bad Request";
        } else if (e instanceof SecurityException) {
            statusCode = 403;
            message = "Forbidden";
        }

        if (statusCode >= 500) {
            logger.error("Uncaught exception during request processing", e);
        } else {
            logger.debug("Request failed with status {}: {}", statusCode, e.getMessage());
        }

        Map<String, Object> errorResponse = new LinkedHashMap<>();
        errorResponse.put("error", true);
        errorResponse.put("status", statusCode);
        errorResponse.put("message", message);

        // Include exception details in development mode
        if (dev) {
            errorResponse.put("exception", e.getClass().getName());
            errorResponse.put("detail", e.getMessage());
        }

        return new Response().status(statusCode).json(errorResponse).finish();
    }
}
