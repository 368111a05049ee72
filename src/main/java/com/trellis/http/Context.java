package com.trellis.http;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Context for an HTTP request/response cycle.
 * Provides convenient access to both the request and the response builder.
 */
public class Context {
    private final Request request;
    private final Response response;
    private final Map<String, Object> locals = new HashMap<>();

    /**
     * Creates a new context with the given request and response.
     *
     * @param request  the HTTP request
     * @param response the response builder
     */
    public Context(Request request, Response response) {
        this.request = request;
        this.response = response;
    }

    /**
     * Creates a context with a fresh response builder.
     *
     * @param request the HTTP request
     */
    public Context(Request request) {
        this(request, new Response());
    }

    public Request request() {
        return request;
    }

    public Response response() {
        return response;
    }

    /**
     * Gets a path parameter by name.
     *
     * @param name the parameter name
     * @return the parameter value
     */
    public String param(String name) {
        return request.getPathParam(name);
    }

    /**
     * Gets all path parameters of the matched route.
     *
     * @return the read-only parameter map
     */
    public Map<String, String> params() {
        return request.getPathParams();
    }

    /**
     * Gets a query parameter by name.
     *
     * @param name the parameter name
     * @return the parameter value
     */
    public String query(String name) {
        return request.getQueryParam(name);
    }

    /**
     * Gets a request header by name.
     *
     * @param name the header name
     * @return the header value
     */
    public String header(String name) {
        return request.getHeader(name);
    }

    public String body() {
        return request.getBody();
    }

    public JsonNode json() throws IOException {
        return request.getJsonBody();
    }

    public <T> T parseBody(Class<T> clazz) throws IOException {
        return request.parseBody(clazz);
    }

    /**
     * Sets the response status code.
     *
     * @param status the status code
     * @return this context for method chaining
     */
    public Context status(int status) {
        response.status(status);
        return this;
    }

    /**
     * Sets a response header.
     *
     * @param name  the header name
     * @param value the header value
     * @return this context for method chaining
     */
    public Context header(String name, String value) {
        response.header(name, value);
        return this;
    }

    public Context type(String contentType) {
        response.type(contentType);
        return this;
    }

    public Context send(Object data) {
        response.send(data);
        return this;
    }

    public Context text(String text) {
        response.text(text);
        return this;
    }

    public Context html(String html) {
        response.html(html);
        return this;
    }

    /**
     * Serializes an object to JSON and sends it as a response.
     *
     * @param obj the object to serialize
     * @return this context for method chaining
     */
    public Context json(Object obj) {
        response.json(obj);
        return this;
    }

    public Context redirect(String url) {
        response.redirect(url);
        return this;
    }

    /**
     * Stores a value in the context locals for the current request/response cycle.
     *
     * @param key   the key
     * @param value the value
     * @return this context for method chaining
     */
    public Context set(String key, Object value) {
        locals.put(key, value);
        return this;
    }

    /**
     * Gets a value from the context locals.
     *
     * @param key the key
     * @param <T> the type of the value
     * @return the value or null if not present
     */
    @SuppressWarnings("unchecked")
    public <T> T get(String key) {
        return (T) locals.get(key);
    }

    /**
     * Sends a standardized JSON error body.
     *
     * @param status  the HTTP status code
     * @param message the error message
     * @return this context for method chaining
     */
    public Context error(int status, String message) {
        Map<String, Object> error = new HashMap<>();
        error.put("error", true);
        error.put("status", status);
        error.put("message", message);
        response.status(status).json(error);
        return this;
    }
}
