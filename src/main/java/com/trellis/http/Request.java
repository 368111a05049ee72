package com.trellis.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.trellis.util.JsonUtil;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transport-independent HTTP request.
 *
 * <p>The Undertow listener and the mock harness both produce instances of this class, so the
 * dispatch core never sees the underlying exchange. Path parameters are attached by the dispatcher
 * once the route is resolved and are read-only afterwards.
 */
public class Request {
  private static final Logger logger = LoggerFactory.getLogger(Request.class);

  private final String method;
  private final String path;
  private final String queryString;
  private final Map<String, List<String>> queryParams;
  private final HttpHeaders headers;
  private final byte[] body;
  private final Map<String, Object> attributes = new ConcurrentHashMap<>();
  private volatile Map<String, String> pathParams = Collections.emptyMap();
  private JsonNode jsonBody;
  private Map<String, String> cookies;

  private Request(Builder builder) {
    this.method = builder.method;
    this.path = builder.path;
    this.queryString = builder.queryString;
    this.queryParams = parseQuery(builder.queryString);
    this.headers = builder.headers.unmodifiable();
    this.body = builder.body == null ? new byte[0] : builder.body;
  }

  /**
   * Creates a request builder.
   *
   * @param method the HTTP method as received
   * @param target the request target, path with optional query string
   * @return the builder
   */
  public static Builder builder(String method, String target) {
    return new Builder(method, target);
  }

  /**
   * Gets the HTTP method as received from the client.
   *
   * @return the method name
   */
  public String getMethod() {
    return method;
  }

  /**
   * Gets the HTTP method as an enum constant.
   *
   * @return the method or null if it is not a supported verb
   */
  public HttpMethod getHttpMethod() {
    return HttpMethod.lookup(method);
  }

  /**
   * Gets the path of the request, without the query string.
   *
   * @return the request path
   */
  public String getPath() {
    return path;
  }

  public String getQueryString() {
    return queryString;
  }

  /**
   * Gets a query parameter by name.
   *
   * @param name the parameter name
   * @return the first value or null if not present
   */
  public String getQueryParam(String name) {
    List<String> values = queryParams.get(name);
    return values == null || values.isEmpty() ? null : values.get(0);
  }

  public List<String> getQueryParamValues(String name) {
    List<String> values = queryParams.get(name);
    return values == null ? Collections.emptyList() : values;
  }

  /**
   * Gets all query parameters, first value per name.
   *
   * @return the query parameters
   */
  public Map<String, String> getQueryParams() {
    Map<String, String> result = new LinkedHashMap<>();
    queryParams.forEach((k, v) -> result.put(k, v.isEmpty() ? "" : v.get(0)));
    return result;
  }

  /**
   * Gets a request header by name, ignoring case.
   *
   * @param name the header name
   * @return the header value or null
   */
  public String getHeader(String name) {
    return headers.getFirst(name);
  }

  public HttpHeaders getHeaders() {
    return headers;
  }

  public byte[] getBodyBytes() {
    return body.clone();
  }

  /**
   * Gets the request body as a UTF-8 string.
   *
   * @return the body, empty if there is none
   */
  public String getBody() {
    return new String(body, StandardCharsets.UTF_8);
  }

  /**
   * Gets the request body parsed as JSON.
   *
   * @return the JSON body
   * @throws IOException if the body is not valid JSON
   */
  public JsonNode getJsonBody() throws IOException {
    if (jsonBody == null) {
      jsonBody = JsonUtil.parseJson(getBody());
    }
    return jsonBody;
  }

  /**
   * Parses the request body into an object of the specified type.
   *
   * @param clazz the class to parse into
   * @param <T> the type of the object
   * @return the parsed object
   * @throws IOException if the body cannot be parsed
   */
  public <T> T parseBody(Class<T> clazz) throws IOException {
    return JsonUtil.fromJson(getBody(), clazz);
  }

  /**
   * Gets the cookies sent with the request.
   *
   * @return cookie name to decoded value
   */
  public Map<String, String> getCookies() {
    if (cookies == null) {
      Map<String, String> parsed = new LinkedHashMap<>();
      String header = headers.getFirst("Cookie");
      if (header != null) {
        for (String segment : header.split(";")) {
          int eq = segment.indexOf('=');
          if (eq > 0) {
            String name = segment.substring(0, eq).trim();
            String value = segment.substring(eq + 1).trim();
            parsed.put(name, decodeOrRaw(value.replace("+", "%2B"), value));
          }
        }
      }
      cookies = Collections.unmodifiableMap(parsed);
    }
    return cookies;
  }

  public String getCookie(String name) {
    return getCookies().get(name);
  }

  /**
   * Gets a path parameter by name.
   *
   * @param name the parameter name
   * @return the parameter value or null
   */
  public String getPathParam(String name) {
    return pathParams.get(name);
  }

  /**
   * Gets the path parameters of the matched route.
   *
   * @return a read-only map
   */
  public Map<String, String> getPathParams() {
    return pathParams;
  }

  /**
   * Attaches the parameters extracted by the router. Called by the dispatcher.
   *
   * @param params the parameters, already read-only
   */
  public void setPathParams(Map<String, String> params) {
    this.pathParams = params == null ? Collections.emptyMap() : params;
  }

  public void setAttribute(String name, Object value) {
    attributes.put(name, value);
  }

  public Object getAttribute(String name) {
    return attributes.get(name);
  }

  @Override
  public String toString() {
    return method + " " + path + (queryString == null ? "" : "?" + queryString);
  }

  private static Map<String, List<String>> parseQuery(String query) {
    if (query == null || query.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, List<String>> result = new HashMap<>();
    for (String pair : query.split("&")) {
      if (pair.isEmpty()) {
        continue;
      }
      int eq = pair.indexOf('=');
      String key = eq >= 0 ? pair.substring(0, eq) : pair;
      String value = eq >= 0 ? pair.substring(eq + 1) : "";
      result
          .computeIfAbsent(decodeOrRaw(key, key), k -> new ArrayList<>())
          .add(decodeOrRaw(value, value));
    }
    return result;
  }

  /**
   * Decodes a form-encoded value. A malformed escape such as a bare {@code %} leaves the raw text
   * in place, so client input never fails request construction.
   */
  private static String decodeOrRaw(String encoded, String raw) {
    try {
      return URLDecoder.decode(encoded, StandardCharsets.UTF_8);
    } catch (IllegalArgumentException e) {
      logger.debug("Keeping undecodable value {}: {}", raw, e.getMessage());
      return raw;
    }
  }

  /** Builder for requests coming from a transport or a test harness. */
  public static class Builder {
    private final String method;
    private final String path;
    private String queryString;
    private final HttpHeaders headers = new HttpHeaders();
    private byte[] body;

    private Builder(String method, String target) {
      if (method == null || method.isEmpty()) {
        throw new IllegalArgumentException("Request method must not be empty");
      }
      this.method = method;
      String t = target == null || target.isEmpty() ? "/" : target;
      int q = t.indexOf('?');
      if (q >= 0) {
        this.queryString = t.substring(q + 1);
        t = t.substring(0, q);
      }
      this.path = t.isEmpty() ? "/" : t;
    }

    public Builder query(String queryString) {
      this.queryString = queryString;
      return this;
    }

    public Builder header(String name, String value) {
      headers.add(name, value);
      return this;
    }

    public Builder headers(Map<String, String> values) {
      values.forEach(headers::add);
      return this;
    }

    public Builder body(byte[] bytes) {
      this.body = bytes;
      return this;
    }

    public Builder body(String text) {
      this.body = text == null ? null : text.getBytes(StandardCharsets.UTF_8);
      return this;
    }

    public Request build() {
      return new Request(this);
    }
  }
}
