package com.trellis.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.trellis.util.JsonUtil;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-assignment response builder with a fluent API.
 *
 * <p>Non-terminal mutators may be called any number of times while the response is {@link
 * ResponseState#PENDING}. The first terminal mutator ({@code json}, {@code send}, {@code html},
 * {@code text}, {@code redirect}, {@code end}) captures status, headers and body and moves the
 * builder to {@link ResponseState#SENT}. From then on every mutator throws {@link
 * AlreadySentException}.
 *
 * <p>A builder belongs to exactly one request and is not safe for concurrent mutation.
 */
public class Response {
  private static final Logger logger = LoggerFactory.getLogger(Response.class);

  public static final String CONTENT_TYPE = "Content-Type";
  private static final String CLEARED_COOKIE_SUFFIX =
      "=; Max-Age=0; Expires=Thu, 01 Jan 1970 00:00:00 GMT";

  private final HttpHeaders headers = new HttpHeaders();
  private int status = 200;
  private byte[] body;
  private ResponseState state = ResponseState.PENDING;
  private FinalResponse result;

  /**
   * Sets the response status code.
   *
   * @param code the status code
   * @return this response for method chaining
   */
  public Response status(int code) {
    ensurePending("status");
    this.status = code;
    return this;
  }

  /**
   * Sets a response header, replacing any previous value.
   *
   * @param name the header name
   * @param value the header value
   * @return this response for method chaining
   */
  public Response header(String name, String value) {
    ensurePending("header");
    headers.set(name, value);
    return this;
  }

  /**
   * Sets several response headers.
   *
   * @param values the headers to set
   * @return this response for method chaining
   */
  public Response headers(Map<String, String> values) {
    ensurePending("headers");
    for (Map.Entry<String, String> entry : values.entrySet()) {
      headers.set(entry.getKey(), entry.getValue());
    }
    return this;
  }

  /**
   * Appends a Set-Cookie header.
   *
   * @param name the cookie name
   * @param value the cookie value
   * @param options cookie attributes, may be null
   * @return this response for method chaining
   */
  public Response cookie(String name, String value, CookieOptions options) {
    ensurePending("cookie");
    CookieOptions opts = options == null ? CookieOptions.defaults() : options;
    headers.add("Set-Cookie", opts.render(name, value));
    return this;
  }

  public Response cookie(String name, String value) {
    return cookie(name, value, null);
  }

  /**
   * Appends a Set-Cookie header that expires the cookie immediately.
   *
   * @param name the cookie name
   * @return this response for method chaining
   */
  public Response clearCookie(String name) {
    ensurePending("clearCookie");
    headers.add("Set-Cookie", name + CLEARED_COOKIE_SUFFIX);
    return this;
  }

  /**
   * Sets the Content-Type header.
   *
   * @param contentType the content type
   * @return this response for method chaining
   */
  public Response type(String contentType) {
    ensurePending("type");
    headers.set(CONTENT_TYPE, contentType);
    return this;
  }

  /**
   * Marks the response as a download.
   *
   * @return this response for method chaining
   */
  public Response attachment() {
    return attachment(null);
  }

  /**
   * Marks the response as a download with a file name.
   *
   * @param filename the file name, may be null
   * @return this response for method chaining
   */
  public Response attachment(String filename) {
    ensurePending("attachment");
    String disposition = "attachment";
    if (filename != null && !filename.isEmpty()) {
      disposition += "; filename=\"" + filename + "\"";
    }
    headers.set("Content-Disposition", disposition);
    return this;
  }

  /**
   * Adds a header name to the Vary header unless it is already listed.
   *
   * @param headerName the header name to vary on
   * @return this response for method chaining
   */
  public Response vary(String headerName) {
    ensurePending("vary");
    String current = headers.getFirst("Vary");
    if (current == null || current.isEmpty()) {
      headers.set("Vary", headerName);
      return this;
    }
    boolean present =
        Arrays.stream(current.split(","))
            .map(String::trim)
            .anyMatch(token -> token.equalsIgnoreCase(headerName));
    if (!present) {
      headers.set("Vary", current + ", " + headerName);
    }
    return this;
  }

  /**
   * Serializes an object to JSON and sends it with Content-Type 'application/json'.
   *
   * @param data the object to serialize
   * @return this response for method chaining
   */
  public Response json(Object data) {
    ensurePending("json");
    String json;
    try {
      json = JsonUtil.toJson(data);
    } catch (JsonProcessingException e) {
      logger.error("Error serializing object to JSON", e);
      status = 500;
      headers.set(CONTENT_TYPE, "text/plain");
      return finishWith("Error processing JSON".getBytes(StandardCharsets.UTF_8));
    }
    defaultContentType("application/json");
    return finishWith(json.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Sends data, choosing the encoding from its runtime type. Strings, numbers, booleans and
   * characters are sent as 'text/plain'; byte arrays are sent raw; anything else is serialized to
   * JSON.
   *
   * @param data the data to send
   * @return this response for method chaining
   */
  public Response send(Object data) {
    ensurePending("send");
    if (data == null) {
      defaultContentType("text/plain");
      return finishWith(null);
    }
    if (data instanceof CharSequence
        || data instanceof Number
        || data instanceof Boolean
        || data instanceof Character) {
      defaultContentType("text/plain");
      return finishWith(String.valueOf(data).getBytes(StandardCharsets.UTF_8));
    }
    if (data instanceof byte[]) {
      defaultContentType("application/octet-stream");
      return finishWith((byte[]) data);
    }
    return json(data);
  }

  /**
   * Sends an HTML body.
   *
   * @param content the markup
   * @return this response for method chaining
   */
  public Response html(String content) {
    ensurePending("html");
    defaultContentType("text/html");
    return finishWith(content.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Sends a plain text body.
   *
   * @param content the text
   * @return this response for method chaining
   */
  public Response text(String content) {
    ensurePending("text");
    defaultContentType("text/plain");
    return finishWith(content.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Performs a temporary (302) redirect.
   *
   * @param location the target URL
   * @return this response for method chaining
   */
  public Response redirect(String location) {
    return redirect(location, 302);
  }

  /**
   * Redirects with the given status code.
   *
   * @param location the target URL
   * @param code the redirect status
   * @return this response for method chaining
   */
  public Response redirect(String location, int code) {
    ensurePending("redirect");
    status = code;
    headers.set("Location", location);
    return finishWith(("Redirecting to " + location).getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Ends the response with whatever status and headers were set and an empty body.
   *
   * @return this response for method chaining
   */
  public Response end() {
    ensurePending("end");
    return finishWith(null);
  }

  /**
   * Finalizes the response. If no terminal mutator ran, the response is ended implicitly with the
   * accumulated status and headers and an empty body. Calling this again returns the same result.
   *
   * @return the immutable response
   */
  public FinalResponse finish() {
    if (state == ResponseState.PENDING) {
      finishWith(null);
    }
    return result;
  }

  public ResponseState getState() {
    return state;
  }

  public boolean isSent() {
    return state == ResponseState.SENT;
  }

  public int getStatus() {
    return status;
  }

  /**
   * Gets the first value of a header set so far.
   *
   * @param name the header name
   * @return the value or null
   */
  public String getHeader(String name) {
    return headers.getFirst(name);
  }

  private void defaultContentType(String contentType) {
    if (!headers.contains(CONTENT_TYPE)) {
      headers.set(CONTENT_TYPE, contentType);
    }
  }

  private Response finishWith(byte[] bytes) {
    this.body = bytes;
    this.state = ResponseState.SENT;
    this.result = new FinalResponse(status, headers, body);
    return this;
  }

  private void ensurePending(String operation) {
    if (state == ResponseState.SENT) {
      throw new AlreadySentException(operation);
    }
  }
}
