package com.trellis.http;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Immutable result of a finalized {@link Response}.
 *
 * <p>Middleware that needs to change a response after {@code next} returned works on copies via
 * {@link #withHeader} and {@link #withStatus}.
 */
public final class FinalResponse {
  private static final byte[] EMPTY = new byte[0];

  private final int status;
  private final HttpHeaders headers;
  private final byte[] body;

  /**
   * Creates a final response.
   *
   * @param status the status code
   * @param headers the headers, copied
   * @param body the body bytes, copied; null means empty
   */
  public FinalResponse(int status, HttpHeaders headers, byte[] body) {
    this.status = status;
    this.headers = headers.unmodifiable();
    this.body = body == null ? EMPTY : body.clone();
  }

  /**
   * Creates a plain text response.
   *
   * @param status the status code
   * @param text the body
   * @return the response
   */
  public static FinalResponse text(int status, String text) {
    HttpHeaders headers = new HttpHeaders().set("Content-Type", "text/plain");
    return new FinalResponse(status, headers, text.getBytes(StandardCharsets.UTF_8));
  }

  public int getStatus() {
    return status;
  }

  /**
   * Gets a read-only view of the headers.
   *
   * @return the headers
   */
  public HttpHeaders getHeaders() {
    return headers;
  }

  public String getHeader(String name) {
    return headers.getFirst(name);
  }

  public List<String> getHeaderValues(String name) {
    return headers.getAll(name);
  }

  public byte[] getBody() {
    return body.clone();
  }

  public String getBodyAsString() {
    return new String(body, StandardCharsets.UTF_8);
  }

  public int getContentLength() {
    return body.length;
  }

  /**
   * Returns a copy with a header set, replacing existing values.
   *
   * @param name the header name
   * @param value the header value
   * @return the new response
   */
  public FinalResponse withHeader(String name, String value) {
    return new FinalResponse(status, headers.copy().set(name, value), body);
  }

  /**
   * Returns a copy with a header value appended.
   *
   * @param name the header name
   * @param value the header value
   * @return the new response
   */
  public FinalResponse withAddedHeader(String name, String value) {
    return new FinalResponse(status, headers.copy().add(name, value), body);
  }

  /**
   * Returns a copy with a different status.
   *
   * @param newStatus the status code
   * @return the new response
   */
  public FinalResponse withStatus(int newStatus) {
    return new FinalResponse(newStatus, headers, body);
  }

  @Override
  public String toString() {
    return "FinalResponse{status=" + status + ", headers=" + headers + ", length=" + body.length
        + "}";
  }
}
