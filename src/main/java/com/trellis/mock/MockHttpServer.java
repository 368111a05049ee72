package com.trellis.mock;

import com.trellis.core.Trellis;
import com.trellis.http.FinalResponse;
import com.trellis.http.Request;
import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory HTTP harness. Builds synthetic requests, dispatches them straight into a
 * {@link Trellis} application without a network listener and records every exchange.
 */
public class MockHttpServer {
  private static final Logger logger = LoggerFactory.getLogger(MockHttpServer.class);

  public static final String DEFAULT_BASE_URL = "http://localhost";

  private final Trellis app;
  private final String baseUrl;
  private final List<Exchange> history = Collections.synchronizedList(new ArrayList<>());

  public MockHttpServer(Trellis app) {
    this(app, DEFAULT_BASE_URL);
  }

  /**
   * Creates a harness.
   *
   * @param app the application to dispatch into
   * @param baseUrl the base URL relative request URLs are resolved against
   */
  public MockHttpServer(Trellis app, String baseUrl) {
    this.app = app;
    this.baseUrl = baseUrl;
  }

  /**
   * Sends a request.
   *
   * @param method the HTTP method
   * @param url an absolute URL or a path relative to the base URL, with optional query string
   * @param headers request headers, may be null
   * @param body the body, may be null
   * @return the response
   */
  public FinalResponse request(String method, String url, Map<String, String> headers, String body) {
    URI uri = resolve(url);
    String target = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
    Request.Builder builder = Request.builder(method, target);
    if (uri.getRawQuery() != null) {
      builder.query(uri.getRawQuery());
    }
    if (uri.getHost() != null) {
      builder.header("Host", uri.getPort() > 0 ? uri.getHost() + ":" + uri.getPort() : uri.getHost());
    }
    if (headers != null) {
      builder.headers(headers);
    }
    if (body != null) {
      builder.body(body);
    }
    Request request = builder.build();

    FinalResponse response = app.handle(request);
    history.add(new Exchange(request, response, System.currentTimeMillis()));
    logger.debug("{} -> {}", request, response.getStatus());
    return response;
  }

  public FinalResponse get(String url) {
    return request("GET", url, null, null);
  }

  public FinalResponse get(String url, Map<String, String> headers) {
    return request("GET", url, headers, null);
  }

  public FinalResponse post(String url, String body) {
    return request("POST", url, null, body);
  }

  public FinalResponse post(String url, String body, Map<String, String> headers) {
    return request("POST", url, headers, body);
  }

  public FinalResponse put(String url, String body) {
    return request("PUT", url, null, body);
  }

  public FinalResponse delete(String url) {
    return request("DELETE", url, null, null);
  }

  /**
   * Gets the recorded exchanges, oldest first.
   *
   * @return a snapshot of the history
   */
  public List<Exchange> getHistory() {
    synchronized (history) {
      return new ArrayList<>(history);
    }
  }

  public void clearHistory() {
    history.clear();
  }

  public Trellis getApp() {
    return app;
  }

  private URI resolve(String url) {
    if (url == null || url.isEmpty()) {
      return URI.create(baseUrl + "/");
    }
    if (url.startsWith("http://") || url.startsWith("https://")) {
      return URI.create(url);
    }
    return URI.create(baseUrl + (url.startsWith("/") ? url : "/" + url));
  }

  /** A recorded request and its response. */
  public static final class Exchange {
    private final Request request;
    private final FinalResponse response;
    private final long timestamp;

    Exchange(Request request, FinalResponse response, long timestamp) {
      this.request = request;
      this.response = response;
      this.timestamp = timestamp;
    }

    public Request getRequest() {
      return request;
    }

    public FinalResponse getResponse() {
      return response;
    }

    public long getTimestamp() {
      return timestamp;
    }
  }
}
