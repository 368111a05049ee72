package com.trellis.http;

import java.util.Locale;

/** The fixed set of HTTP verbs routes can be registered for. */
public enum HttpMethod {
  GET,
  POST,
  PUT,
  DELETE,
  PATCH,
  HEAD,
  OPTIONS,
  TRACE,
  CONNECT;

  /**
   * Looks up a method by name, ignoring case.
   *
   * @param name the method name, e.g. "get" or "POST"
   * @return the method or null if the name is not a known verb
   */
  public static HttpMethod lookup(String name) {
    if (name == null || name.isEmpty()) {
      return null;
    }
    try {
      return valueOf(name.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /**
   * Parses a method name, ignoring case.
   *
   * @param name the method name
   * @return the method
   * @throws IllegalArgumentException if the name is not a known verb
   */
  public static HttpMethod parse(String name) {
    HttpMethod method = lookup(name);
    if (method == null) {
      throw new IllegalArgumentException("Unsupported HTTP method: " + name);
    }
    return method;
  }
}
