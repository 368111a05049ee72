package com.trellis.core;

import com.trellis.routing.RouteCache;
import java.util.Properties;

/**
 * Application configuration. Values come from fluent setters or from properties named
 * {@code trellis.*}.
 */
public class TrellisConfig {
  public static final String HOST = "trellis.host";
  public static final String PORT = "trellis.port";
  public static final String ROUTE_CACHE_CAPACITY = "trellis.routeCache.capacity";
  public static final String ROUTE_CACHE_ENABLED = "trellis.routeCache.enabled";
  public static final String DEV = "trellis.dev";

  private String host = "0.0.0.0";
  private int port = 8080;
  private int routeCacheCapacity = RouteCache.DEFAULT_CAPACITY;
  private boolean routeCacheEnabled = true;
  private boolean dev = false;

  /**
   * Reads configuration from properties. Missing keys keep their defaults.
   *
   * @param properties the properties
   * @return the configuration
   * @throws IllegalArgumentException if a numeric value cannot be parsed
   */
  public static TrellisConfig fromProperties(Properties properties) {
    TrellisConfig config = new TrellisConfig();
    config.host(properties.getProperty(HOST, config.host));
    config.port(intProperty(properties, PORT, config.port));
    config.routeCacheCapacity(
        intProperty(properties, ROUTE_CACHE_CAPACITY, config.routeCacheCapacity));
    config.routeCacheEnabled(
        Boolean.parseBoolean(
            properties.getProperty(ROUTE_CACHE_ENABLED, String.valueOf(config.routeCacheEnabled))));
    config.dev(Boolean.parseBoolean(properties.getProperty(DEV, String.valueOf(config.dev))));
    return config;
  }

  /**
   * Reads configuration from JVM system properties.
   *
   * @return the configuration
   */
  public static TrellisConfig fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  private static int intProperty(Properties properties, String key, int defaultValue) {
    String value = properties.getProperty(key);
    if (value == null || value.trim().isEmpty()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
    }
  }

  public TrellisConfig host(String host) {
    this.host = host;
    return this;
  }

  /**
   * Sets the port. 0 binds an ephemeral port.
   *
   * @param port the port to listen on
   * @return this configuration
   */
  public TrellisConfig port(int port) {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Port out of range: " + port);
    }
    this.port = port;
    return this;
  }

  public TrellisConfig routeCacheCapacity(int capacity) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("Route cache capacity must be positive: " + capacity);
    }
    this.routeCacheCapacity = capacity;
    return this;
  }

  public TrellisConfig routeCacheEnabled(boolean enabled) {
    this.routeCacheEnabled = enabled;
    return this;
  }

  public TrellisConfig dev(boolean dev) {
    this.dev = dev;
    return this;
  }

  public String getHost() {
    return host;
  }

  public int getPort() {
    return port;
  }

  public int getRouteCacheCapacity() {
    return routeCacheCapacity;
  }

  public boolean isRouteCacheEnabled() {
    return routeCacheEnabled;
  }

  public boolean isDev() {
    return dev;
  }
}
