package com.trellis.util;

/**
 * Builds colored log messages for framework lifecycle events. The level and timestamp are left to
 * the SLF4J backend; this only adds the highlighted subject.
 */
public final class LogUtil {

  private LogUtil() {}

  /**
   * Formats a plugin lifecycle message, e.g. "Registering plugin: auth v1.0.0".
   *
   * @param action the lifecycle action
   * @param name the plugin name
   * @param version the plugin version, may be null
   * @return the formatted message
   */
  public static String plugin(String action, String name, String version) {
    String subject = version == null ? name : name + " v" + version;
    return action + " plugin: " + ConsoleColors.paint(ConsoleColors.CYAN_BOLD, subject);
  }

  /**
   * Formats a route description, e.g. "GET /users/:id".
   *
   * @param method the method
   * @param path the route pattern
   * @return the formatted message
   */
  public static String route(String method, String path) {
    return ConsoleColors.paint(ConsoleColors.GREEN, method) + " " + path;
  }

  /**
   * Formats a success message.
   *
   * @param message the message
   * @return the formatted message
   */
  public static String success(String message) {
    return ConsoleColors.paint(ConsoleColors.GREEN_BOLD, message);
  }

  /**
   * Formats a warning message.
   *
   * @param message the message
   * @return the formatted message
   */
  public static String warn(String message) {
    return ConsoleColors.paint(ConsoleColors.YELLOW_BOLD, message);
  }

  /**
   * Formats an error message.
   *
   * @param message the message
   * @return the formatted message
   */
  public static String error(String message) {
    return ConsoleColors.paint(ConsoleColors.RED, message);
  }
}
