package com.trellis.util;

/** ANSI escape codes used to decorate lifecycle log lines. */
public final class ConsoleColors {
  public static final String RESET = "\033[0m";

  public static final String RED = "\033[0;31m";
  public static final String GREEN = "\033[0;32m";
  public static final String CYAN = "\033[0;36m";

  public static final String GREEN_BOLD = "\033[1;32m";
  public static final String YELLOW_BOLD = "\033[1;33m";
  public static final String CYAN_BOLD = "\033[1;36m";

  private ConsoleColors() {}

  /**
   * Wraps text in a color and a reset code.
   *
   * @param color the color escape
   * @param text the text
   * @return the colored text
   */
  public static String paint(String color, String text) {
    return color + text + RESET;
  }
}
