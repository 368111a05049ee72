package com.trellis.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogUtil Tests")
public class LogUtilTest {

    @Test
    @DisplayName("Should highlight the plugin name and version")
    void testPlugin() {
        assertEquals("Registering plugin: " + ConsoleColors.CYAN_BOLD + "auth v1.0.0" + ConsoleColors.RESET,
                LogUtil.plugin("Registering", "auth", "1.0.0"));
        assertEquals("Starting plugin: " + ConsoleColors.CYAN_BOLD + "auth" + ConsoleColors.RESET,
                LogUtil.plugin("Starting", "auth", null));
    }

    @Test
    @DisplayName("Should color routes and status messages")
    void testColoredMessages() {
        assertEquals(ConsoleColors.GREEN + "GET" + ConsoleColors.RESET + " /users/:id",
                LogUtil.route("GET", "/users/:id"));
        assertEquals(ConsoleColors.GREEN_BOLD + "up" + ConsoleColors.RESET, LogUtil.success("up"));
        assertEquals(ConsoleColors.YELLOW_BOLD + "replaced" + ConsoleColors.RESET, LogUtil.warn("replaced"));
        assertEquals(ConsoleColors.RED + "failed" + ConsoleColors.RESET, LogUtil.error("failed"));
    }
}
