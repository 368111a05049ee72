package com.trellis.plugin;

import com.trellis.middleware.MiddlewarePipeline;
import com.trellis.routing.Router;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PluginBuilder Tests")
public class PluginBuilderTest {

    @Test
    @DisplayName("Should require a name, a version and a register function")
    void testValidation() {
        IllegalStateException noName = assertThrows(IllegalStateException.class,
                () -> new PluginBuilder().version("1.0.0").onRegister(ctx -> { }).build());
        IllegalStateException noVersion = assertThrows(IllegalStateException.class,
                () -> new PluginBuilder().name("x").onRegister(ctx -> { }).build());
        IllegalStateException noRegister = assertThrows(IllegalStateException.class,
                () -> Plugin.builder("x", "1.0.0").build());

        assertEquals("Plugin name is required", noName.getMessage());
        assertEquals("Plugin version is required", noVersion.getMessage());
        assertEquals("Plugin register function is required", noRegister.getMessage());
    }

    @Test
    @DisplayName("Should carry metadata")
    void testMetadata() {
        Plugin plugin = Plugin.builder("search", "2.1.0")
                .description("Full text search")
                .author("Search Team")
                .dependencies("db", "cache")
                .tags("search", "core")
                .onRegister(ctx -> { })
                .build();

        PluginMetadata metadata = plugin.getMetadata();
        assertEquals("search", plugin.getName());
        assertEquals("2.1.0", metadata.getVersion());
        assertEquals("Full text search", metadata.getDescription());
        assertEquals("Search Team", metadata.getAuthor());
        assertEquals(Arrays.asList("db", "cache"), metadata.getDependencies());
        assertEquals(Arrays.asList("search", "core"), metadata.getTags());
    }

    @Test
    @DisplayName("Hooks set on the builder should run through the manager")
    void testHooks() {
        List<String> events = new ArrayList<>();
        Plugin plugin = Plugin.builder("hooks", "1.0.0")
                .beforeRegister(ctx -> events.add("beforeRegister"))
                .onRegister(ctx -> events.add("register"))
                .afterRegister(ctx -> events.add("afterRegister"))
                .beforeStart(ctx -> events.add("beforeStart"))
                .afterStart(ctx -> events.add("afterStart"))
                .beforeStop(ctx -> events.add("beforeStop"))
                .afterStop(ctx -> events.add("afterStop"))
                .build();
        PluginManager manager = new PluginManager(null, new Router(), new MiddlewarePipeline());

        manager.register(plugin);
        manager.start();
        manager.stop();

        assertEquals(Arrays.asList("beforeRegister", "register", "afterRegister", "beforeStart",
                "afterStart", "beforeStop", "afterStop"), events);
    }

    @Test
    @DisplayName("Metadata should reject empty names")
    void testMetadataValidation() {
        assertThrows(IllegalArgumentException.class, () -> PluginMetadata.of("", "1.0.0"));
        assertThrows(IllegalArgumentException.class, () -> PluginMetadata.of("x", null));
    }
}
