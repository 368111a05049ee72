package com.trellis.core;

import com.trellis.plugin.LifecycleHookException;
import com.trellis.plugin.Plugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the Undertow listener end to end with a real HTTP client.
 */
@DisplayName("Trellis HTTP Listener Tests")
public class TrellisHttpTest {

    private static final int CONNECTION_TIMEOUT_SECONDS = 5;
    private static final int REQUEST_TIMEOUT_SECONDS = 10;

    private Trellis app;
    private HttpClient httpClient;
    private List<String> lifecycle;

    @BeforeEach
    void setUp() {
        // Port 0 binds an ephemeral port
        app = new Trellis(new TrellisConfig().host("127.0.0.1").port(0));
        lifecycle = new ArrayList<>();
        httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(CONNECTION_TIMEOUT_SECONDS))
                .build();
    }

    @AfterEach
    void tearDown() {
        if (app != null) {
            app.stop();
        }
    }

    private HttpResponse<String> send(HttpRequest.Builder builder, String path) throws Exception {
        HttpRequest request = builder
                .uri(URI.create("http://127.0.0.1:" + app.getPort() + path))
                .timeout(Duration.ofSeconds(REQUEST_TIMEOUT_SECONDS))
                .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    @DisplayName("Should serve JSON with path parameters over HTTP")
    void testGetJson() throws Exception {
        // Given: a running server with a parameter route
        app.get("/users/:id", ctx -> ctx.json(Map.of("id", ctx.param("id"))));
        app.listen();

        // When: the route is requested
        HttpResponse<String> response = send(HttpRequest.newBuilder().GET(), "/users/a%20b");

        // Then: the escaped segment is decoded once by the router
        assertEquals(200, response.statusCode());
        assertEquals("{\"id\":\"a b\"}", response.body());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("application/json"));
    }

    @Test
    @DisplayName("Should read request bodies and write headers and cookies")
    void testPostEcho() throws Exception {
        app.post("/echo", ctx -> ctx.response()
                .status(201)
                .header("X-Echo", "yes")
                .cookie("seen", "1")
                .text(ctx.body()));
        app.listen();

        HttpResponse<String> response = send(
                HttpRequest.newBuilder().POST(HttpRequest.BodyPublishers.ofString("hello")), "/echo");

        assertEquals(201, response.statusCode());
        assertEquals("hello", response.body());
        assertEquals("yes", response.headers().firstValue("X-Echo").orElse(null));
        assertEquals("seen=1", response.headers().firstValue("Set-Cookie").orElse(null));
    }

    @Test
    @DisplayName("Should answer 404 for unknown routes")
    void testNotFound() throws Exception {
        app.listen();

        HttpResponse<String> response = send(HttpRequest.newBuilder().GET(), "/nothing");

        assertEquals(404, response.statusCode());
        assertEquals("Not Found", response.body());
    }

    @Test
    @DisplayName("listen and stop should drive plugin start and stop hooks")
    void testPluginLifecycle() throws Exception {
        app.register(Plugin.builder("probe", "1.0.0")
                .onRegister(ctx -> ctx.addRoute("GET", "/probe", c -> c.text("probe")))
                .beforeStart(ctx -> lifecycle.add("start"))
                .afterStop(ctx -> lifecycle.add("stop"))
                .build());

        app.listen();
        HttpResponse<String> response = send(HttpRequest.newBuilder().GET(), "/probe");
        app.stop();

        assertEquals("probe", response.body());
        assertEquals(Arrays.asList("start", "stop"), lifecycle);
    }

    @Test
    @DisplayName("A failing stop hook should still release the listener")
    void testStopReleasesPortWhenHookFails() throws Exception {
        // Given: a running server whose plugin fails while stopping
        app.register(Plugin.builder("flaky", "1.0.0")
                .onRegister(ctx -> ctx.addRoute("GET", "/ping", c -> c.text("pong")))
                .beforeStop(ctx -> {
                    throw new IllegalStateException("stop failed");
                })
                .build());
        app.listen();
        int port = app.getPort();
        assertEquals("pong", send(HttpRequest.newBuilder().GET(), "/ping").body());

        // When: stopping
        LifecycleHookException failure = assertThrows(LifecycleHookException.class, app::stop);

        // Then: the hook failure surfaces and the port no longer accepts connections
        assertEquals("beforeStop", failure.getHook());
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("http://127.0.0.1:" + port + "/ping"))
                .timeout(Duration.ofSeconds(REQUEST_TIMEOUT_SECONDS))
                .GET()
                .build();
        assertThrows(IOException.class, () -> httpClient.send(request, HttpResponse.BodyHandlers.ofString()));
        assertEquals(0, app.getPort());

        // The plugin would fail again on the teardown stop
        app = null;
    }
}
