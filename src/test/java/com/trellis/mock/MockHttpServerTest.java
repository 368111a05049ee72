package com.trellis.mock;

import com.trellis.core.Trellis;
import com.trellis.http.FinalResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MockHttpServer Tests")
public class MockHttpServerTest {

    private Trellis app;
    private MockHttpServer server;

    @BeforeEach
    void setUp() {
        app = new Trellis();
        app.get("/search", ctx -> ctx.text(ctx.query("q") + "|" + ctx.header("Host")));
        app.post("/echo", ctx -> ctx.type("application/json").send(ctx.body()));
        app.put("/items/:id", ctx -> ctx.text("put " + ctx.param("id") + " " + ctx.body()));
        app.delete("/items/:id", ctx -> ctx.status(204).response().end());
        server = new MockHttpServer(app);
    }

    @Test
    @DisplayName("Should resolve relative URLs against the base URL and parse the query")
    void testRelativeUrl() {
        FinalResponse response = server.get("/search?q=hello%20world");

        assertEquals(200, response.getStatus());
        assertEquals("hello world|localhost", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should accept absolute URLs")
    void testAbsoluteUrl() {
        FinalResponse response = server.get("http://example.com:8081/search?q=x");

        assertEquals("x|example.com:8081", response.getBodyAsString());
    }

    @Test
    @DisplayName("Should pass headers and bodies through")
    void testHeadersAndBody() {
        FinalResponse response = server.post("/echo", "{\"a\":1}", Map.of("X-Trace", "t1"));

        assertEquals(200, response.getStatus());
        assertEquals("{\"a\":1}", response.getBodyAsString());
        assertEquals("application/json", response.getHeader("Content-Type"));
        assertEquals("t1", server.getHistory().get(0).getRequest().getHeader("x-trace"));
    }

    @Test
    @DisplayName("Should support PUT and DELETE")
    void testPutAndDelete() {
        assertEquals("put 7 data", server.put("/items/7", "data").getBodyAsString());

        FinalResponse deleted = server.delete("/items/7");
        assertEquals(204, deleted.getStatus());
        assertEquals(0, deleted.getContentLength());
    }

    @Test
    @DisplayName("Should record and clear the exchange history")
    void testHistory() {
        // Given: two requests
        server.get("/search?q=a");
        server.get("/missing");

        // When: reading the history
        List<MockHttpServer.Exchange> history = server.getHistory();

        // Then: both are recorded in order with their responses
        assertEquals(2, history.size());
        assertEquals("/search", history.get(0).getRequest().getPath());
        assertEquals(404, history.get(1).getResponse().getStatus());
        assertTrue(history.get(0).getTimestamp() > 0);

        server.clearHistory();
        assertTrue(server.getHistory().isEmpty());
        assertSame(app, server.getApp());
    }
}
