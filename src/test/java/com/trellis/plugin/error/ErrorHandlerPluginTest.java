package com.trellis.plugin.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.trellis.core.Trellis;
import com.trellis.core.TrellisConfig;
import com.trellis.http.FinalResponse;
import com.trellis.http.HttpException;
import com.trellis.http.Request;
import com.trellis.plugin.PluginRegistrationOptions;
import com.trellis.util.JsonUtil;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ErrorHandlerPlugin Tests")
public class ErrorHandlerPluginTest {

    @Test
    @DisplayName("Should turn handler exceptions into JSON errors")
    void testConvertsExceptions() throws Exception {
        // Given: an app with the error handler and a failing route
        Trellis app = new Trellis();
        app.register(new ErrorHandlerPlugin());
        app.get("/users/:id", ctx -> {
            throw HttpException.notFound("User " + ctx.param("id") + " not found");
        });

        // When: the route is requested
        FinalResponse response = app.handle(Request.builder("GET", "/users/9").build());

        // Then: the status and message come from the exception
        JsonNode body = JsonUtil.parseJson(response.getBodyAsString());
        assertEquals(404, response.getStatus());
        assertEquals("User 9 not found", body.get("message").asText());
        assertNull(body.get("exception"));
    }

    @Test
    @DisplayName("Should include details when the app runs in dev mode")
    void testDevModeFromApp() throws Exception {
        Trellis app = new Trellis(new TrellisConfig().dev(true));
        app.register(new ErrorHandlerPlugin());
        app.get("/fail", ctx -> {
            throw new IllegalStateException("broken");
        });

        FinalResponse response = app.handle(Request.builder("GET", "/fail").build());

        JsonNode body = JsonUtil.parseJson(response.getBodyAsString());
        assertEquals(500, response.getStatus());
        assertEquals("broken", body.get("detail").asText());
    }

    @Test
    @DisplayName("Registration config should override the app's dev flag")
    void testDevModeFromConfig() throws Exception {
        Trellis app = new Trellis(new TrellisConfig().dev(true));
        app.register(new ErrorHandlerPlugin(), PluginRegistrationOptions.create().config("dev", false));
        app.get("/fail", ctx -> {
            throw new IllegalStateException("broken");
        });

        FinalResponse response = app.handle(Request.builder("GET", "/fail").build());

        assertFalse(response.getBodyAsString().contains("broken"));
    }
}
