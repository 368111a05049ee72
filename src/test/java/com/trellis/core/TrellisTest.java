package com.trellis.core;

import com.trellis.http.FinalResponse;
import com.trellis.http.Request;
import com.trellis.middleware.Middleware;
import com.trellis.plugin.MissingDependencyException;
import com.trellis.plugin.Plugin;
import com.trellis.routing.RouteCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Dispatch tests for the Trellis application, driven through {@link Trellis#handle(Request)}.
 */
@DisplayName("Trellis Dispatch Tests")
public class TrellisTest {

    private Trellis app;

    @BeforeEach
    void setUp() {
        app = new Trellis();
    }

    private FinalResponse get(String target) {
        return app.handle(Request.builder("GET", target).build());
    }

    @Nested
    @DisplayName("End-to-end scenarios")
    class Scenarios {

        @Test
        @DisplayName("Parameter route should return the bound id as JSON")
        void testParamRoute() {
            // Given: GET /users/:id returning {id}
            app.get("/users/:id", ctx -> ctx.json(Map.of("id", ctx.param("id"))));

            // When: /users/42 is requested
            FinalResponse response = get("/users/42");

            // Then: 200 with the id
            assertEquals(200, response.getStatus());
            assertEquals("{\"id\":\"42\"}", response.getBodyAsString());
            assertEquals("application/json", response.getHeader("Content-Type"));
        }

        @Test
        @DisplayName("Global middleware header should reach every response")
        void testGlobalHeader() {
            app.use((ctx, next) -> next.proceed().withHeader("X-Trace", "1"));
            app.get("/hello", ctx -> ctx.text("hi"));

            assertEquals("1", get("/hello").getHeader("X-Trace"));
            assertEquals("1", get("/missing").getHeader("X-Trace"));
        }

        @Test
        @DisplayName("Method mismatch should be a 404")
        void testMethodMismatch() {
            app.get("/a", ctx -> ctx.text("a"));

            FinalResponse response = app.handle(Request.builder("POST", "/a").build());

            assertEquals(404, response.getStatus());
            assertEquals("Not Found", response.getBodyAsString());
            assertEquals("text/plain", response.getHeader("Content-Type"));
        }

        @Test
        @DisplayName("Full cache should evict the least recently requested route")
        void testCacheEviction() {
            // Given: a cache of three entries filled by three distinct requests
            app = new Trellis(new TrellisConfig().routeCacheCapacity(3));
            app.get("/items/:id", ctx -> ctx.text(ctx.param("id")));
            get("/items/1");
            get("/items/2");
            get("/items/3");

            // When: a fourth distinct key is requested
            get("/items/4");

            // Then: the oldest is gone, the others remain
            RouteCache cache = app.getRouteCache();
            assertFalse(cache.contains("GET:/items/1"));
            assertTrue(cache.contains("GET:/items/2"));
            assertTrue(cache.contains("GET:/items/4"));

            long missesBefore = cache.stats().getMisses();
            assertEquals("1", get("/items/1").getBodyAsString());
            assertEquals(missesBefore + 1, cache.stats().getMisses());
        }

        @Test
        @DisplayName("Dependent plugin should see its dependency's service only in order")
        void testPluginDependencies() {
            Object[] calc = new Object[1];
            Plugin base = Plugin.builder("base", "1.0.0")
                    .onRegister(ctx -> ctx.registerService("calc", "calculator"))
                    .build();
            Plugin dependent = Plugin.builder("dependent", "1.0.0")
                    .dependencies("base")
                    .onRegister(ctx -> calc[0] = ctx.getService("base:calc"))
                    .build();

            // Reversed order fails
            Trellis reversed = new Trellis();
            assertThrows(MissingDependencyException.class, () -> reversed.register(dependent));

            app.register(base).register(dependent);
            assertEquals("calculator", calc[0]);
        }
    }

    @Nested
    @DisplayName("Dispatch")
    class Dispatch {

        @Test
        @DisplayName("Middleware tiers should wrap the handler in order")
        void testTierOrder() {
            List<String> events = new ArrayList<>();
            app.use(recording("global", events));
            app.use("/api", recording("scoped", events));
            app.get("/api/users", ctx -> {
                events.add("handler");
                ctx.text("users");
            }, recording("route", events));

            get("/api/users");

            assertEquals(Arrays.asList("global", "scoped", "route", "handler",
                    "route-after", "scoped-after", "global-after"), events);
        }

        @Test
        @DisplayName("Short-circuiting middleware should prevent the handler from running")
        void testShortCircuit() throws Exception {
            Trellis.Handler handler = mock(Trellis.Handler.class);
            app.use((ctx, next) -> ctx.response().status(403).text("Forbidden").finish());
            app.get("/admin", handler);

            FinalResponse response = get("/admin");

            assertEquals(403, response.getStatus());
            verify(handler, never()).handle(any());
        }

        @Test
        @DisplayName("Handler that sends nothing should give an implicit 200")
        void testImplicitResponse() {
            app.get("/noop", ctx -> { });

            FinalResponse response = get("/noop");

            assertEquals(200, response.getStatus());
            assertEquals(0, response.getContentLength());
        }

        @Test
        @DisplayName("Uncaught exceptions should become a generic 500")
        void testUncaughtException() {
            app.get("/fail", ctx -> {
                throw new IllegalStateException("secret detail");
            });

            FinalResponse response = get("/fail");

            assertEquals(500, response.getStatus());
            assertEquals("Internal Server Error", response.getBodyAsString());
        }

        @Test
        @DisplayName("Sending twice should surface as a 500")
        void testDoubleSend() {
            app.get("/twice", ctx -> {
                ctx.text("one");
                ctx.text("two");
            });

            assertEquals(500, get("/twice").getStatus());
        }

        @Test
        @DisplayName("Malformed escapes in parameters should be a 400")
        void testMalformedPath() {
            app.get("/files/:name", ctx -> ctx.text(ctx.param("name")));

            assertEquals(400, get("/files/%E0%A4%A").getStatus());
        }

        @Test
        @DisplayName("Cache hits should still run route middleware")
        void testCacheHitRunsRouteMiddleware() {
            AtomicInteger calls = new AtomicInteger();
            app.get("/counted", ctx -> ctx.text("ok"), (ctx, next) -> {
                calls.incrementAndGet();
                return next.proceed();
            });

            get("/counted");
            get("/counted");

            assertEquals(2, calls.get());
            assertEquals(1, app.getRouteCache().stats().getHits());
        }

        @Test
        @DisplayName("Query strings should not be part of the cache key")
        void testQueryExcludedFromKey() {
            app.get("/search", ctx -> ctx.text(ctx.query("q")));

            assertEquals("a", get("/search?q=a").getBodyAsString());
            assertEquals("b", get("/search?q=b").getBodyAsString());
            assertEquals(1, app.getRouteCache().stats().getSize());
        }

        @Test
        @DisplayName("Method case should not split cache entries")
        void testCacheKeyUsesCanonicalMethod() {
            app.get("/a", ctx -> ctx.text("a"));

            app.handle(Request.builder("get", "/a").build());
            FinalResponse response = app.handle(Request.builder("GET", "/a").build());

            assertEquals("a", response.getBodyAsString());
            assertEquals(1, app.getRouteCache().stats().getSize());
            assertEquals(1, app.getRouteCache().stats().getHits());
            assertNotNull(app.getRouteCache().get("GET:/a"));
        }

        @Test
        @DisplayName("Bare percent signs in query and cookies should reach the handler")
        void testBarePercentInQueryAndCookie() {
            // Given: a handler reading both a query value and a cookie
            app.get("/c", ctx -> ctx.text(ctx.query("d") + "|" + ctx.request().getCookie("a")));

            // When: both carry an incomplete escape
            FinalResponse response = app.handle(Request.builder("GET", "/c?d=50%")
                    .header("Cookie", "a=100%; b=1")
                    .build());

            // Then: the request is served with the raw values
            assertEquals(200, response.getStatus());
            assertEquals("50%|100%", response.getBodyAsString());
        }

        @Test
        @DisplayName("Disabled cache should resolve every request through the router")
        void testCacheDisabled() {
            app = new Trellis(new TrellisConfig().routeCacheEnabled(false));
            app.get("/x", ctx -> ctx.text("x"));

            get("/x");
            get("/x");

            assertEquals(0, app.getRouteCache().stats().getSize());
        }

        @Test
        @DisplayName("Mounted apps should serve under the base path with their middleware")
        void testMount() {
            Trellis api = new Trellis();
            api.use((ctx, next) -> next.proceed().withHeader("X-Api", "1"));
            api.get("/status", ctx -> ctx.text("up"));

            app.mount("/api", api);
            app.get("/home", ctx -> ctx.text("home"));

            FinalResponse status = get("/api/status");
            assertEquals("up", status.getBodyAsString());
            assertEquals("1", status.getHeader("X-Api"));
            assertNull(get("/home").getHeader("X-Api"));
        }

        @Test
        @DisplayName("Application locals should be stored and read back")
        void testLocals() {
            app.set("name", "trellis");

            String name = app.get("name");

            assertEquals("trellis", name);
        }
    }

    private static Middleware recording(String name, List<String> events) {
        return (ctx, next) -> {
            events.add(name);
            FinalResponse response = next.proceed();
            events.add(name + "-after");
            return response;
        };
    }
}
