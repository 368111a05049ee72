package com.trellis.http;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FinalResponse Tests")
public class FinalResponseTest {

    @Test
    @DisplayName("withHeader should return a modified copy")
    void testWithHeader() {
        FinalResponse original = FinalResponse.text(200, "ok");

        FinalResponse traced = original.withHeader("X-Trace", "1");

        assertNull(original.getHeader("X-Trace"));
        assertEquals("1", traced.getHeader("X-Trace"));
        assertEquals("ok", traced.getBodyAsString());
        assertEquals("text/plain", traced.getHeader("Content-Type"));
    }

    @Test
    @DisplayName("withStatus should keep headers and body")
    void testWithStatus() {
        FinalResponse created = FinalResponse.text(200, "ok").withStatus(201);

        assertEquals(201, created.getStatus());
        assertEquals("ok", created.getBodyAsString());
    }

    @Test
    @DisplayName("Body should not be mutable from outside")
    void testBodyIsCopied() {
        byte[] body = {1, 2};
        FinalResponse response = new FinalResponse(200, new HttpHeaders(), body);
        body[0] = 9;
        response.getBody()[1] = 9;

        assertArrayEquals(new byte[] {1, 2}, response.getBody());
    }
}
