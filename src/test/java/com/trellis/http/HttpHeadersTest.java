package com.trellis.http;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpHeaders Tests")
public class HttpHeadersTest {

    @Test
    @DisplayName("Should keep the first spelling and insertion order")
    void testOrderAndSpelling() {
        HttpHeaders headers = new HttpHeaders()
                .set("Content-Type", "text/plain")
                .add("X-Trace", "1")
                .add("x-trace", "2");

        assertEquals(Arrays.asList("Content-Type", "X-Trace"), Arrays.asList(headers.names().toArray()));
        assertEquals(Arrays.asList("1", "2"), headers.getAll("X-TRACE"));
    }

    @Test
    @DisplayName("Copies should be independent")
    void testCopy() {
        HttpHeaders original = new HttpHeaders().set("A", "1");
        HttpHeaders copy = original.copy().set("A", "2");

        assertEquals("1", original.getFirst("A"));
        assertEquals("2", copy.getFirst("a"));
    }

    @Test
    @DisplayName("Unmodifiable views should reject writes")
    void testUnmodifiable() {
        HttpHeaders headers = new HttpHeaders().set("A", "1").unmodifiable();

        assertThrows(UnsupportedOperationException.class, () -> headers.remove("A"));
        assertTrue(headers.contains("a"));
    }

    @Test
    @DisplayName("Should reject empty header names")
    void testEmptyName() {
        assertThrows(IllegalArgumentException.class, () -> new HttpHeaders().set("", "x"));
    }
}
