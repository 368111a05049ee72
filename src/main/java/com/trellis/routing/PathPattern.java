package com.trellis.routing;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compiled form of a route pattern such as {@code /users/:id} or {@code /static/*}.
 *
 * <p>A pattern is split on {@code /} into segment descriptors once, at route registration. A
 * segment is either a literal, a named parameter ({@code :name}) binding exactly one non-empty path
 * segment, or a trailing wildcard ({@code *}) capturing the rest of the path under the name
 * {@code *}.
 */
public class PathPattern {
    /** Parameter name under which a trailing wildcard is captured. */
    public static final String WILDCARD = "*";

    private final String pattern;
    private final List<Segment> segments;
    private final boolean wildcard;
    private final List<String> paramNames;

    private PathPattern(String pattern, List<Segment> segments) {
        this.pattern = pattern;
        this.segments = Collections.unmodifiableList(segments);
        this.wildcard = !segments.isEmpty()
                && segments.get(segments.size() - 1).kind == SegmentKind.WILDCARD;
        List<String> names = new ArrayList<>();
        for (Segment segment : segments) {
            if (segment.kind != SegmentKind.LITERAL) {
                names.add(segment.value);
            }
        }
        this.paramNames = Collections.unmodifiableList(names);
    }

    /**
     * Compiles a route pattern.
     *
     * @param pattern the route pattern
     * @return the compiled pattern
     * @throws IllegalArgumentException if the pattern is empty, has an unnamed parameter or a
     *     wildcard that is not the last segment
     */
    public static PathPattern compile(String pattern) {
        if (pattern == null || pattern.isEmpty()) {
            throw new IllegalArgumentException("Route pattern must not be empty");
        }
        String normalized = normalize(pattern);
        List<Segment> segments = new ArrayList<>();
        String[] parts = normalized.equals("/") ? new String[0] : normalized.substring(1).split("/");
        for (int i = 0; i < parts.length; i++) {
            String part = parts[i];
            if (part.equals(WILDCARD)) {
                if (i != parts.length - 1) {
                    throw new IllegalArgumentException(
                            "Wildcard must be the last segment of route pattern: " + pattern);
                }
                segments.add(new Segment(SegmentKind.WILDCARD, WILDCARD));
            } else if (part.startsWith(":")) {
                String name = part.substring(1);
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("Unnamed parameter in route pattern: " + pattern);
                }
                segments.add(new Segment(SegmentKind.PARAM, name));
            } else {
                segments.add(new Segment(SegmentKind.LITERAL, part));
            }
        }
        return new PathPattern(normalized, segments);
    }

    /**
     * Matches a request path against this pattern.
     *
     * @param path the request path, without query string
     * @return the extracted, percent-decoded parameters (read-only), or null if the path does not
     *     match
     * @throws IllegalArgumentException if a bound segment contains a malformed percent escape
     */
    public Map<String, String> match(String path) {
        if (path == null) {
            return null;
        }
        String candidate = path.startsWith("/") ? path : "/" + path;
        String[] parts;
        if (wildcard) {
            parts = candidate.substring(1).split("/", -1);
        } else {
            // One trailing slash is tolerated
            if (candidate.length() > 1 && candidate.endsWith("/")) {
                candidate = candidate.substring(0, candidate.length() - 1);
            }
            parts = candidate.equals("/") ? new String[0] : candidate.substring(1).split("/", -1);
        }

        int fixed = wildcard ? segments.size() - 1 : segments.size();
        if (wildcard ? parts.length < segments.size() : parts.length != fixed) {
            return null;
        }

        Map<String, String> params = null;
        for (int i = 0; i < fixed; i++) {
            Segment segment = segments.get(i);
            String part = parts[i];
            if (segment.kind == SegmentKind.LITERAL) {
                if (!segment.value.equals(part)) {
                    return null;
                }
            } else {
                if (part.isEmpty()) {
                    return null;
                }
                if (params == null) {
                    params = new LinkedHashMap<>();
                }
                params.put(segment.value, decode(part));
            }
        }

        if (wildcard) {
            StringBuilder rest = new StringBuilder();
            for (int i = fixed; i < parts.length; i++) {
                if (i > fixed) {
                    rest.append('/');
                }
                rest.append(parts[i]);
            }
            if (params == null) {
                params = new LinkedHashMap<>();
            }
            params.put(WILDCARD, decode(rest.toString()));
        }

        return params == null ? Collections.emptyMap() : Collections.unmodifiableMap(params);
    }

    /**
     * Percent-decodes a path segment. Unlike form decoding, {@code +} is kept literally.
     *
     * @param value the raw segment
     * @return the decoded value
     * @throws IllegalArgumentException if an escape is malformed
     */
    static String decode(String value) {
        if (value.indexOf('%') < 0) {
            return value;
        }
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    private static String normalize(String pattern) {
        String normalized = pattern.startsWith("/") ? pattern : "/" + pattern;
        if (normalized.length() > 1 && normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized;
    }

    /**
     * Gets the normalized pattern string.
     *
     * @return the pattern
     */
    public String getPattern() {
        return pattern;
    }

    public List<String> getParamNames() {
        return paramNames;
    }

    public boolean hasWildcard() {
        return wildcard;
    }

    /**
     * Checks whether the pattern has no parameter or wildcard segments.
     *
     * @return true for a purely literal pattern
     */
    public boolean isStatic() {
        return paramNames.isEmpty();
    }

    int segmentCount() {
        return segments.size();
    }

    @Override
    public String toString() {
        return pattern;
    }

    private enum SegmentKind {
        LITERAL,
        PARAM,
        WILDCARD
    }

    private static final class Segment {
        private final SegmentKind kind;
        private final String value;

        private Segment(SegmentKind kind, String value) {
            this.kind = kind;
            this.value = value;
        }
    }
}
