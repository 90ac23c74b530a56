package io.contractrpc.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Compiled path pattern with {@code :name} placeholders.
 *
 * <p>A placeholder occupies a whole {@code /}-delimited segment and captures any run of
 * non-{@code /} characters; every other segment must match literally. Patterns are compiled once,
 * when the contract is built, and are immutable afterwards.
 *
 * <pre>{@code
 * PathPattern p = PathPattern.compile("/users/:id/posts/:postId");
 * p.match("/users/42/posts/7");   // Optional[{id=42, postId=7}]
 * p.match("/users/42");           // Optional.empty
 * p.interpolate(Map.of("id", 42, "postId", 7)); // "/users/42/posts/7"
 * }</pre>
 */
public final class PathPattern {

    private final String pattern;
    private final List<Segment> segments;
    private final List<String> parameterNames;

    private PathPattern(String pattern, List<Segment> segments, List<String> parameterNames) {
        this.pattern = pattern;
        this.segments = segments;
        this.parameterNames = parameterNames;
    }

    public static PathPattern compile(String pattern) {
        Objects.requireNonNull(pattern, "pattern");
        if (!pattern.startsWith("/")) {
            throw new IllegalArgumentException("path pattern must start with '/': " + pattern);
        }
        String[] parts = pattern.split("/", -1);
        List<Segment> segments = new ArrayList<>(parts.length);
        Set<String> names = new LinkedHashSet<>();
        for (String part : parts) {
            if (part.startsWith(":")) {
                String name = part.substring(1);
                if (name.isEmpty()) throw new IllegalArgumentException("empty parameter name in " + pattern);
                if (!names.add(name)) throw new IllegalArgumentException("duplicate parameter '" + name + "' in " + pattern);
                segments.add(new Segment(name, true));
            } else {
                segments.add(new Segment(part, false));
            }
        }
        return new PathPattern(pattern, List.copyOf(segments), List.copyOf(names));
    }

    /**
     * @return the source pattern, e.g. {@code /users/:id}
     */
    public String pattern() {
        return pattern;
    }

    /**
     * @return placeholder names in declaration order
     */
    public List<String> parameterNames() {
        return parameterNames;
    }

    /**
     * Matches a concrete path.
     *
     * @param path raw path without query string
     * @return the captured parameters, or empty when the path does not match
     */
    public Optional<Map<String, String>> match(String path) {
        if (path == null) return Optional.empty();
        String[] parts = path.split("/", -1);
        if (parts.length != segments.size()) return Optional.empty();

        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < parts.length; i++) {
            Segment s = segments.get(i);
            if (s.parameter()) {
                params.put(s.text(), parts[i]);
            } else if (!s.text().equals(parts[i])) {
                return Optional.empty();
            }
        }
        return Optional.of(params);
    }

    /**
     * Substitutes parameter values into the pattern. Values are inserted verbatim (callers building URLs
     * encode them first); placeholders without a value are left in place.
     */
    public String interpolate(Map<String, ?> params) {
        Map<String, ?> values = params == null ? Map.of() : params;
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) sb.append('/');
            Segment s = segments.get(i);
            if (s.parameter() && values.containsKey(s.text()) && values.get(s.text()) != null) {
                sb.append(values.get(s.text()));
            } else if (s.parameter()) {
                sb.append(':').append(s.text());
            } else {
                sb.append(s.text());
            }
        }
        return sb.toString();
    }

    /**
     * Interface-description form: {@code /users/:id} becomes {@code /users/{id}}.
     */
    public String toOpenApiPath() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) sb.append('/');
            Segment s = segments.get(i);
            if (s.parameter()) {
                sb.append('{').append(s.text()).append('}');
            } else {
                sb.append(s.text());
            }
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof PathPattern other && pattern.equals(other.pattern);
    }

    @Override
    public int hashCode() {
        return pattern.hashCode();
    }

    @Override
    public String toString() {
        return pattern;
    }

    private record Segment(String text, boolean parameter) {}
}
