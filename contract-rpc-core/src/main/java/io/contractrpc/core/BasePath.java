package io.contractrpc.core;

import java.util.Optional;

/**
 * Normalized mount prefix shared by routers and clients: a leading {@code /}, no trailing {@code /},
 * or the empty string for "mounted at the root".
 */
public final class BasePath {

    private static final BasePath ROOT = new BasePath("");

    private final String value;

    private BasePath(String value) {
        this.value = value;
    }

    public static BasePath root() {
        return ROOT;
    }

    public static BasePath of(String raw) {
        if (raw == null || raw.isBlank() || raw.equals("/")) return ROOT;
        String v = raw.trim();
        if (!v.startsWith("/")) v = "/" + v;
        while (v.endsWith("/")) v = v.substring(0, v.length() - 1);
        return v.isEmpty() ? ROOT : new BasePath(v);
    }

    public String value() {
        return value;
    }

    /**
     * Removes the prefix from a request path.
     *
     * @return the remaining path ({@code /} when nothing remains), or empty if the path lies outside the prefix
     */
    public Optional<String> strip(String path) {
        if (value.isEmpty()) return Optional.of(path);
        if (path.equals(value)) return Optional.of("/");
        if (path.startsWith(value + "/")) return Optional.of(path.substring(value.length()));
        return Optional.empty();
    }

    public String prepend(String path) {
        return value + path;
    }

    @Override
    public String toString() {
        return value;
    }
}
