package io.contractrpc.core;

import java.util.Locale;

/**
 * HTTP methods an endpoint can be bound to.
 */
public enum HttpMethod {
    GET, POST, PUT, PATCH, DELETE, HEAD, OPTIONS;

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException for methods outside this set
     */
    public static HttpMethod parse(String raw) {
        if (raw == null) throw new IllegalArgumentException("method must not be null");
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
