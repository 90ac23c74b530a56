package io.contractrpc.server.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a standard handler returns: a status, an optional body and optional extra headers.
 *
 * <p>The body is validated against the endpoint's response schema for {@code status}, when one is declared.
 */
public record HandlerResponse(int status, Object body, Map<String, String> headers) {

    public HandlerResponse {
        if (status < 100 || status > 599) throw new IllegalArgumentException("invalid status: " + status);
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public static HandlerResponse of(int status, Object body) {
        return new HandlerResponse(status, body, Map.of());
    }

    public static HandlerResponse ok(Object body) {
        return of(200, body);
    }

    public static HandlerResponse created(Object body) {
        return of(201, body);
    }

    public static HandlerResponse noContent() {
        return of(204, null);
    }

    public HandlerResponse withHeader(String name, String value) {
        Map<String, String> next = new LinkedHashMap<>(headers);
        next.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
        return new HandlerResponse(status, body, next);
    }
}
