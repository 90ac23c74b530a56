package io.contractrpc.core;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One schema complaint about an input value.
 *
 * @param code machine-readable reason, e.g. {@code invalid_type}
 * @param path location inside the value (property names and array indexes)
 * @param message human-readable description
 */
public record Issue(String code, List<Object> path, String message) {

    public Issue {
        Objects.requireNonNull(code, "code");
        path = path == null ? List.of() : List.copyOf(path);
        message = message == null ? "" : message;
    }

    public static Issue custom(String message, Object... path) {
        return new Issue("custom", List.of(path), message);
    }

    /**
     * JSON-ready representation: {@code {"code":..,"path":[..],"message":..}}.
     */
    public Map<String, Object> toTree() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("code", code);
        out.put("path", path);
        out.put("message", message);
        return out;
    }
}
