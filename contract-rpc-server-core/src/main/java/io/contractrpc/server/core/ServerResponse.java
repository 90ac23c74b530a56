package io.contractrpc.server.core;

import io.contractrpc.core.Headers;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * What a router answers: a status, headers in insertion order, and a buffered or streaming body.
 * Adapters copy the headers before touching the body.
 */
public final class ServerResponse {
    private final int status;
    private final ResponseBody body;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = body;
    }

    public int status() {
        return status;
    }

    public ResponseBody body() {
        return body;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    /**
     * Adds a value, appending to an existing header whose name differs only in case.
     */
    public ServerResponse header(String name, String value) {
        String key = headers.keySet().stream().filter(name::equalsIgnoreCase).findFirst().orElse(name);
        headers.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
        return this;
    }

    public Optional<String> firstHeader(String name) {
        return Headers.firstValue(headers, name);
    }
}
