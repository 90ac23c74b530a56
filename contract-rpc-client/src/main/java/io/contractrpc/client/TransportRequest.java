package io.contractrpc.client;

import java.net.URI;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One outgoing HTTP exchange built from an endpoint and its {@link RequestOptions}.
 *
 * <p>{@code timeout} is {@code null} for push-event and chunked-stream subscriptions, which stay open until
 * either side ends them.
 */
public record TransportRequest(String method, URI url, Map<String, List<String>> headers, byte[] body, Duration timeout) {

    public TransportRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : new LinkedHashMap<>(headers);
    }

    public TransportRequest withTimeout(Duration timeout) {
        return new TransportRequest(method, url, headers, body, timeout);
    }

    /**
     * First value of {@code name}, matched case-insensitively.
     */
    public Optional<String> header(String name) {
        for (Map.Entry<String, List<String>> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name) && e.getValue() != null && !e.getValue().isEmpty()) {
                return Optional.ofNullable(e.getValue().get(0));
            }
        }
        return Optional.empty();
    }
}
