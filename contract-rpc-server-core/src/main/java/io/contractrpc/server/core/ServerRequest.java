package io.contractrpc.server.core;

import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An inbound HTTP request as handed over by a server adapter.
 *
 * <p>{@code method} is kept as sent; routers resolve it against {@link io.contractrpc.core.HttpMethod} and
 * treat unknown methods as unmatched routes. {@code body} is read at most once and may be {@code null}.
 */
public record ServerRequest(String method, URI uri, Map<String, List<String>> headers, InputStream body) {

    public ServerRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(uri, "uri");
        Objects.requireNonNull(headers, "headers");
    }
}
