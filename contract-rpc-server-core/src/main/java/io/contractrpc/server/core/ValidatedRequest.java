package io.contractrpc.server.core;

import io.contractrpc.core.EndpointDefinition;

import java.util.Objects;

/**
 * Typed input bundle handed to a handler after every declared schema accepted the request.
 *
 * <p>Each part holds what its schema produced. Parts without a schema fall back to the raw path parameter map,
 * an empty query map, an empty header map and a {@code null} body.
 */
public final class ValidatedRequest {
    private final String endpointName;
    private final EndpointDefinition endpoint;
    private final Object params;
    private final Object query;
    private final Object headers;
    private final Object body;
    private final Object context;

    public ValidatedRequest(
            String endpointName,
            EndpointDefinition endpoint,
            Object params,
            Object query,
            Object headers,
            Object body,
            Object context
    ) {
        this.endpointName = Objects.requireNonNull(endpointName, "endpointName");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.params = params;
        this.query = query;
        this.headers = headers;
        this.body = body;
        this.context = context;
    }

    public String endpointName() {
        return endpointName;
    }

    public EndpointDefinition endpoint() {
        return endpoint;
    }

    @SuppressWarnings("unchecked")
    public <T> T params() {
        return (T) params;
    }

    @SuppressWarnings("unchecked")
    public <T> T query() {
        return (T) query;
    }

    @SuppressWarnings("unchecked")
    public <T> T headers() {
        return (T) headers;
    }

    @SuppressWarnings("unchecked")
    public <T> T body() {
        return (T) body;
    }

    @SuppressWarnings("unchecked")
    public <T> T context() {
        return (T) context;
    }
}
