package io.contractrpc.core;

import java.util.Map;
import java.util.Objects;

/**
 * A resolved endpoint together with the raw path parameters captured by its pattern.
 */
public record RouteMatch(EndpointDefinition endpoint, Map<String, String> pathParams) {
    public RouteMatch {
        Objects.requireNonNull(endpoint, "endpoint");
        pathParams = pathParams == null ? Map.of() : Map.copyOf(pathParams);
    }

    public String name() {
        return endpoint.name();
    }
}
