package io.contractrpc.client;

import java.util.Map;

/**
 * Result of a standard call.
 *
 * @param data the decoded body: the value produced by the status's response schema when response validation
 *             ran, otherwise a JSON tree, a string for {@code text/*} bodies, or an empty map for 204 and
 *             empty bodies
 */
public record EndpointResponse(int status, Map<String, ? extends Iterable<String>> headers, Object data) {

    public EndpointResponse {
        if (headers == null) {
            headers = Map.<String, Iterable<String>>of();
        }
    }

    public <T> T data(Class<T> type) {
        return type.cast(data);
    }
}
