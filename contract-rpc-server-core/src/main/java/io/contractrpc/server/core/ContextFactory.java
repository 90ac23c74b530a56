package io.contractrpc.server.core;

import io.contractrpc.core.EndpointDefinition;

/**
 * Computes the per-request context handed to handlers (and used as session data for message endpoints).
 *
 * <p>Called once per accepted request, after the route is matched.
 */
@FunctionalInterface
public interface ContextFactory {

    Object create(ServerRequest request, String endpointName, EndpointDefinition endpoint) throws Exception;

    static ContextFactory none() {
        return (request, endpointName, endpoint) -> null;
    }
}
