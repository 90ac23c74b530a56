package io.contractrpc.server.core.message;

import io.contractrpc.core.MessageEndpoint;

import java.util.Objects;

/**
 * Everything the upgrade phase validated, handed to the socket integration and back into
 * {@link MessageRouter#open(UpgradeResult, MessageSocket)}.
 *
 * @param context per-request context from the router's context factory, may be {@code null}
 */
public record UpgradeResult(
        String endpointName,
        MessageEndpoint endpoint,
        Object params,
        Object query,
        Object headers,
        Object context
) {
    public UpgradeResult {
        Objects.requireNonNull(endpointName, "endpointName");
        Objects.requireNonNull(endpoint, "endpoint");
    }
}
