package io.contractrpc.server.core.transport;

import io.contractrpc.server.core.ValidatedRequest;

/**
 * Handler for a chunked-stream endpoint.
 *
 * <p>Runs as a blocking task on the router's executor. If it returns without closing the stream, the
 * stream is closed with an empty terminal frame. If it throws, the stream is abandoned: no terminal frame is
 * written and the connection is torn down.
 */
@FunctionalInterface
public interface ChunkedStreamHandler {

    void handle(ValidatedRequest request, ChunkStream stream) throws Exception;
}
