package io.contractrpc.server.core.transport;

import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.server.core.ValidatedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;

/**
 * Opens chunked (NDJSON) streams for validated requests.
 */
public final class ChunkedStreamTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedStreamTransport.class);

    private final Executor executor;
    private final JsonCodec json;
    private final int bufferSize;

    public ChunkedStreamTransport(Executor executor, JsonCodec json, int bufferSize) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.json = Objects.requireNonNull(json, "json");
        this.bufferSize = bufferSize;
    }

    /**
     * Returns a cold publisher of NDJSON lines. Subscribing opens the connection and schedules the handler;
     * cancelling the subscription is treated as a client disconnect.
     */
    public Flow.Publisher<String> open(ValidatedRequest request, ChunkedStreamHandler handler) {
        Connection connection = new Connection(request.endpointName());
        FramePublisher<String> frames = new FramePublisher<>(bufferSize);
        frames.onStart(() -> executor.execute(() -> run(request, handler, connection, frames)))
                .onCancel(() -> {
                    LOGGER.debug("Client disconnected from {} before the terminal frame", connection.id());
                    connection.close();
                });
        return frames;
    }

    private void run(ValidatedRequest request, ChunkedStreamHandler handler, Connection connection, FramePublisher<String> frames) {
        if (!connection.open()) return;
        ChunkStream stream = new ChunkStream(connection, frames, json);
        try {
            handler.handle(request, stream);
        } catch (Exception e) {
            LOGGER.error("Chunked-stream handler for {} failed; abandoning stream", request.endpointName(), e);
            if (connection.beginClose()) frames.fail(e);
            connection.finish();
            return;
        }
        stream.close();
    }
}
