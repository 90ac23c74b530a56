package io.contractrpc.server.core.transport;

import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.server.core.SseFrame;
import io.contractrpc.server.core.ValidatedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;

/**
 * Opens push-event streams for validated requests.
 */
public final class PushEventTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(PushEventTransport.class);

    private final Executor executor;
    private final JsonCodec json;
    private final int bufferSize;

    public PushEventTransport(Executor executor, JsonCodec json, int bufferSize) {
        this.executor = Objects.requireNonNull(executor, "executor");
        this.json = Objects.requireNonNull(json, "json");
        this.bufferSize = bufferSize;
    }

    /**
     * Returns a cold publisher. Subscribing opens the connection and schedules the handler; cancelling the
     * subscription is treated as a client disconnect.
     */
    public Flow.Publisher<SseFrame> open(ValidatedRequest request, PushEventHandler handler) {
        Connection connection = new Connection(request.endpointName());
        FramePublisher<SseFrame> frames = new FramePublisher<>(bufferSize);
        frames.onStart(() -> executor.execute(() -> run(request, handler, connection, frames)))
                .onCancel(() -> {
                    LOGGER.debug("Client disconnected from {}", connection.id());
                    connection.close();
                });
        return frames;
    }

    private void run(ValidatedRequest request, PushEventHandler handler, Connection connection, FramePublisher<SseFrame> frames) {
        if (!connection.open()) return;
        PushEventEmitter emitter = new PushEventEmitter(connection, frames, json);
        try {
            Cleanup cleanup = handler.handle(request, emitter, connection.signal());
            connection.addCleanup(cleanup);
        } catch (Exception e) {
            LOGGER.error("Push-event handler for {} failed; abandoning stream", request.endpointName(), e);
            if (connection.beginClose()) frames.fail(e);
            connection.finish();
        }
    }
}
