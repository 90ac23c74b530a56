package io.contractrpc.server.core.transport;

import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;
import io.contractrpc.server.core.SseFrame;

import java.util.Objects;

/**
 * Server-side capability for pushing named events to one client.
 *
 * <p>Safe to call from any thread. {@link #send(String, Object)} on a connection that is no longer open
 * does nothing.
 */
public final class PushEventEmitter {

    private final Connection connection;
    private final FramePublisher<SseFrame> frames;
    private final JsonCodec json;

    PushEventEmitter(Connection connection, FramePublisher<SseFrame> frames, JsonCodec json) {
        this.connection = connection;
        this.frames = frames;
        this.json = json;
    }

    /**
     * Serializes {@code payload} as JSON and emits it under {@code event}. Blocks while the connection's frame
     * buffer is full.
     *
     * @return {@code true} if the frame was queued
     * @throws IllegalArgumentException if the payload cannot be serialized or the event name spans lines
     */
    public boolean send(String event, Object payload) {
        Objects.requireNonNull(event, "event");
        if (!connection.isOpen()) return false;
        String data;
        try {
            data = json.writeString(payload);
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot serialize payload of event '" + event + "'", e);
        }
        return frames.offer(new SseFrame(event, data));
    }

    public boolean isOpen() {
        return connection.isOpen();
    }

    public ConnectionState state() {
        return connection.state();
    }

    public CancellationSignal signal() {
        return connection.signal();
    }

    /**
     * Ends the stream from the server side. Frames already sent are still delivered.
     */
    public void close() {
        if (connection.beginClose()) {
            frames.complete();
            connection.finish();
        }
    }
}
