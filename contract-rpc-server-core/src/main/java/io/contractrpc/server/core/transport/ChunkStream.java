package io.contractrpc.server.core.transport;

import io.contractrpc.core.ChunkFrame;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;

/**
 * Server-side capability for one chunked-stream response.
 *
 * <p>Each {@link #send(Object)} writes one frame, in call order. {@link #close(Object)} writes the single
 * terminal frame; later calls to either method do nothing. After a client disconnect nothing is written and
 * {@link #isOpen()} turns {@code false}, which is the handler's cue to stop producing.
 */
public final class ChunkStream {

    private final Connection connection;
    private final FramePublisher<String> frames;
    private final JsonCodec json;
    private final Object writeLock = new Object();

    ChunkStream(Connection connection, FramePublisher<String> frames, JsonCodec json) {
        this.connection = connection;
        this.frames = frames;
        this.json = json;
    }

    /**
     * @return {@code true} if the chunk was queued
     * @throws IllegalArgumentException if the chunk cannot be serialized
     */
    public boolean send(Object chunk) {
        synchronized (writeLock) {
            if (!connection.isOpen()) return false;
            return frames.offer(render(new ChunkFrame.Chunk(chunk)));
        }
    }

    /**
     * Ends the stream with a terminal frame that carries no value.
     */
    public void close() {
        close(null);
    }

    /**
     * Ends the stream with a terminal frame carrying {@code finalValue}.
     */
    public void close(Object finalValue) {
        synchronized (writeLock) {
            if (!connection.beginClose()) return;
            try {
                frames.offer(render(new ChunkFrame.Final(finalValue)));
            } finally {
                frames.complete();
                connection.finish();
            }
        }
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

    private String render(ChunkFrame frame) {
        try {
            return json.writeString(frame.toTree());
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot serialize chunk frame", e);
        }
    }
}
