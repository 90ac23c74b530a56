package io.contractrpc.client;

/**
 * One frame received from a chunked-stream endpoint. A successful stream is zero or more {@link Data}
 * items followed by exactly one {@link Final}.
 */
public sealed interface StreamChunk permits StreamChunk.Data, StreamChunk.Final {

    Object value();

    record Data(Object value) implements StreamChunk {}

    /**
     * @param value the final value, {@code null} when the server closed without one
     */
    record Final(Object value) implements StreamChunk {}
}
