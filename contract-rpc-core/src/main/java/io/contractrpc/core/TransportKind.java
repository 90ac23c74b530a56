package io.contractrpc.core;

/**
 * Wire protocol an endpoint speaks once matched.
 */
public enum TransportKind {
    /** One buffered request, one buffered response. */
    STANDARD,
    /** Server-to-client named events over {@code text/event-stream}. */
    PUSH_EVENT,
    /** Ordered NDJSON frames followed by one terminal frame. */
    CHUNKED_STREAM,
    /** Full-duplex typed envelopes after an upgrade. */
    MESSAGE
}
