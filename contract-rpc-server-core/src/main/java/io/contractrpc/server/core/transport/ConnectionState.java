package io.contractrpc.server.core.transport;

/**
 * Lifecycle of a long-lived connection. Transitions only move forward.
 */
public enum ConnectionState {
    CONNECTING,
    OPEN,
    CLOSING,
    CLOSED;

    boolean canMoveTo(ConnectionState next) {
        return next.ordinal() > ordinal();
    }
}
