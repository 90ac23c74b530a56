package io.contractrpc.server.core.transport;

/**
 * Release action run once when a connection is torn down.
 */
@FunctionalInterface
public interface Cleanup {

    void run() throws Exception;

    static Cleanup none() {
        return () -> { };
    }
}
