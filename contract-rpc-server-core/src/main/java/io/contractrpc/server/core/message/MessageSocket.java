package io.contractrpc.server.core.message;

import java.io.IOException;

/**
 * Write side of an upgraded connection, supplied by the hosting WebSocket integration.
 *
 * <p>The engine never performs the socket handshake itself; the integration accepts the upgrade, wraps its
 * native socket in this interface and forwards inbound events to the {@link MessageSession}.
 */
public interface MessageSocket {

    void send(String text) throws IOException;

    void close(int code, String reason);
}
