package io.contractrpc.client;

import java.io.InputStream;

/**
 * HTTP exchange used by {@link ContractClient}. Buffered calls use {@link #sendBytes}; push-event and
 * chunked-stream subscriptions use {@link #sendStream} and read the body incrementally.
 */
public interface ClientTransport {
    TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception;
    TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception;
}
