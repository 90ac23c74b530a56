package io.contractrpc.server.core;

import java.util.concurrent.Flow;

/**
 * Framework-neutral response body abstraction.
 *
 * <p>The streaming variants are cold: the transport starts the handler when the adapter subscribes, and
 * cancelling the subscription is how an adapter reports a client disconnect.
 */
public sealed interface ResponseBody permits ResponseBody.Empty, ResponseBody.Bytes, ResponseBody.Sse, ResponseBody.Ndjson {

    record Empty() implements ResponseBody {}

    record Bytes(byte[] bytes) implements ResponseBody {}

    record Sse(Flow.Publisher<SseFrame> publisher) implements ResponseBody {}

    /**
     * Newline-delimited JSON. Each item is one complete JSON document without its trailing {@code \n}.
     */
    record Ndjson(Flow.Publisher<String> publisher) implements ResponseBody {}
}
