package io.contractrpc.server.core.transport;

import io.contractrpc.server.core.ValidatedRequest;

/**
 * Handler for a push-event endpoint.
 *
 * <p>Invoked once per connection on the router's executor. Returning does not end the stream: the handler
 * typically starts producers that call {@link PushEventEmitter#send(String, Object)} later. The stream ends
 * when the client disconnects, when {@link PushEventEmitter#close()} is called, or when this method throws.
 *
 * <pre>{@code
 * (request, emitter, signal) -> {
 *     ScheduledFuture<?> tick = scheduler.scheduleAtFixedRate(
 *         () -> emitter.send("tick", Map.of("at", Instant.now().toString())), 0, 1, TimeUnit.SECONDS);
 *     return () -> tick.cancel(false);
 * }
 * }</pre>
 */
@FunctionalInterface
public interface PushEventHandler {

    /**
     * @return a cleanup action run at teardown, or {@code null}
     */
    Cleanup handle(ValidatedRequest request, PushEventEmitter emitter, CancellationSignal signal) throws Exception;
}
