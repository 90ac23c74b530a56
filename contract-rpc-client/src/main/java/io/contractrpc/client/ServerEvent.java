package io.contractrpc.client;

import java.util.Objects;

/**
 * One event received from a push-event endpoint.
 *
 * @param data the payload, parsed from JSON and passed through the event's schema when one is declared
 */
public record ServerEvent(String event, Object data) {
    public ServerEvent {
        Objects.requireNonNull(event, "event");
    }
}
