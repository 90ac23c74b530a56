package io.contractrpc.server.core;

import java.util.Objects;

/**
 * One push event as it goes on the wire: an event name and its JSON-encoded payload.
 */
public record SseFrame(String event, String data) {

    public SseFrame {
        Objects.requireNonNull(event, "event");
        if (event.indexOf('\n') >= 0 || event.indexOf('\r') >= 0) {
            throw new IllegalArgumentException("event name must be a single line: " + event);
        }
        data = data == null ? "" : data;
    }

    /**
     * The {@code text/event-stream} block for this event, blank-line terminated. A multi-line payload gets
     * one {@code data:} line per line.
     */
    public String render() {
        StringBuilder block = new StringBuilder("event: ").append(event).append('\n');
        for (String line : data.split("\r\n|\r|\n", -1)) {
            block.append("data: ").append(line).append('\n');
        }
        return block.append('\n').toString();
    }
}
