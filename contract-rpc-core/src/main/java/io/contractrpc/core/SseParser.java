package io.contractrpc.core;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Incremental reader for {@code text/event-stream} bodies.
 *
 * <p>Blocks end at a blank line. {@code event} names the event (default {@value #DEFAULT_EVENT}), every
 * {@code data} line adds one line of payload, and {@code id} sets the last event id, which carries over to
 * later events until replaced. Comments, unknown fields and blocks without data are skipped. A block cut off
 * by end of stream is discarded.
 */
public final class SseParser implements AutoCloseable {

    public static final String DEFAULT_EVENT = "message";

    /**
     * @param id the last event id seen on the stream, or {@code null}
     */
    public record Event(String name, String data, String id) {}

    private final BufferedReader reader;
    private String lastEventId;

    public SseParser(InputStream body) {
        this.reader = new BufferedReader(new InputStreamReader(body, StandardCharsets.UTF_8));
    }

    /**
     * Blocks until the next complete event.
     *
     * @return the event, or {@code null} at end of stream
     */
    public Event next() throws IOException {
        String name = null;
        List<String> data = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isEmpty()) {
                if (!data.isEmpty()) {
                    return new Event(name != null ? name : DEFAULT_EVENT, String.join("\n", data), lastEventId);
                }
                name = null;
                continue;
            }
            int colon = line.indexOf(':');
            if (colon == 0) continue;
            String field = colon < 0 ? line : line.substring(0, colon);
            String value = colon < 0 ? "" : fieldValue(line, colon);
            switch (field) {
                case "event" -> name = value;
                case "data" -> data.add(value);
                case "id" -> {
                    if (value.indexOf('\0') < 0) lastEventId = value;
                }
                default -> {
                    // retry and extension fields
                }
            }
        }
        return null;
    }

    public String lastEventId() {
        return lastEventId;
    }

    private static String fieldValue(String line, int colon) {
        int start = colon + 1;
        if (start < line.length() && line.charAt(start) == ' ') start++;
        return line.substring(start);
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
