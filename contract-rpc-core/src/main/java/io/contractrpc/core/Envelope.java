package io.contractrpc.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Message-transport wire unit: {@code {"type": string, "payload": <JSON>}}.
 */
public record Envelope(String type, Object payload) {

    public Envelope {
        Objects.requireNonNull(type, "type");
    }

    public Map<String, Object> toTree() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(Protocol.ENVELOPE_TYPE, type);
        out.put(Protocol.ENVELOPE_PAYLOAD, payload);
        return out;
    }

    /**
     * Reads an envelope from a decoded JSON tree.
     *
     * @throws IllegalArgumentException if the tree is not an object with a string {@code type}
     */
    public static Envelope fromTree(Object tree) {
        if (!(tree instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("envelope must be a JSON object");
        }
        if (!(map.get(Protocol.ENVELOPE_TYPE) instanceof String type)) {
            throw new IllegalArgumentException("envelope is missing a string 'type'");
        }
        return new Envelope(type, map.get(Protocol.ENVELOPE_PAYLOAD));
    }
}
