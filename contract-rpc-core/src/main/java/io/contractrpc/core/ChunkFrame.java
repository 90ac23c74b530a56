package io.contractrpc.core;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chunked-stream wire unit, one per NDJSON line.
 *
 * <p>Every frame is an object tagged by {@code kind}, so a chunk payload may contain any key without being
 * mistaken for the end of the stream:
 * <pre>
 * {"kind":"chunk","value":{"text":"hello"}}
 * {"kind":"final","value":{"total":3}}
 * </pre>
 */
public sealed interface ChunkFrame permits ChunkFrame.Chunk, ChunkFrame.Final {

    Object value();

    boolean terminal();

    default Map<String, Object> toTree() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(Protocol.FRAME_KIND, terminal() ? Protocol.KIND_FINAL : Protocol.KIND_CHUNK);
        out.put(Protocol.FRAME_VALUE, value());
        return out;
    }

    /**
     * @throws IllegalArgumentException if the tree is not a tagged frame
     */
    static ChunkFrame fromTree(Object tree) {
        if (!(tree instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("chunk frame must be a JSON object");
        }
        Object kind = map.get(Protocol.FRAME_KIND);
        if (Protocol.KIND_CHUNK.equals(kind)) return new Chunk(map.get(Protocol.FRAME_VALUE));
        if (Protocol.KIND_FINAL.equals(kind)) return new Final(map.get(Protocol.FRAME_VALUE));
        throw new IllegalArgumentException("unknown chunk frame kind: " + kind);
    }

    record Chunk(Object value) implements ChunkFrame {
        @Override
        public boolean terminal() {
            return false;
        }
    }

    /**
     * @param value the optional final value, {@code null} when the stream closed without one
     */
    record Final(Object value) implements ChunkFrame {
        @Override
        public boolean terminal() {
            return true;
        }
    }
}
