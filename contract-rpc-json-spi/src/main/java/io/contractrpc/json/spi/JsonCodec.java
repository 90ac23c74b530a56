package io.contractrpc.json.spi;

import java.io.InputStream;

/**
 * JSON reading and writing used by routers and clients.
 *
 * <p>Reads produce plain Java trees: {@link java.util.Map} for objects, {@link java.util.List} for arrays,
 * {@link String}, {@link Number}, {@link Boolean} and {@code null}. Schemas validate those trees, so no
 * library-specific node type leaks past the codec. Writes accept the same trees plus whatever beans the
 * underlying library can serialize.
 */
public interface JsonCodec {

    byte[] writeBytes(Object value) throws JsonException;

    String writeString(Object value) throws JsonException;

    /**
     * @return the tree, {@code null} for a JSON {@code null}
     * @throws JsonException if {@code data} is not exactly one JSON value
     */
    Object readTree(byte[] data) throws JsonException;

    Object readTree(String json) throws JsonException;

    Object readTree(InputStream input) throws JsonException;

    /**
     * Binds a tree (or any value) to {@code type}, e.g. a record declared by the caller.
     */
    <T> T convert(Object value, Class<T> type) throws JsonException;
}
