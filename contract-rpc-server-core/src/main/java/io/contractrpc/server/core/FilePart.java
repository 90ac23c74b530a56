package io.contractrpc.server.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * A file field of a {@code multipart/form-data} body.
 */
public record FilePart(String filename, String contentType, byte[] bytes) {

    public FilePart {
        Objects.requireNonNull(filename, "filename");
        contentType = contentType == null ? "application/octet-stream" : contentType;
        bytes = bytes == null ? new byte[0] : bytes;
    }

    public long size() {
        return bytes.length;
    }

    public String text() {
        return new String(bytes, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "FilePart[" + filename + ", " + contentType + ", " + bytes.length + " bytes]";
    }
}
