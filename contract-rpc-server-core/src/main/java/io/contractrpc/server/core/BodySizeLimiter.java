package io.contractrpc.server.core;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;

/**
 * Reads request bodies up to a configured size. Routers answer {@code 413 Payload Too Large} past the limit.
 */
public final class BodySizeLimiter {

    /** Disables limiting. */
    public static final long UNLIMITED = Long.MAX_VALUE;

    private static final int CHUNK_SIZE = 8192;

    private BodySizeLimiter() {}

    /**
     * Reads {@code in} to its end and closes it. Reading stops at the first chunk that crosses the limit,
     * so an oversized body is never fully buffered.
     *
     * @param maxBytes largest accepted body; {@link #UNLIMITED} or a non-positive value disables the check
     * @return the body bytes, empty for a {@code null} stream
     * @throws PayloadTooLargeException if more than {@code maxBytes} bytes arrive
     */
    public static byte[] read(InputStream in, long maxBytes) throws IOException {
        if (in == null) return new byte[0];
        try (in) {
            if (maxBytes <= 0 || maxBytes == UNLIMITED) return in.readAllBytes();

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] chunk = new byte[CHUNK_SIZE];
            long total = 0;
            int n;
            while ((n = in.read(chunk)) != -1) {
                total += n;
                if (total > maxBytes) throw new PayloadTooLargeException(maxBytes);
                out.write(chunk, 0, n);
            }
            return out.toByteArray();
        }
    }

    public static final class PayloadTooLargeException extends IOException {
        private final long maxBytes;

        public PayloadTooLargeException(long maxBytes) {
            super("Request body exceeds " + maxBytes + " bytes");
            this.maxBytes = maxBytes;
        }

        public long maxBytes() {
            return maxBytes;
        }
    }
}
