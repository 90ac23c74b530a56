package io.contractrpc.server.core;

import io.contractrpc.core.Headers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Buffered {@code multipart/form-data} parser.
 *
 * <p>Parts without a {@code filename} become {@code String} fields, parts with one become {@link FilePart}s.
 * A field name sent more than once maps to a list of its values.
 */
final class MultipartParser {

    private static final byte[] CRLF = {'\r', '\n'};
    private static final byte[] HEADER_END = {'\r', '\n', '\r', '\n'};

    private final byte[] delimiter;

    MultipartParser(String boundary) {
        this.delimiter = ("--" + boundary).getBytes(StandardCharsets.US_ASCII);
    }

    Map<String, Object> parse(byte[] body) throws IOException {
        Map<String, Object> fields = new LinkedHashMap<>();
        int pos = indexOf(body, delimiter, 0);
        if (pos < 0) throw new IOException("multipart body has no opening boundary");
        pos += delimiter.length;

        while (true) {
            if (startsWith(body, pos, new byte[]{'-', '-'})) {
                return fields;
            }
            if (!startsWith(body, pos, CRLF)) throw new IOException("malformed multipart boundary line");
            pos += CRLF.length;

            int headersEnd = indexOf(body, HEADER_END, pos);
            if (headersEnd < 0) throw new IOException("multipart part has no header terminator");
            Map<String, String> headers = parseHeaders(new String(body, pos, headersEnd - pos, StandardCharsets.UTF_8));
            int contentStart = headersEnd + HEADER_END.length;

            byte[] next = concat(CRLF, delimiter);
            int contentEnd = indexOf(body, next, contentStart);
            if (contentEnd < 0) throw new IOException("multipart body has no closing boundary");

            byte[] content = new byte[contentEnd - contentStart];
            System.arraycopy(body, contentStart, content, 0, content.length);
            addPart(fields, headers, content);
            pos = contentEnd + next.length;
        }
    }

    private static void addPart(Map<String, Object> fields, Map<String, String> headers, byte[] content) throws IOException {
        String disposition = headers.get("content-disposition");
        if (disposition == null) throw new IOException("multipart part without Content-Disposition");
        String name = Headers.mediaTypeParameter(disposition, "name")
                .orElseThrow(() -> new IOException("multipart part without a name"));
        String filename = Headers.mediaTypeParameter(disposition, "filename").orElse(null);

        Object value = filename == null
                ? new String(content, StandardCharsets.UTF_8)
                : new FilePart(filename, headers.get("content-type"), content);
        fields.merge(name, value, MultipartParser::append);
    }

    @SuppressWarnings("unchecked")
    private static Object append(Object existing, Object value) {
        if (existing instanceof List<?> list) {
            ((List<Object>) list).add(value);
            return list;
        }
        List<Object> values = new ArrayList<>();
        values.add(existing);
        values.add(value);
        return values;
    }

    private static Map<String, String> parseHeaders(String block) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (String line : block.split("\r\n")) {
            int colon = line.indexOf(':');
            if (colon <= 0) continue;
            headers.put(line.substring(0, colon).trim().toLowerCase(Locale.ROOT), line.substring(colon + 1).trim());
        }
        return headers;
    }

    private static boolean startsWith(byte[] data, int offset, byte[] prefix) {
        if (offset + prefix.length > data.length) return false;
        for (int i = 0; i < prefix.length; i++) {
            if (data[offset + i] != prefix[i]) return false;
        }
        return true;
    }

    private static int indexOf(byte[] data, byte[] target, int from) {
        outer:
        for (int i = from; i <= data.length - target.length; i++) {
            for (int j = 0; j < target.length; j++) {
                if (data[i + j] != target[j]) continue outer;
            }
            return i;
        }
        return -1;
    }

    private static byte[] concat(byte[] a, byte[] b) {
        byte[] out = new byte[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }
}
