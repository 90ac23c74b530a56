package io.contractrpc.core;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * URL building helpers shared by the client and the routers.
 */
public final class Urls {
    private Urls() {}

    /**
     * Appends query parameters in map order. {@link Iterable} values are expanded into repeated keys;
     * {@code null} values are skipped.
     */
    public static URI withQuery(URI base, Map<String, ?> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, ?> e : params.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            if (e.getValue() instanceof Iterable<?> values) {
                for (Object v : values) {
                    if (v != null) appendPair(sb, e.getKey(), v);
                }
            } else {
                appendPair(sb, e.getKey(), e.getValue());
            }
        }
        if (sb.length() == 0) return base;
        String s = base.toString();
        return URI.create(s + (base.getRawQuery() == null ? "?" : "&") + sb);
    }

    private static void appendPair(StringBuilder sb, String key, Object value) {
        if (sb.length() > 0) sb.append('&');
        sb.append(encode(key)).append('=').append(encode(String.valueOf(value)));
    }

    /**
     * Percent-encodes one path segment (spaces become {@code %20}, not {@code +}).
     */
    public static String encodePathSegment(String segment) {
        return encode(segment).replace("+", "%20");
    }

    /**
     * Decodes a raw path segment. Unlike form decoding, {@code +} is kept literally.
     */
    public static String decodePathSegment(String raw) {
        if (raw.indexOf('%') < 0) return raw;
        ByteArrayOutputStream out = new ByteArrayOutputStream(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '%' && i + 2 < raw.length()) {
                int hi = Character.digit(raw.charAt(i + 1), 16);
                int lo = Character.digit(raw.charAt(i + 2), 16);
                if (hi >= 0 && lo >= 0) {
                    out.write((hi << 4) + lo);
                    i += 3;
                    continue;
                }
            }
            int cp = raw.codePointAt(i);
            byte[] bytes = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
            out.write(bytes, 0, bytes.length);
            i += Character.charCount(cp);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Maps {@code http(s)://} base URLs to {@code ws(s)://}; {@code ws(s)://} passes through and
     * scheme-less values default to {@code ws://}.
     */
    public static String toWebSocketBase(String baseUrl) {
        Objects.requireNonNull(baseUrl, "baseUrl");
        if (baseUrl.startsWith("ws://") || baseUrl.startsWith("wss://")) return baseUrl;
        if (baseUrl.startsWith("http://")) return "ws://" + baseUrl.substring("http://".length());
        if (baseUrl.startsWith("https://")) return "wss://" + baseUrl.substring("https://".length());
        if (baseUrl.startsWith("/")) return "ws://localhost" + baseUrl;
        return "ws://" + baseUrl;
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
