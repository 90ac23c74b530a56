package io.contractrpc.core;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal query string parser (framework-neutral).
 */
public final class QueryString {

    private QueryString() {}

    /**
     * Parses the query of {@code uri}. A key seen once maps to its {@code String} value, a repeated key maps to
     * a {@code List<String>} of all its values in order.
     */
    public static Map<String, Object> parse(URI uri) {
        return parse(uri.getRawQuery());
    }

    public static Map<String, Object> parse(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) return new LinkedHashMap<>();
        Map<String, Object> out = new LinkedHashMap<>();
        for (String part : rawQuery.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            String k = eq < 0 ? decode(part) : decode(part.substring(0, eq));
            String v = eq < 0 ? "" : decode(part.substring(eq + 1));
            out.merge(k, v, QueryString::append);
        }
        return out;
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

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }
}
