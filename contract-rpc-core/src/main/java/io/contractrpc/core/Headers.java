package io.contractrpc.core;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Header lookups shared by the router and the client. Names compare case-insensitively.
 */
public final class Headers {
    private Headers() {}

    /**
     * First non-null value of the header {@code name}, matched case-insensitively.
     */
    public static Optional<String> firstValue(Map<String, ? extends Iterable<String>> headers, String name) {
        if (headers == null || name == null) return Optional.empty();
        return headers.entrySet().stream()
                .filter(e -> name.equalsIgnoreCase(e.getKey()) && e.getValue() != null)
                .findFirst()
                .flatMap(e -> {
                    for (String v : e.getValue()) {
                        if (v != null) return Optional.of(v);
                    }
                    return Optional.<String>empty();
                });
    }

    /**
     * Flattens headers the way schemas see them: lower-cased names, repeated values joined with {@code ", "}.
     */
    public static Map<String, String> flatten(Map<String, ? extends Iterable<String>> headers) {
        Map<String, String> out = new LinkedHashMap<>();
        if (headers == null) return out;
        for (Map.Entry<String, ? extends Iterable<String>> e : headers.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            String key = e.getKey().toLowerCase(Locale.ROOT);
            for (String v : e.getValue()) {
                if (v == null) continue;
                out.merge(key, v, (a, b) -> a + ", " + b);
            }
        }
        return out;
    }

    /**
     * Lower-cased media type without parameters, e.g. {@code application/json} for
     * {@code Application/JSON; charset=utf-8}. Returns an empty string for {@code null}.
     */
    public static String mediaType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String base = semi >= 0 ? contentType.substring(0, semi) : contentType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Extracts a parameter such as {@code boundary} from a content type value.
     */
    public static Optional<String> mediaTypeParameter(String contentType, String parameter) {
        if (contentType == null) return Optional.empty();
        String[] parts = contentType.split(";");
        for (int i = 1; i < parts.length; i++) {
            String p = parts[i].trim();
            int eq = p.indexOf('=');
            if (eq <= 0) continue;
            if (p.substring(0, eq).trim().equalsIgnoreCase(parameter)) {
                String v = p.substring(eq + 1).trim();
                if (v.length() >= 2 && v.startsWith("\"") && v.endsWith("\"")) {
                    v = v.substring(1, v.length() - 1);
                }
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
