package io.contractrpc.server.core;

import java.io.ByteArrayInputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builders for {@link ServerRequest}s and readers for {@link ServerResponse}s.
 */
public final class TestRequests {
    private TestRequests() {}

    public static ServerRequest request(String method, String pathAndQuery, Map<String, List<String>> headers, String body) {
        return new ServerRequest(
                method,
                URI.create("http://localhost" + pathAndQuery),
                headers,
                body == null ? null : new ByteArrayInputStream(body.getBytes(StandardCharsets.UTF_8)));
    }

    public static Map<String, List<String>> headers(String... kv) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) {
            out.put(kv[i], List.of(kv[i + 1]));
        }
        return out;
    }

    public static String firstHeader(ServerResponse resp, String name) {
        return resp.firstHeader(name).orElse(null);
    }

    public static byte[] readBodyBytes(ResponseBody body) {
        if (body instanceof ResponseBody.Bytes bytes) return bytes.bytes();
        return new byte[0];
    }
}
