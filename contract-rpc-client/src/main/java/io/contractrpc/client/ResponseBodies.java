package io.contractrpc.client;

import io.contractrpc.core.Headers;
import io.contractrpc.core.Protocol;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;

import java.nio.charset.StandardCharsets;
import java.util.Map;

final class ResponseBodies {
    private ResponseBodies() {}

    /**
     * 204 and empty bodies decode to an empty map, JSON media types to a tree, anything else to text.
     *
     * @throws JsonException if a JSON-typed body is malformed
     */
    static Object decode(int status, Map<String, ? extends Iterable<String>> headers, byte[] body, JsonCodec json) throws JsonException {
        if (status == Protocol.STATUS_NO_CONTENT || body == null || body.length == 0) {
            return Map.of();
        }
        String mediaType = Headers.mediaType(Headers.firstValue(headers, Protocol.H_CONTENT_TYPE).orElse(null));
        if (mediaType.equals(Protocol.CT_JSON) || mediaType.endsWith("+json")) {
            return json.readTree(body);
        }
        return new String(body, StandardCharsets.UTF_8);
    }
}
