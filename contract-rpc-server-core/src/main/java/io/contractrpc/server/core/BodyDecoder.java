package io.contractrpc.server.core;

import io.contractrpc.core.Headers;
import io.contractrpc.core.Issue;
import io.contractrpc.core.Protocol;
import io.contractrpc.core.QueryString;
import io.contractrpc.core.RequestValidationException;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns a request body into the value a body schema is given, based on the declared content type:
 * <ul>
 *   <li>{@code application/json} (or a missing content type): a plain JSON tree, {@code null} when empty</li>
 *   <li>{@code application/x-www-form-urlencoded}: {@code Map<String, String>}</li>
 *   <li>{@code multipart/form-data}: {@code Map<String, Object>} of text fields and {@link FilePart}s</li>
 *   <li>anything else: the raw text</li>
 * </ul>
 */
public final class BodyDecoder {

    private final JsonCodec json;
    private final long maxBodySize;

    public BodyDecoder(JsonCodec json, long maxBodySize) {
        this.json = Objects.requireNonNull(json, "json");
        this.maxBodySize = maxBodySize;
    }

    /**
     * @throws RequestValidationException on a malformed JSON or multipart body
     * @throws BodySizeLimiter.PayloadTooLargeException when the body exceeds the configured limit
     */
    public Object decode(ServerRequest request) throws IOException {
        byte[] bytes = readAll(request.body());
        String contentType = Headers.firstValue(request.headers(), Protocol.H_CONTENT_TYPE).orElse(null);
        String mediaType = Headers.mediaType(contentType);

        if (mediaType.isEmpty() || mediaType.equals(Protocol.CT_JSON) || mediaType.endsWith("+json")) {
            return decodeJson(bytes);
        }
        if (mediaType.equals(Protocol.CT_FORM_URLENCODED)) {
            return decodeForm(bytes);
        }
        if (mediaType.equals(Protocol.CT_MULTIPART_FORM)) {
            return decodeMultipart(contentType, bytes);
        }
        return new String(bytes, StandardCharsets.UTF_8);
    }

    private Object decodeJson(byte[] bytes) {
        if (bytes.length == 0) return null;
        try {
            return json.readTree(bytes);
        } catch (JsonException e) {
            throw new RequestValidationException(RequestValidationException.BODY,
                    List.of(new Issue("invalid_json", List.of(), "Request body is not valid JSON")));
        }
    }

    private static Map<String, String> decodeForm(byte[] bytes) {
        Map<String, Object> fields;
        try {
            fields = QueryString.parse(new String(bytes, StandardCharsets.UTF_8));
        } catch (IllegalArgumentException e) {
            throw new RequestValidationException(RequestValidationException.BODY,
                    List.of(new Issue("invalid_form", List.of(), "Request body is not valid form data")));
        }
        Map<String, String> out = new LinkedHashMap<>();
        fields.forEach((k, v) -> {
            // last value wins for repeated form keys
            out.put(k, v instanceof List<?> list ? String.valueOf(list.get(list.size() - 1)) : String.valueOf(v));
        });
        return out;
    }

    private static Map<String, Object> decodeMultipart(String contentType, byte[] bytes) {
        String boundary = Headers.mediaTypeParameter(contentType, "boundary").orElse(null);
        if (boundary == null || boundary.isEmpty()) {
            throw invalidMultipart("multipart body without a boundary parameter");
        }
        try {
            return new MultipartParser(boundary).parse(bytes);
        } catch (IOException e) {
            throw invalidMultipart(e.getMessage());
        }
    }

    private static RequestValidationException invalidMultipart(String message) {
        return new RequestValidationException(RequestValidationException.BODY,
                List.of(new Issue("invalid_multipart", List.of(), message)));
    }

    private byte[] readAll(InputStream in) throws IOException {
        return BodySizeLimiter.read(in, maxBodySize);
    }
}
