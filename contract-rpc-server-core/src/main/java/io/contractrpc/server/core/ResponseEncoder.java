package io.contractrpc.server.core;

import io.contractrpc.core.Headers;
import io.contractrpc.core.Issue;
import io.contractrpc.core.ParseResult;
import io.contractrpc.core.Protocol;
import io.contractrpc.core.RequestValidationException;
import io.contractrpc.core.ResponseContractViolationException;
import io.contractrpc.core.Schema;
import io.contractrpc.core.StandardEndpoint;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Validates handler results against their declared response schemas and renders wire responses,
 * including the engine's own error bodies.
 */
public final class ResponseEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResponseEncoder.class);

    private final JsonCodec json;

    public ResponseEncoder(JsonCodec json) {
        this.json = Objects.requireNonNull(json, "json");
    }

    /**
     * Encodes a standard handler result.
     *
     * <p>A {@code 204} never carries a body. Other statuses are validated when the endpoint declares a schema
     * for them; the body is then written as JSON unless the handler chose another content type.
     *
     * @throws ResponseContractViolationException if the body fails its declared schema
     */
    public ServerResponse encode(StandardEndpoint endpoint, HandlerResponse result) throws JsonException {
        int status = result.status();
        if (status == Protocol.STATUS_NO_CONTENT) {
            ServerResponse resp = new ServerResponse(status, new ResponseBody.Empty());
            result.headers().forEach((k, v) -> {
                if (!k.equalsIgnoreCase(Protocol.H_CONTENT_TYPE)) resp.header(k, v);
            });
            return resp;
        }

        Schema<?> schema = endpoint.responses().get(status);
        if (schema != null) {
            ParseResult<?> parsed = schema.parse(result.body());
            if (parsed instanceof ParseResult.Failure<?> failure) {
                throw new ResponseContractViolationException(status, failure.issues());
            }
        }

        String contentType = contentType(result.headers());
        ResponseBody body = result.body() == null ? new ResponseBody.Empty() : new ResponseBody.Bytes(render(contentType, result.body()));
        ServerResponse resp = new ServerResponse(status, body).header(Protocol.H_CONTENT_TYPE, contentType);
        result.headers().forEach((k, v) -> {
            if (!k.equalsIgnoreCase(Protocol.H_CONTENT_TYPE)) resp.header(k, v);
        });
        return resp;
    }

    private byte[] render(String contentType, Object body) throws JsonException {
        String mediaType = Headers.mediaType(contentType);
        if (mediaType.equals(Protocol.CT_JSON) || mediaType.endsWith("+json")) {
            return json.writeBytes(body);
        }
        if (body instanceof byte[] bytes) return bytes;
        return String.valueOf(body).getBytes(StandardCharsets.UTF_8);
    }

    private static String contentType(Map<String, String> headers) {
        for (Map.Entry<String, String> e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(Protocol.H_CONTENT_TYPE)) return e.getValue();
        }
        return Protocol.CT_JSON;
    }

    public ServerResponse validationError(RequestValidationException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", Protocol.ERR_VALIDATION);
        body.put("field", e.field());
        body.put("issues", issueTrees(e.issues()));
        return error(400, body);
    }

    public ServerResponse notFound(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", Protocol.ERR_NOT_FOUND);
        body.put("message", message);
        return error(404, body);
    }

    public ServerResponse upgradeRequired() {
        return error(426, Map.of("error", Protocol.ERR_UPGRADE_REQUIRED));
    }

    public ServerResponse payloadTooLarge() {
        return error(413, Map.of("error", Protocol.ERR_PAYLOAD_TOO_LARGE));
    }

    public ServerResponse internalError(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", Protocol.ERR_INTERNAL);
        if (message != null) body.put("message", message);
        return error(500, body);
    }

    public static List<Map<String, Object>> issueTrees(List<Issue> issues) {
        List<Map<String, Object>> out = new ArrayList<>(issues.size());
        for (Issue issue : issues) out.add(issue.toTree());
        return out;
    }

    private ServerResponse error(int status, Map<String, Object> body) {
        try {
            return new ServerResponse(status, new ResponseBody.Bytes(json.writeBytes(body)))
                    .header(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
        } catch (JsonException e) {
            LOGGER.error("Failed to render {} error body", status, e);
            return new ServerResponse(status, new ResponseBody.Empty());
        }
    }
}
