package io.contractrpc.server.core;

import io.contractrpc.core.ChunkedStreamEndpoint;
import io.contractrpc.core.EndpointDefinition;
import io.contractrpc.core.Headers;
import io.contractrpc.core.ParseResult;
import io.contractrpc.core.QueryString;
import io.contractrpc.core.RequestValidationException;
import io.contractrpc.core.RouteMatch;
import io.contractrpc.core.Schema;
import io.contractrpc.core.StandardEndpoint;
import io.contractrpc.core.Urls;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Validates the request shape of a matched endpoint: path parameters, query, headers, then body.
 *
 * <p>The first failing part stops validation. Only endpoints that declare a body schema (standard and
 * chunked-stream endpoints) read the body at all.
 */
public final class RequestValidator {

    private final BodyDecoder bodyDecoder;

    public RequestValidator(BodyDecoder bodyDecoder) {
        this.bodyDecoder = Objects.requireNonNull(bodyDecoder, "bodyDecoder");
    }

    /**
     * @throws RequestValidationException naming the first part that failed
     * @throws IOException if the body cannot be read, including {@link BodySizeLimiter.PayloadTooLargeException}
     */
    public ValidatedRequest validate(RouteMatch match, ServerRequest request, Object context) throws IOException {
        EndpointDefinition endpoint = match.endpoint();

        Object params = validateParams(endpoint, match.pathParams());
        Object query = validateQuery(endpoint, request);
        Object headers = validateHeaders(endpoint, request);

        Schema<?> bodySchema = bodySchema(endpoint);
        Object body = null;
        if (bodySchema != null) {
            body = check(RequestValidationException.BODY, bodySchema, bodyDecoder.decode(request));
        }
        return new ValidatedRequest(endpoint.name(), endpoint, params, query, headers, body, context);
    }

    /**
     * Validates everything an upgrade request carries (no body).
     */
    public ValidatedRequest validateUpgrade(RouteMatch match, ServerRequest request, Object context) {
        EndpointDefinition endpoint = match.endpoint();
        Object params = validateParams(endpoint, match.pathParams());
        Object query = validateQuery(endpoint, request);
        Object headers = validateHeaders(endpoint, request);
        return new ValidatedRequest(endpoint.name(), endpoint, params, query, headers, null, context);
    }

    private static Object validateParams(EndpointDefinition endpoint, Map<String, String> raw) {
        Map<String, String> decoded = new LinkedHashMap<>();
        raw.forEach((k, v) -> decoded.put(k, Urls.decodePathSegment(v)));
        if (endpoint.params() == null) return decoded;
        return check(RequestValidationException.PARAMS, endpoint.params(), decoded);
    }

    private static Object validateQuery(EndpointDefinition endpoint, ServerRequest request) {
        if (endpoint.query() == null) return Map.of();
        return check(RequestValidationException.QUERY, endpoint.query(), QueryString.parse(request.uri()));
    }

    private static Object validateHeaders(EndpointDefinition endpoint, ServerRequest request) {
        if (endpoint.headers() == null) return Map.of();
        return check(RequestValidationException.HEADERS, endpoint.headers(), Headers.flatten(request.headers()));
    }

    private static Schema<?> bodySchema(EndpointDefinition endpoint) {
        if (endpoint instanceof StandardEndpoint standard) return standard.body();
        if (endpoint instanceof ChunkedStreamEndpoint chunked) return chunked.body();
        return null;
    }

    static Object check(String field, Schema<?> schema, Object input) {
        ParseResult<?> result = schema.parse(input);
        if (result instanceof ParseResult.Failure<?> failure) {
            throw new RequestValidationException(field, failure.issues());
        }
        return ((ParseResult.Success<?>) result).value();
    }
}
