package io.contractrpc.client;

import io.contractrpc.core.BasePath;
import io.contractrpc.core.EndpointDefinition;
import io.contractrpc.core.Protocol;
import io.contractrpc.core.Schema;
import io.contractrpc.core.StandardEndpoint;
import io.contractrpc.core.Urls;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns an endpoint plus {@link RequestOptions} into a {@link TransportRequest}: validates the supplied parts,
 * interpolates the path, appends the query and merges headers over the client defaults.
 */
final class RequestFactory {

    private final String baseUrl;
    private final BasePath basePath;
    private final Map<String, String> defaultHeaders;
    private final boolean validate;
    private final JsonCodec json;
    private final Duration callTimeout;

    RequestFactory(String baseUrl, BasePath basePath, Map<String, String> defaultHeaders, boolean validate,
                   JsonCodec json, Duration callTimeout) {
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.basePath = basePath;
        this.defaultHeaders = Map.copyOf(defaultHeaders);
        this.validate = validate;
        this.json = json;
        this.callTimeout = callTimeout;
    }

    /**
     * A buffered call to a standard endpoint, bounded by the client's call timeout when one is set.
     */
    TransportRequest call(StandardEndpoint endpoint, RequestOptions options) {
        return build(endpoint, endpoint.body(), options, null).withTimeout(callTimeout);
    }

    /**
     * @param bodySchema the endpoint's body schema, {@code null} for endpoints without one
     * @param accept value of the {@code Accept} header, or {@code null}
     * @throws ClientValidationException if request validation is enabled and a supplied part is rejected
     */
    TransportRequest build(EndpointDefinition endpoint, Schema<?> bodySchema, RequestOptions options, String accept) {
        Map<String, String> headers = headers(options);
        byte[] body = null;
        if (options.body() != null) {
            body = encode(options.body());
            headers = withHeader(headers, Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
        }
        if (validate) {
            validateParts(endpoint, options, headers);
            if (bodySchema != null && body != null) {
                Validation.check("body", bodySchema, decode(body));
            }
        }
        if (accept != null) {
            headers = withHeader(headers, Protocol.H_ACCEPT, accept);
        }
        Map<String, List<String>> wire = new LinkedHashMap<>();
        headers.forEach((k, v) -> wire.put(k, List.of(v)));
        return new TransportRequest(endpoint.method().name(), url(baseUrl, endpoint, options), wire, body, null);
    }

    /**
     * Validates the upgrade parts of a message endpoint and returns the headers to send.
     */
    Map<String, String> upgradeHeaders(EndpointDefinition endpoint, RequestOptions options) {
        Map<String, String> headers = headers(options);
        if (validate) validateParts(endpoint, options, headers);
        return headers;
    }

    URI url(String base, EndpointDefinition endpoint, RequestOptions options) {
        Map<String, String> encoded = new LinkedHashMap<>();
        options.params().forEach((k, v) -> encoded.put(k, Urls.encodePathSegment(String.valueOf(v))));
        String path = basePath.prepend(endpoint.path().interpolate(encoded));
        return Urls.withQuery(URI.create(stripTrailingSlash(base) + path), options.query());
    }

    String baseUrl() {
        return baseUrl;
    }

    private void validateParts(EndpointDefinition endpoint, RequestOptions options, Map<String, String> headers) {
        if (endpoint.params() != null && !options.params().isEmpty()) {
            Validation.check("params", endpoint.params(), stringValues(options.params()));
        }
        if (endpoint.query() != null && !options.query().isEmpty()) {
            Validation.check("query", endpoint.query(), stringValues(options.query()));
        }
        if (endpoint.headers() != null && !options.headers().isEmpty()) {
            Map<String, String> lower = new LinkedHashMap<>();
            headers.forEach((k, v) -> lower.put(k.toLowerCase(Locale.ROOT), v));
            Validation.check("headers", endpoint.headers(), lower);
        }
    }

    private Map<String, String> headers(RequestOptions options) {
        Map<String, String> out = new LinkedHashMap<>(defaultHeaders);
        for (Map.Entry<String, String> e : options.headers().entrySet()) {
            out = withHeader(out, e.getKey(), e.getValue());
        }
        return out;
    }

    private static Map<String, String> withHeader(Map<String, String> headers, String name, String value) {
        Map<String, String> out = new LinkedHashMap<>();
        headers.forEach((k, v) -> {
            if (!k.equalsIgnoreCase(name)) out.put(k, v);
        });
        out.put(name, value);
        return out;
    }

    /**
     * Path and query values as the server sees them: strings, or lists of strings for repeated keys.
     */
    private static Map<String, Object> stringValues(Map<String, Object> values) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            if (e.getValue() instanceof Iterable<?> items) {
                List<String> list = new ArrayList<>();
                for (Object item : items) {
                    if (item != null) list.add(String.valueOf(item));
                }
                out.put(e.getKey(), list);
            } else {
                out.put(e.getKey(), String.valueOf(e.getValue()));
            }
        }
        return out;
    }

    private byte[] encode(Object body) {
        try {
            return json.writeBytes(body);
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
    }

    private Object decode(byte[] body) {
        try {
            return json.readTree(body);
        } catch (JsonException e) {
            throw new IllegalStateException("Serialized request body is not valid JSON", e);
        }
    }

    private static String stripTrailingSlash(String url) {
        String u = url;
        while (u.endsWith("/")) u = u.substring(0, u.length() - 1);
        return u;
    }
}
