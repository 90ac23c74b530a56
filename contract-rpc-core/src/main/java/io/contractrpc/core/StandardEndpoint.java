package io.contractrpc.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Request/response endpoint.
 *
 * @param responses status code to body schema; statuses without an entry are not validated
 */
public record StandardEndpoint(
        String name,
        HttpMethod method,
        PathPattern path,
        Schema<?> params,
        Schema<?> query,
        Schema<?> headers,
        Schema<?> body,
        Map<Integer, Schema<?>> responses
) implements EndpointDefinition {

    public StandardEndpoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        responses = responses == null ? Map.of() : Map.copyOf(responses);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.STANDARD;
    }

    public static Builder builder(String name, HttpMethod method, String path) {
        return new Builder(name, method, path);
    }

    public static final class Builder {
        private final String name;
        private final HttpMethod method;
        private final String path;
        private Schema<?> params;
        private Schema<?> query;
        private Schema<?> headers;
        private Schema<?> body;
        private final Map<Integer, Schema<?>> responses = new LinkedHashMap<>();

        private Builder(String name, HttpMethod method, String path) {
            this.name = Objects.requireNonNull(name, "name");
            this.method = Objects.requireNonNull(method, "method");
            this.path = Objects.requireNonNull(path, "path");
        }

        public Builder params(Schema<?> params) {
            this.params = params;
            return this;
        }

        public Builder query(Schema<?> query) {
            this.query = query;
            return this;
        }

        public Builder headers(Schema<?> headers) {
            this.headers = headers;
            return this;
        }

        public Builder body(Schema<?> body) {
            this.body = body;
            return this;
        }

        public Builder response(int status, Schema<?> schema) {
            this.responses.put(status, Objects.requireNonNull(schema, "schema"));
            return this;
        }

        public StandardEndpoint build() {
            return new StandardEndpoint(name, method, PathPattern.compile(path), params, query, headers, body, responses);
        }
    }
}
