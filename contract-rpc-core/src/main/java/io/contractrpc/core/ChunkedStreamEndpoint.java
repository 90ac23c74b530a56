package io.contractrpc.core;

import java.util.Objects;

/**
 * One request answered by an ordered NDJSON stream of chunks and a terminal frame.
 *
 * @param chunk schema of each chunk (declarative on the server side)
 * @param finalResponse schema of the value carried by the terminal frame, may be {@code null}
 */
public record ChunkedStreamEndpoint(
        String name,
        HttpMethod method,
        PathPattern path,
        Schema<?> params,
        Schema<?> query,
        Schema<?> headers,
        Schema<?> body,
        Schema<?> chunk,
        Schema<?> finalResponse
) implements EndpointDefinition {

    public ChunkedStreamEndpoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
    }

    @Override
    public TransportKind kind() {
        return TransportKind.CHUNKED_STREAM;
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
        private Schema<?> chunk;
        private Schema<?> finalResponse;

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

        public Builder chunk(Schema<?> chunk) {
            this.chunk = chunk;
            return this;
        }

        public Builder finalResponse(Schema<?> finalResponse) {
            this.finalResponse = finalResponse;
            return this;
        }

        public ChunkedStreamEndpoint build() {
            return new ChunkedStreamEndpoint(name, method, PathPattern.compile(path), params, query, headers, body, chunk, finalResponse);
        }
    }
}
