package io.contractrpc.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Server-push event stream endpoint.
 *
 * @param events event name to payload schema. Declarative: the server does not validate what a handler
 *               emits, clients may validate what they receive.
 */
public record PushEventEndpoint(
        String name,
        HttpMethod method,
        PathPattern path,
        Schema<?> params,
        Schema<?> query,
        Schema<?> headers,
        Map<String, Schema<?>> events
) implements EndpointDefinition {

    public PushEventEndpoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        events = events == null ? Map.of() : Map.copyOf(events);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.PUSH_EVENT;
    }

    public static Builder builder(String name, String path) {
        return new Builder(name, HttpMethod.GET, path);
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
        private final Map<String, Schema<?>> events = new LinkedHashMap<>();

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

        public Builder event(String eventName, Schema<?> payload) {
            this.events.put(Objects.requireNonNull(eventName, "eventName"), Objects.requireNonNull(payload, "payload"));
            return this;
        }

        public PushEventEndpoint build() {
            return new PushEventEndpoint(name, method, PathPattern.compile(path), params, query, headers, events);
        }
    }
}
