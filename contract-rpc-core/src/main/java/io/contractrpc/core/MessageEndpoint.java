package io.contractrpc.core;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Bidirectional message endpoint reached through an upgrade request.
 *
 * @param clientMessages envelope type to payload schema for inbound messages (enforced)
 * @param serverMessages envelope type to payload schema for outbound messages (declarative)
 */
public record MessageEndpoint(
        String name,
        PathPattern path,
        Schema<?> params,
        Schema<?> query,
        Schema<?> headers,
        Map<String, Schema<?>> clientMessages,
        Map<String, Schema<?>> serverMessages
) implements EndpointDefinition {

    public MessageEndpoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(path, "path");
        clientMessages = clientMessages == null ? Map.of() : Map.copyOf(clientMessages);
        serverMessages = serverMessages == null ? Map.of() : Map.copyOf(serverMessages);
    }

    @Override
    public TransportKind kind() {
        return TransportKind.MESSAGE;
    }

    /**
     * Upgrades always arrive as {@code GET}.
     */
    @Override
    public HttpMethod method() {
        return HttpMethod.GET;
    }

    public static Builder builder(String name, String path) {
        return new Builder(name, path);
    }

    public static final class Builder {
        private final String name;
        private final String path;
        private Schema<?> params;
        private Schema<?> query;
        private Schema<?> headers;
        private final Map<String, Schema<?>> clientMessages = new LinkedHashMap<>();
        private final Map<String, Schema<?>> serverMessages = new LinkedHashMap<>();

        private Builder(String name, String path) {
            this.name = Objects.requireNonNull(name, "name");
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

        public Builder clientMessage(String type, Schema<?> payload) {
            this.clientMessages.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(payload, "payload"));
            return this;
        }

        public Builder serverMessage(String type, Schema<?> payload) {
            this.serverMessages.put(Objects.requireNonNull(type, "type"), Objects.requireNonNull(payload, "payload"));
            return this;
        }

        public MessageEndpoint build() {
            return new MessageEndpoint(name, PathPattern.compile(path), params, query, headers, clientMessages, serverMessages);
        }
    }
}
