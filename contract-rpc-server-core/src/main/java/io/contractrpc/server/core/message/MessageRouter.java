package io.contractrpc.server.core.message;

import io.contractrpc.core.BasePath;
import io.contractrpc.core.Contract;
import io.contractrpc.core.EndpointDefinition;
import io.contractrpc.core.HttpMethod;
import io.contractrpc.core.MessageEndpoint;
import io.contractrpc.core.ParseResult;
import io.contractrpc.core.RequestValidationException;
import io.contractrpc.core.RouteMatch;
import io.contractrpc.core.RouteNotFoundException;
import io.contractrpc.core.Schema;
import io.contractrpc.core.TransportKind;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonCodecs;
import io.contractrpc.server.core.BodyDecoder;
import io.contractrpc.server.core.BodySizeLimiter;
import io.contractrpc.server.core.ContextFactory;
import io.contractrpc.server.core.RequestValidator;
import io.contractrpc.server.core.ResponseEncoder;
import io.contractrpc.server.core.ServerRequest;
import io.contractrpc.server.core.ValidatedRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Upgrade validation and session management for the message endpoints of a contract.
 *
 * <p>A socket integration calls {@link #upgrade(ServerRequest)} on the HTTP upgrade request, performs the
 * handshake itself when the outcome is accepted, then calls {@link #open(UpgradeResult, MessageSocket)} and
 * forwards socket events to the returned {@link MessageSession}.
 *
 * <pre>{@code
 * MessageRouter router = MessageRouter.builder(contract)
 *     .handlers("chat", chatHandlers)
 *     .basePath("/api")
 *     .build();
 * }</pre>
 */
public final class MessageRouter {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageRouter.class);

    private final Contract contract;
    private final Map<String, MessageHandlers> handlers;
    private final BasePath basePath;
    private final ContextFactory contextFactory;
    private final Schema<?> dataSchema;
    private final JsonCodec json;
    private final RequestValidator validator;
    private final ResponseEncoder encoder;
    private final TopicRegistry topics = new TopicRegistry();

    private MessageRouter(Builder b) {
        this.contract = b.contract;
        this.handlers = Map.copyOf(b.handlers);
        this.basePath = b.basePath;
        this.contextFactory = b.contextFactory != null ? b.contextFactory : ContextFactory.none();
        this.dataSchema = b.dataSchema;
        this.json = b.json != null ? b.json : JsonCodecs.discover();
        this.validator = new RequestValidator(new BodyDecoder(json, BodySizeLimiter.UNLIMITED));
        this.encoder = new ResponseEncoder(json);
    }

    public static Builder builder(Contract contract) {
        return new Builder(contract);
    }

    /**
     * Validates an upgrade request: route, path parameters, query and headers.
     */
    public UpgradeOutcome upgrade(ServerRequest request) {
        RouteMatch match;
        try {
            match = resolve(request);
        } catch (RouteNotFoundException e) {
            LOGGER.warn("Rejected upgrade: {}", e.getMessage());
            return new UpgradeOutcome.Rejected(encoder.notFound(e.getMessage()));
        }
        EndpointDefinition endpoint = match.endpoint();
        try {
            Object context = contextFactory.create(request, endpoint.name(), endpoint);
            ValidatedRequest v = validator.validateUpgrade(match, request, context);
            return new UpgradeOutcome.Accepted(new UpgradeResult(
                    endpoint.name(), (MessageEndpoint) endpoint, v.params(), v.query(), v.headers(), context));
        } catch (RequestValidationException e) {
            LOGGER.warn("Rejected upgrade to {}: invalid {} {}", endpoint.name(), e.field(), e.issues());
            return new UpgradeOutcome.Rejected(encoder.validationError(e));
        } catch (Exception e) {
            LOGGER.error("Upgrade to {} failed", endpoint.name(), e);
            return new UpgradeOutcome.Rejected(encoder.internalError(null));
        }
    }

    /**
     * Opens a session whose data is the upgrade's context value.
     */
    public MessageSession open(UpgradeResult upgrade, MessageSocket socket) {
        return open(upgrade, socket, upgrade.context());
    }

    /**
     * Opens a session with caller-supplied per-connection data and runs the {@code open} hook.
     *
     * @throws RequestValidationException with field {@code data} if a data schema is configured and rejects it
     */
    public MessageSession open(UpgradeResult upgrade, MessageSocket socket, Object data) {
        Objects.requireNonNull(upgrade, "upgrade");
        Objects.requireNonNull(socket, "socket");
        MessageHandlers h = handlers.get(upgrade.endpointName());
        if (h == null) throw new IllegalArgumentException("No message handlers bound for " + upgrade.endpointName());
        Object sessionData = data;
        if (dataSchema != null) {
            sessionData = validateData(data);
        }
        MessageSession session = new MessageSession(upgrade, h, socket, json, topics, sessionData);
        session.start();
        return session;
    }

    /**
     * @return whether a request path (including the base path) belongs to a message endpoint
     */
    public boolean isMessageRoute(ServerRequest request) {
        try {
            resolve(request);
            return true;
        } catch (RouteNotFoundException e) {
            return false;
        }
    }

    private Object validateData(Object data) {
        ParseResult<?> result = dataSchema.parse(data);
        if (result instanceof ParseResult.Failure<?> failure) {
            throw new RequestValidationException(RequestValidationException.DATA, failure.issues());
        }
        return ((ParseResult.Success<?>) result).value();
    }

    private RouteMatch resolve(ServerRequest request) {
        String rawPath = request.uri().getRawPath();
        HttpMethod method;
        try {
            method = HttpMethod.parse(request.method());
        } catch (IllegalArgumentException e) {
            throw new RouteNotFoundException(request.method(), rawPath);
        }
        Optional<String> path = basePath.strip(rawPath);
        if (path.isEmpty()) throw new RouteNotFoundException(request.method(), rawPath);
        return contract.match(method, path.get(), EnumSet.of(TransportKind.MESSAGE))
                .orElseThrow(() -> new RouteNotFoundException(request.method(), rawPath));
    }

    public static final class Builder {
        private final Contract contract;
        private final Map<String, MessageHandlers> handlers = new LinkedHashMap<>();
        private BasePath basePath = BasePath.root();
        private ContextFactory contextFactory;
        private Schema<?> dataSchema;
        private JsonCodec json;

        private Builder(Contract contract) {
            this.contract = Objects.requireNonNull(contract, "contract");
        }

        /**
         * @throws IllegalArgumentException if {@code name} is not a message endpoint of the contract
         */
        public Builder handlers(String name, MessageHandlers messageHandlers) {
            EndpointDefinition e = contract.endpoint(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown endpoint: " + name));
            if (e.kind() != TransportKind.MESSAGE) {
                throw new IllegalArgumentException("Endpoint " + name + " is " + e.kind() + ", not MESSAGE");
            }
            handlers.put(name, Objects.requireNonNull(messageHandlers, "messageHandlers"));
            return this;
        }

        public Builder basePath(String basePath) {
            this.basePath = BasePath.of(basePath);
            return this;
        }

        public Builder contextFactory(ContextFactory contextFactory) {
            this.contextFactory = contextFactory;
            return this;
        }

        /** Validates per-connection data passed to {@link MessageRouter#open}. */
        public Builder dataSchema(Schema<?> dataSchema) {
            this.dataSchema = dataSchema;
            return this;
        }

        public Builder jsonCodec(JsonCodec json) {
            this.json = json;
            return this;
        }

        /**
         * @throws IllegalStateException if a message endpoint of the contract has no handlers
         */
        public MessageRouter build() {
            for (EndpointDefinition e : contract.endpoints()) {
                if (e.kind() == TransportKind.MESSAGE && !handlers.containsKey(e.name())) {
                    throw new IllegalStateException("No message handlers bound for endpoint " + e.name());
                }
            }
            return new MessageRouter(this);
        }
    }
}
