package io.contractrpc.server.core;

import io.contractrpc.core.BasePath;
import io.contractrpc.core.ChunkedStreamEndpoint;
import io.contractrpc.core.Contract;
import io.contractrpc.core.EndpointDefinition;
import io.contractrpc.core.HttpMethod;
import io.contractrpc.core.Protocol;
import io.contractrpc.core.PushEventEndpoint;
import io.contractrpc.core.RequestValidationException;
import io.contractrpc.core.ResponseContractViolationException;
import io.contractrpc.core.RouteMatch;
import io.contractrpc.core.RouteNotFoundException;
import io.contractrpc.core.Schema;
import io.contractrpc.core.StandardEndpoint;
import io.contractrpc.core.TransportKind;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonCodecs;
import io.contractrpc.server.core.message.MessageHandlers;
import io.contractrpc.server.core.message.MessageRouter;
import io.contractrpc.server.core.transport.ChunkedStreamHandler;
import io.contractrpc.server.core.transport.ChunkedStreamTransport;
import io.contractrpc.server.core.transport.PushEventHandler;
import io.contractrpc.server.core.transport.PushEventTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;

/**
 * Framework-neutral HTTP dispatcher for a {@link Contract}.
 *
 * <p>Every request is matched against the contract, validated, and handed to the handler bound to the
 * matched endpoint. Standard endpoints produce a buffered response; push-event and chunked-stream endpoints
 * produce a streaming {@link ResponseBody}. Message endpoints are reached through {@link #messageRouter()}
 * by the WebSocket integration; a plain HTTP request to one gets {@code 426 Upgrade Required}.
 *
 * <p>Use {@link #builder(Contract)} to bind handlers and configure the router:
 * <pre>{@code
 * ContractRouter router = ContractRouter.builder(contract)
 *     .standard("getUser", req -> HandlerResponse.ok(users.find(req.<Map<String, String>>params().get("id"))))
 *     .pushEvents("logs", (req, emitter, signal) -> logs.tail(emitter::send))
 *     .chunkedStream("generate", (req, stream) -> generator.run(req.body(), stream))
 *     .messages("chat", chatHandlers)
 *     .basePath("/api")
 *     .maxBodySize(5 * 1024 * 1024)
 *     .build();
 * }</pre>
 */
public final class ContractRouter implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ContractRouter.class);

    /** Default bound of each stream's frame buffer. */
    public static final int DEFAULT_STREAM_BUFFER_SIZE = 256;

    private final Contract contract;
    private final Map<String, StandardHandler> standardHandlers;
    private final Map<String, PushEventHandler> pushHandlers;
    private final Map<String, ChunkedStreamHandler> chunkHandlers;
    private final BasePath basePath;
    private final ContextFactory contextFactory;
    private final RequestValidator validator;
    private final ResponseEncoder encoder;
    private final PushEventTransport pushTransport;
    private final ChunkedStreamTransport chunkTransport;
    private final MessageRouter messageRouter;
    private final ExecutorService ownedExecutor;

    public static Builder builder(Contract contract) {
        return new Builder(contract);
    }

    private ContractRouter(Builder b) {
        this.contract = b.contract;
        this.standardHandlers = Map.copyOf(b.standard);
        this.pushHandlers = Map.copyOf(b.push);
        this.chunkHandlers = Map.copyOf(b.chunked);
        this.basePath = b.basePath;
        this.contextFactory = b.contextFactory != null ? b.contextFactory : ContextFactory.none();

        JsonCodec json = b.json != null ? b.json : JsonCodecs.discover();
        long maxBodySize = b.maxBodySize > 0 ? b.maxBodySize : BodySizeLimiter.UNLIMITED;
        int bufferSize = b.streamBufferSize > 0 ? b.streamBufferSize : DEFAULT_STREAM_BUFFER_SIZE;

        Executor executor = b.executor;
        if (executor == null) {
            this.ownedExecutor = HandlerExecutors.newExecutor("contract-rpc-stream");
            executor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
        }

        this.validator = new RequestValidator(new BodyDecoder(json, maxBodySize));
        this.encoder = new ResponseEncoder(json);
        this.pushTransport = new PushEventTransport(executor, json, bufferSize);
        this.chunkTransport = new ChunkedStreamTransport(executor, json, bufferSize);

        MessageRouter.Builder messages = MessageRouter.builder(contract)
                .basePath(basePath.value())
                .contextFactory(contextFactory)
                .jsonCodec(json);
        if (b.messageDataSchema != null) messages.dataSchema(b.messageDataSchema);
        b.messages.forEach(messages::handlers);
        this.messageRouter = messages.build();
    }

    public Contract contract() {
        return contract;
    }

    /**
     * Router for the contract's message endpoints, sharing this router's base path, context factory and codec.
     */
    public MessageRouter messageRouter() {
        return messageRouter;
    }

    public ServerResponse handle(ServerRequest req) {
        String endpointName = null;
        TransportKind kind = null;
        try {
            RouteMatch match = resolve(req);
            EndpointDefinition endpoint = match.endpoint();
            endpointName = endpoint.name();
            kind = endpoint.kind();

            return switch (endpoint.kind()) {
                case STANDARD -> dispatchStandard(req, match, (StandardEndpoint) endpoint);
                case PUSH_EVENT -> openPushEvents(req, match, (PushEventEndpoint) endpoint);
                case CHUNKED_STREAM -> openChunkedStream(req, match, (ChunkedStreamEndpoint) endpoint);
                case MESSAGE -> encoder.upgradeRequired();
            };
        } catch (RouteNotFoundException e) {
            return encoder.notFound(e.getMessage());
        } catch (RequestValidationException e) {
            if (kind == TransportKind.PUSH_EVENT) {
                LOGGER.warn("Rejected upgrade to {}: invalid {} {}", endpointName, e.field(), e.issues());
            } else {
                LOGGER.debug("Invalid {} for {}: {}", e.field(), endpointName, e.issues());
            }
            return encoder.validationError(e);
        } catch (BodySizeLimiter.PayloadTooLargeException e) {
            return encoder.payloadTooLarge();
        } catch (ResponseContractViolationException e) {
            LOGGER.error("Handler for {} violated its response contract for status {}: {}", endpointName, e.status(), e.issues());
            return encoder.internalError(e.getMessage());
        } catch (Exception e) {
            LOGGER.error("Unhandled failure in handler for {}", endpointName, e);
            return encoder.internalError(null);
        }
    }

    /**
     * Encodes a validation failure detected by an adapter before the request could be handed to {@link #handle}.
     */
    public ServerResponse reject(RequestValidationException e) {
        LOGGER.debug("Rejected request: invalid {}: {}", e.field(), e.issues());
        return encoder.validationError(e);
    }

    private ServerResponse dispatchStandard(ServerRequest req, RouteMatch match, StandardEndpoint endpoint) throws Exception {
        ValidatedRequest input = validator.validate(match, req, context(req, endpoint));
        HandlerResponse result = standardHandlers.get(endpoint.name()).handle(input);
        if (result == null) {
            throw new IllegalStateException("Handler for " + endpoint.name() + " returned no response");
        }
        return encoder.encode(endpoint, result);
    }

    private ServerResponse openPushEvents(ServerRequest req, RouteMatch match, PushEventEndpoint endpoint) throws Exception {
        ValidatedRequest input = validator.validateUpgrade(match, req, context(req, endpoint));
        PushEventHandler handler = pushHandlers.get(endpoint.name());
        return new ServerResponse(200, new ResponseBody.Sse(pushTransport.open(input, handler)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_EVENT_STREAM)
                .header(Protocol.H_CACHE_CONTROL, "no-cache")
                .header(Protocol.H_CONNECTION, "keep-alive");
    }

    private ServerResponse openChunkedStream(ServerRequest req, RouteMatch match, ChunkedStreamEndpoint endpoint) throws Exception {
        ValidatedRequest input = validator.validate(match, req, context(req, endpoint));
        ChunkedStreamHandler handler = chunkHandlers.get(endpoint.name());
        return new ServerResponse(200, new ResponseBody.Ndjson(chunkTransport.open(input, handler)))
                .header(Protocol.H_CONTENT_TYPE, Protocol.CT_NDJSON)
                .header(Protocol.H_CACHE_CONTROL, "no-cache");
    }

    private Object context(ServerRequest req, EndpointDefinition endpoint) throws Exception {
        return contextFactory.create(req, endpoint.name(), endpoint);
    }

    private RouteMatch resolve(ServerRequest req) {
        String rawPath = req.uri().getRawPath();
        HttpMethod method;
        try {
            method = HttpMethod.parse(req.method());
        } catch (IllegalArgumentException e) {
            throw new RouteNotFoundException(req.method(), rawPath);
        }
        Optional<String> path = basePath.strip(rawPath);
        if (path.isEmpty()) throw new RouteNotFoundException(req.method(), rawPath);
        return contract.match(method, path.get())
                .orElseThrow(() -> new RouteNotFoundException(req.method(), rawPath));
    }

    /**
     * Shuts down the default stream executor, if this router created one.
     */
    @Override
    public void close() {
        if (ownedExecutor != null) ownedExecutor.shutdownNow();
    }

    /**
     * Builder for {@link ContractRouter}. Every endpoint of the contract must be bound to a handler of its kind.
     */
    public static final class Builder {
        private final Contract contract;
        private final Map<String, StandardHandler> standard = new LinkedHashMap<>();
        private final Map<String, PushEventHandler> push = new LinkedHashMap<>();
        private final Map<String, ChunkedStreamHandler> chunked = new LinkedHashMap<>();
        private final Map<String, MessageHandlers> messages = new LinkedHashMap<>();
        private BasePath basePath = BasePath.root();
        private ContextFactory contextFactory;
        private Executor executor;
        private JsonCodec json;
        private Schema<?> messageDataSchema;
        private long maxBodySize;
        private int streamBufferSize;

        private Builder(Contract contract) {
            this.contract = Objects.requireNonNull(contract, "contract");
        }

        public Builder standard(String name, StandardHandler handler) {
            bind(name, TransportKind.STANDARD);
            standard.put(name, Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder pushEvents(String name, PushEventHandler handler) {
            bind(name, TransportKind.PUSH_EVENT);
            push.put(name, Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder chunkedStream(String name, ChunkedStreamHandler handler) {
            bind(name, TransportKind.CHUNKED_STREAM);
            chunked.put(name, Objects.requireNonNull(handler, "handler"));
            return this;
        }

        public Builder messages(String name, MessageHandlers handlers) {
            bind(name, TransportKind.MESSAGE);
            messages.put(name, Objects.requireNonNull(handlers, "handlers"));
            return this;
        }

        /** Prefix stripped from request paths before matching. Default: none. */
        public Builder basePath(String basePath) {
            this.basePath = BasePath.of(basePath);
            return this;
        }

        /** Computes the per-request context. Default: {@code null} context. */
        public Builder contextFactory(ContextFactory contextFactory) {
            this.contextFactory = contextFactory;
            return this;
        }

        /**
         * Executor running push-event and chunked-stream handlers. Default: virtual threads when available,
         * otherwise a cached pool of daemon threads.
         */
        public Builder executor(Executor executor) {
            this.executor = executor;
            return this;
        }

        /** JSON codec. Default: discovered through {@link JsonCodecs#discover()}. */
        public Builder jsonCodec(JsonCodec json) {
            this.json = json;
            return this;
        }

        /**
         * Schema applied to the connection data of every message session accepted through {@link #messageRouter()}.
         * Default: none, data is passed through unvalidated.
         */
        public Builder messageDataSchema(Schema<?> schema) {
            this.messageDataSchema = schema;
            return this;
        }

        /** Maximum request body size in bytes; larger bodies get {@code 413}. Default: unlimited. */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        /** Frames buffered per stream before {@code send} blocks. Default: 256. */
        public Builder streamBufferSize(int streamBufferSize) {
            this.streamBufferSize = streamBufferSize;
            return this;
        }

        private void bind(String name, TransportKind kind) {
            EndpointDefinition e = contract.endpoint(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown endpoint: " + name));
            if (e.kind() != kind) {
                throw new IllegalArgumentException("Endpoint " + name + " is " + e.kind() + ", not " + kind);
            }
        }

        /**
         * @throws IllegalStateException if an endpoint has no handler
         */
        public ContractRouter build() {
            for (EndpointDefinition e : contract.endpoints()) {
                boolean bound = standard.containsKey(e.name()) || push.containsKey(e.name())
                        || chunked.containsKey(e.name()) || messages.containsKey(e.name());
                if (!bound) throw new IllegalStateException("No handler bound for endpoint " + e.name());
            }
            return new ContractRouter(this);
        }
    }
}
