package io.contractrpc.client;

import io.contractrpc.core.Envelope;
import io.contractrpc.core.Issue;
import io.contractrpc.core.MessageEndpoint;
import io.contractrpc.core.ParseResult;
import io.contractrpc.core.Protocol;
import io.contractrpc.core.Schema;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Client side of one message endpoint connection.
 *
 * <p>Outbound messages are checked against the endpoint's client message schemas before they are sent;
 * inbound messages are parsed as envelopes, checked against the server message schemas and dispatched to
 * the listeners registered for their type. Every listener registration returns a {@link Runnable} that
 * removes it again.
 *
 * <pre>{@code
 * TypedWebSocket chat = client.webSocket("chat", RequestOptions.builder().param("room", "lobby").build());
 * chat.<Map<String, Object>>on("said", payload -> System.out.println(payload.get("text")));
 * chat.connect().join();
 * chat.send("say", Map.of("text", "hello"));
 * }</pre>
 */
public final class TypedWebSocket implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TypedWebSocket.class);

    private final HttpClient http;
    private final URI url;
    private final Map<String, String> headers;
    private final MessageEndpoint endpoint;
    private final JsonCodec json;
    private final boolean validateOutbound;
    private final boolean validateInbound;

    private final Set<Consumer<Envelope>> messageListeners = new CopyOnWriteArraySet<>();
    private final Map<String, Set<Consumer<Object>>> typedListeners = new ConcurrentHashMap<>();
    private final Set<Consumer<Boolean>> stateListeners = new CopyOnWriteArraySet<>();
    private final Set<Consumer<Throwable>> errorListeners = new CopyOnWriteArraySet<>();

    private final Object sendLock = new Object();
    private volatile WebSocket socket;
    private volatile boolean connected;
    private CompletableFuture<Void> connecting;

    TypedWebSocket(HttpClient http, URI url, Map<String, String> headers, MessageEndpoint endpoint, JsonCodec json,
                   boolean validateOutbound, boolean validateInbound) {
        this.http = http;
        this.url = url;
        this.headers = Map.copyOf(headers);
        this.endpoint = endpoint;
        this.json = json;
        this.validateOutbound = validateOutbound;
        this.validateInbound = validateInbound;
    }

    /**
     * Opens the connection. While a connection is open or being opened, returns the same future.
     */
    public synchronized CompletableFuture<Void> connect() {
        if (connecting != null) return connecting;
        WebSocket.Builder builder = http.newWebSocketBuilder();
        headers.forEach(builder::header);
        CompletableFuture<Void> future = builder.buildAsync(url, new Listener()).thenAccept(this::markOpen);
        connecting = future;
        future.whenComplete((v, error) -> {
            if (error != null) {
                reset();
                notifyError(error instanceof CompletionException && error.getCause() != null ? error.getCause() : error);
            }
        });
        return future;
    }

    /**
     * Sends a typed envelope.
     *
     * @throws IllegalStateException if the socket is not connected
     * @throws ClientValidationException if outbound validation is enabled and the type is unknown or the
     *                                   payload fails its schema
     * @throws IOException if the socket refused the write
     */
    public void send(String type, Object payload) throws IOException {
        WebSocket ws = socket;
        if (ws == null || !connected) {
            throw new IllegalStateException("WebSocket is not connected");
        }
        if (validateOutbound) {
            Schema<?> schema = endpoint.clientMessages().get(type);
            if (schema == null) {
                throw new ClientValidationException("message[" + type + "]",
                        List.of(new Issue("unknown_message_type", List.of(Protocol.ENVELOPE_TYPE), "Unknown message type: " + type)));
            }
            Validation.check("message[" + type + "]", schema, roundTrip(payload));
        }
        String text;
        try {
            text = json.writeString(new Envelope(type, payload).toTree());
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot serialize payload of message '" + type + "'", e);
        }
        synchronized (sendLock) {
            try {
                ws.sendText(text, true).get();
            } catch (ExecutionException e) {
                throw new IOException("Failed to send '" + type + "' message", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while sending '" + type + "' message");
            }
        }
    }

    /**
     * Listens for one server message type. The payload is the value produced by its schema when inbound
     * validation ran.
     */
    @SuppressWarnings("unchecked")
    public <T> Runnable on(String type, Consumer<T> listener) {
        Consumer<Object> l = (Consumer<Object>) listener;
        typedListeners.computeIfAbsent(type, t -> new CopyOnWriteArraySet<>()).add(l);
        return () -> typedListeners.getOrDefault(type, Set.of()).remove(l);
    }

    public Runnable onMessage(Consumer<Envelope> listener) {
        messageListeners.add(listener);
        return () -> messageListeners.remove(listener);
    }

    public Runnable onStateChange(Consumer<Boolean> listener) {
        stateListeners.add(listener);
        return () -> stateListeners.remove(listener);
    }

    /**
     * Receives connection failures, unparseable frames and inbound validation failures.
     */
    public Runnable onError(Consumer<Throwable> listener) {
        errorListeners.add(listener);
        return () -> errorListeners.remove(listener);
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * Starts the closing handshake. State listeners see {@code false} once the server acknowledged.
     */
    public void disconnect() {
        WebSocket ws = socket;
        if (ws != null) {
            ws.sendClose(WebSocket.NORMAL_CLOSURE, "");
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    private Object roundTrip(Object payload) {
        try {
            return json.readTree(json.writeBytes(payload));
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot serialize message payload", e);
        }
    }

    private void dispatch(String text) {
        Envelope envelope;
        try {
            envelope = Envelope.fromTree(json.readTree(text));
        } catch (JsonException | IllegalArgumentException e) {
            notifyError(new IOException("Failed to parse WebSocket message: " + e.getMessage(), e));
            return;
        }
        Object payload = envelope.payload();
        Schema<?> schema = endpoint.serverMessages().get(envelope.type());
        if (validateInbound && schema != null) {
            ParseResult<?> result = schema.parse(payload);
            if (result instanceof ParseResult.Failure<?> failure) {
                notifyError(new ClientValidationException("message[" + envelope.type() + "]", failure.issues()));
                return;
            }
            payload = ((ParseResult.Success<?>) result).value();
        }
        Envelope typed = new Envelope(envelope.type(), payload);
        for (Consumer<Envelope> l : messageListeners) {
            deliver(l, typed);
        }
        for (Consumer<Object> l : typedListeners.getOrDefault(envelope.type(), Set.of())) {
            deliver(l, payload);
        }
    }

    private void notifyState(boolean state) {
        connected = state;
        for (Consumer<Boolean> l : stateListeners) {
            deliver(l, state);
        }
    }

    private void notifyError(Throwable error) {
        if (errorListeners.isEmpty()) {
            LOGGER.warn("WebSocket {} error with no error listener", url, error);
            return;
        }
        for (Consumer<Throwable> l : errorListeners) {
            deliver(l, error);
        }
    }

    private <T> void deliver(Consumer<T> listener, T value) {
        try {
            listener.accept(value);
        } catch (RuntimeException e) {
            LOGGER.warn("WebSocket listener for {} failed", url, e);
        }
    }

    /**
     * Called from both the handshake future and {@code onOpen}, whichever comes first.
     */
    private void markOpen(WebSocket ws) {
        synchronized (this) {
            if (socket != null) return;
            socket = ws;
            connected = true;
        }
        LOGGER.debug("WebSocket {} open", url);
        notifyState(true);
    }

    private synchronized void reset() {
        socket = null;
        connecting = null;
    }

    private final class Listener implements WebSocket.Listener {
        private final StringBuilder partial = new StringBuilder();

        @Override
        public void onOpen(WebSocket webSocket) {
            markOpen(webSocket);
            webSocket.request(1);
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                dispatch(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            LOGGER.debug("WebSocket {} closed: {} {}", url, statusCode, reason);
            reset();
            notifyState(false);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            boolean wasConnected = connected;
            reset();
            notifyError(error);
            if (wasConnected) notifyState(false);
        }
    }
}
