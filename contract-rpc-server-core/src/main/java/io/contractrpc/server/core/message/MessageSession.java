package io.contractrpc.server.core.message;

import io.contractrpc.core.Envelope;
import io.contractrpc.core.Issue;
import io.contractrpc.core.MessageValidationException;
import io.contractrpc.core.ParseResult;
import io.contractrpc.core.Protocol;
import io.contractrpc.core.Schema;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;
import io.contractrpc.server.core.ResponseEncoder;
import io.contractrpc.server.core.transport.CancellationSignal;
import io.contractrpc.server.core.transport.Connection;
import io.contractrpc.server.core.transport.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One accepted message connection.
 *
 * <p>The socket integration forwards inbound events here: {@link #onMessage(String)} for each text frame,
 * {@link #onDrain()} when the outbound buffer drained, {@link #onClose(int, String)} once the socket closed.
 * {@code open}, {@code close} and {@code drain} hooks run at most once; exceptions from hooks are logged
 * and leave the session open.
 */
public final class MessageSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(MessageSession.class);

    private final UpgradeResult upgrade;
    private final MessageHandlers handlers;
    private final MessageSocket sink;
    private final JsonCodec json;
    private final TopicRegistry topics;
    private final Object data;
    private final Connection connection;
    private final TypedSocket socket;
    private final AtomicBoolean drained = new AtomicBoolean();
    private final Object sendLock = new Object();

    MessageSession(UpgradeResult upgrade, MessageHandlers handlers, MessageSocket sink, JsonCodec json, TopicRegistry topics, Object data) {
        this.upgrade = upgrade;
        this.handlers = handlers;
        this.sink = sink;
        this.json = json;
        this.topics = topics;
        this.data = data;
        this.connection = new Connection(upgrade.endpointName());
        this.socket = new TypedSocket(this);
    }

    void start() {
        if (!connection.open()) return;
        if (handlers.open() != null) {
            invoke("open", () -> handlers.open().handle(socket));
        }
    }

    /**
     * Handles one inbound text frame.
     */
    public void onMessage(String text) {
        if (!connection.isOpen()) return;
        Envelope inbound;
        try {
            inbound = parse(text);
        } catch (MessageValidationException e) {
            rejected(e);
            return;
        }
        if (handlers.message() != null) {
            invoke("message", () -> handlers.message().handle(socket, inbound));
        }
    }

    public void onDrain() {
        if (!connection.isOpen() || !drained.compareAndSet(false, true)) return;
        if (handlers.drain() != null) {
            invoke("drain", () -> handlers.drain().handle(socket));
        }
    }

    /**
     * Reports that the underlying socket closed. Only the first call has an effect.
     */
    public void onClose(int code, String reason) {
        if (!connection.beginClose()) return;
        topics.unsubscribeAll(this);
        try {
            if (handlers.close() != null) {
                invoke("close", () -> handlers.close().handle(socket, code, reason));
            }
        } finally {
            connection.finish();
        }
    }

    public TypedSocket socket() {
        return socket;
    }

    public ConnectionState state() {
        return connection.state();
    }

    public boolean isOpen() {
        return connection.isOpen();
    }

    CancellationSignal signal() {
        return connection.signal();
    }

    UpgradeResult upgrade() {
        return upgrade;
    }

    Object data() {
        return data;
    }

    TopicRegistry topics() {
        return topics;
    }

    private Envelope parse(String text) {
        Envelope envelope;
        try {
            envelope = Envelope.fromTree(json.readTree(text));
        } catch (JsonException | IllegalArgumentException e) {
            throw new MessageValidationException(Protocol.UNKNOWN_MESSAGE_TYPE,
                    List.of(new Issue("invalid_envelope", List.of(), "Message must be a JSON object with a string 'type'")));
        }
        Schema<?> schema = upgrade.endpoint().clientMessages().get(envelope.type());
        if (schema == null) {
            throw new MessageValidationException(envelope.type(),
                    List.of(new Issue("unknown_message_type", List.of(Protocol.ENVELOPE_TYPE), "Unknown message type: " + envelope.type())));
        }
        ParseResult<?> result = schema.parse(envelope.payload());
        if (result instanceof ParseResult.Failure<?> failure) {
            throw new MessageValidationException(envelope.type(), failure.issues());
        }
        return new Envelope(envelope.type(), ((ParseResult.Success<?>) result).value());
    }

    private void rejected(MessageValidationException e) {
        if (handlers.validationError() != null) {
            invoke("validationError", () -> handlers.validationError().handle(socket, e));
            return;
        }
        LOGGER.warn("Rejected '{}' message on {}: {}", e.messageType(), connection.id(), e.issues());
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("code", Protocol.VALIDATION_ERROR_CODE);
        payload.put("message", e.getMessage());
        payload.put("issues", ResponseEncoder.issueTrees(e.issues()));
        sendEnvelope(new Envelope(Protocol.ERROR_MESSAGE_TYPE, payload));
    }

    boolean sendEnvelope(Envelope envelope) {
        if (!connection.isOpen()) return false;
        String text;
        try {
            text = json.writeString(envelope.toTree());
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot serialize payload of message '" + envelope.type() + "'", e);
        }
        return write(text);
    }

    int publish(String topic, Envelope envelope) {
        String text;
        try {
            text = json.writeString(envelope.toTree());
        } catch (JsonException e) {
            throw new IllegalArgumentException("Cannot serialize payload of message '" + envelope.type() + "'", e);
        }
        int delivered = 0;
        for (MessageSession other : topics.subscribers(topic)) {
            if (other != this && other.write(text)) delivered++;
        }
        return delivered;
    }

    private boolean write(String text) {
        synchronized (sendLock) {
            if (!connection.isOpen()) return false;
            try {
                sink.send(text);
                return true;
            } catch (IOException e) {
                LOGGER.warn("Failed to write to {}", connection.id(), e);
                return false;
            }
        }
    }

    void closeFromServer(int code, String reason) {
        if (!connection.isOpen()) return;
        sink.close(code, reason);
        onClose(code, reason);
    }

    private void invoke(String hook, HookCall call) {
        try {
            call.run();
        } catch (Exception e) {
            LOGGER.error("'{}' hook of {} failed", hook, connection.id(), e);
        }
    }

    @FunctionalInterface
    private interface HookCall {
        void run() throws Exception;
    }
}
