package io.contractrpc.server.core.message;

import io.contractrpc.core.Envelope;
import io.contractrpc.core.MessageValidationException;

/**
 * Lifecycle hooks of one message endpoint. Every hook is optional.
 *
 * <pre>{@code
 * MessageHandlers chat = MessageHandlers.builder()
 *     .onOpen(socket -> socket.subscribe("room:" + socket.<Map<String, String>>params().get("room")))
 *     .onMessage((socket, message) -> socket.publish("room:lobby", "said", message.payload()))
 *     .build();
 * }</pre>
 */
public final class MessageHandlers {

    @FunctionalInterface
    public interface SocketHook {
        void handle(TypedSocket socket) throws Exception;
    }

    @FunctionalInterface
    public interface MessageHook {
        /**
         * @param message the envelope, with the payload as produced by the message type's schema
         */
        void handle(TypedSocket socket, Envelope message) throws Exception;
    }

    @FunctionalInterface
    public interface CloseHook {
        void handle(TypedSocket socket, int code, String reason) throws Exception;
    }

    @FunctionalInterface
    public interface ValidationErrorHook {
        void handle(TypedSocket socket, MessageValidationException error) throws Exception;
    }

    private final SocketHook open;
    private final MessageHook message;
    private final CloseHook close;
    private final SocketHook drain;
    private final ValidationErrorHook validationError;

    private MessageHandlers(Builder b) {
        this.open = b.open;
        this.message = b.message;
        this.close = b.close;
        this.drain = b.drain;
        this.validationError = b.validationError;
    }

    public static Builder builder() {
        return new Builder();
    }

    SocketHook open() {
        return open;
    }

    MessageHook message() {
        return message;
    }

    CloseHook close() {
        return close;
    }

    SocketHook drain() {
        return drain;
    }

    ValidationErrorHook validationError() {
        return validationError;
    }

    public static final class Builder {
        private SocketHook open;
        private MessageHook message;
        private CloseHook close;
        private SocketHook drain;
        private ValidationErrorHook validationError;

        private Builder() {}

        public Builder onOpen(SocketHook hook) {
            this.open = hook;
            return this;
        }

        public Builder onMessage(MessageHook hook) {
            this.message = hook;
            return this;
        }

        public Builder onClose(CloseHook hook) {
            this.close = hook;
            return this;
        }

        /** Called when the socket's send buffer drained after backpressure. */
        public Builder onDrain(SocketHook hook) {
            this.drain = hook;
            return this;
        }

        /**
         * Receives invalid inbound messages. Without this hook the engine answers them with an {@code error}
         * envelope.
         */
        public Builder onValidationError(ValidationErrorHook hook) {
            this.validationError = hook;
            return this;
        }

        public MessageHandlers build() {
            return new MessageHandlers(this);
        }
    }
}
