package io.contractrpc.server.core.message;

import io.contractrpc.core.Envelope;
import io.contractrpc.server.core.transport.CancellationSignal;

import java.util.Objects;

/**
 * Application-facing view of one message session.
 *
 * <p>Outbound payloads are written as {@code {"type":..,"payload":..}} envelopes and are not checked against the
 * endpoint's server message schemas.
 */
public final class TypedSocket {

    private final MessageSession session;

    TypedSocket(MessageSession session) {
        this.session = session;
    }

    /**
     * @return {@code false} if the session is no longer open or the socket refused the write
     */
    public boolean send(String type, Object payload) {
        return session.sendEnvelope(new Envelope(Objects.requireNonNull(type, "type"), payload));
    }

    public void subscribe(String topic) {
        session.topics().subscribe(Objects.requireNonNull(topic, "topic"), session);
    }

    public void unsubscribe(String topic) {
        session.topics().unsubscribe(Objects.requireNonNull(topic, "topic"), session);
    }

    public boolean isSubscribed(String topic) {
        return session.topics().isSubscribed(topic, session);
    }

    /**
     * Sends an envelope to every other open subscriber of {@code topic}.
     *
     * @return the number of sessions the envelope was written to
     */
    public int publish(String topic, String type, Object payload) {
        return session.publish(Objects.requireNonNull(topic, "topic"), new Envelope(Objects.requireNonNull(type, "type"), payload));
    }

    /**
     * Closes the connection from the server side; the {@code close} hook runs once.
     */
    public void close(int code, String reason) {
        session.closeFromServer(code, reason);
    }

    public boolean isOpen() {
        return session.isOpen();
    }

    public CancellationSignal signal() {
        return session.signal();
    }

    public String endpointName() {
        return session.upgrade().endpointName();
    }

    @SuppressWarnings("unchecked")
    public <T> T data() {
        return (T) session.data();
    }

    @SuppressWarnings("unchecked")
    public <T> T params() {
        return (T) session.upgrade().params();
    }

    @SuppressWarnings("unchecked")
    public <T> T query() {
        return (T) session.upgrade().query();
    }

    @SuppressWarnings("unchecked")
    public <T> T headers() {
        return (T) session.upgrade().headers();
    }
}
