package io.contractrpc.core;

import java.util.List;
import java.util.Objects;

/**
 * An inbound envelope had an unknown type or a payload its schema rejected.
 *
 * <p>The session stays open; the failure goes to the endpoint's validation hook or is answered with the
 * reserved {@code error} envelope.
 */
public final class MessageValidationException extends ContractRpcException {
    private final String messageType;
    private final List<Issue> issues;

    public MessageValidationException(String messageType, List<Issue> issues) {
        super("Validation failed for message type: " + messageType);
        this.messageType = Objects.requireNonNull(messageType, "messageType");
        this.issues = List.copyOf(issues);
    }

    public String messageType() {
        return messageType;
    }

    public List<Issue> issues() {
        return issues;
    }
}
