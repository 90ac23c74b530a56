package io.contractrpc.client;

import io.contractrpc.core.ContractRpcException;
import io.contractrpc.core.Issue;

import java.util.List;
import java.util.Objects;

/**
 * Client-side schema failure: a request part before sending, or a response, event, chunk or message after
 * receiving.
 */
public final class ClientValidationException extends ContractRpcException {

    private final String field;
    private final List<Issue> issues;

    public ClientValidationException(String field, List<Issue> issues) {
        super("Validation failed for " + field);
        this.field = Objects.requireNonNull(field, "field");
        this.issues = List.copyOf(issues);
    }

    /**
     * @return {@code params}, {@code query}, {@code headers}, {@code body}, {@code response[<status>]},
     *         {@code event[<name>]}, {@code chunk}, {@code final} or {@code message[<type>]}
     */
    public String field() {
        return field;
    }

    public List<Issue> issues() {
        return issues;
    }
}
