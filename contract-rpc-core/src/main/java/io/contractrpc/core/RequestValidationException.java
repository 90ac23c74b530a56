package io.contractrpc.core;

import java.util.List;
import java.util.Objects;

/**
 * A request part failed its schema. Raised before any handler runs.
 */
public final class RequestValidationException extends ContractRpcException {

    public static final String PARAMS = "params";
    public static final String QUERY = "query";
    public static final String HEADERS = "headers";
    public static final String BODY = "body";
    public static final String DATA = "data";

    private final String field;
    private final List<Issue> issues;

    public RequestValidationException(String field, List<Issue> issues) {
        super("Validation failed for " + field);
        this.field = Objects.requireNonNull(field, "field");
        this.issues = List.copyOf(issues);
    }

    /**
     * @return one of {@code params}, {@code query}, {@code headers}, {@code body} (or {@code data} for
     *         message-session context)
     */
    public String field() {
        return field;
    }

    public List<Issue> issues() {
        return issues;
    }
}
