package io.contractrpc.core;

import java.util.List;

/**
 * A handler produced a body that disagrees with its own declared response schema.
 *
 * <p>This is a programming error on the server, never the caller's fault.
 */
public final class ResponseContractViolationException extends ContractRpcException {
    private final int status;
    private final List<Issue> issues;

    public ResponseContractViolationException(int status, List<Issue> issues) {
        super("Response contract violation for status " + status);
        this.status = status;
        this.issues = List.copyOf(issues);
    }

    public int status() {
        return status;
    }

    public List<Issue> issues() {
        return issues;
    }
}
