package io.contractrpc.client;

import io.contractrpc.core.ContractRpcException;

/**
 * The server answered with a non-2xx status that the endpoint does not declare.
 */
public final class HttpStatusException extends ContractRpcException {

    private final int status;
    private final transient Object body;

    public HttpStatusException(int status, Object body) {
        super("HTTP Error " + status);
        this.status = status;
        this.body = body;
    }

    public int status() {
        return status;
    }

    /**
     * @return the decoded response body: a JSON tree, a string, or an empty map
     */
    public Object body() {
        return body;
    }
}
