package io.contractrpc.core;

/**
 * Base class for dispatch failures.
 *
 * <p>Each subclass maps to one entry of the error taxonomy; transport disconnects are not exceptions
 * but connection state transitions.
 */
public abstract class ContractRpcException extends RuntimeException {

    protected ContractRpcException(String message) {
        super(message);
    }

    protected ContractRpcException(String message, Throwable cause) {
        super(message, cause);
    }
}
