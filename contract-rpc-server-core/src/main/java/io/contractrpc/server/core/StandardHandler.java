package io.contractrpc.server.core;

/**
 * Handler for a request/response endpoint. Only ever sees requests that passed validation.
 */
@FunctionalInterface
public interface StandardHandler {

    HandlerResponse handle(ValidatedRequest request) throws Exception;
}
