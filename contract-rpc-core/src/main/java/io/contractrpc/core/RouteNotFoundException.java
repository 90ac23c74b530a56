package io.contractrpc.core;

/**
 * No endpoint matches the request method and path. Terminal for the request.
 */
public final class RouteNotFoundException extends ContractRpcException {
    private final String method;
    private final String path;

    public RouteNotFoundException(String method, String path) {
        super("Route not found: " + method + " " + path);
        this.method = method;
        this.path = path;
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }
}
