package io.contractrpc.core;

/**
 * One named entry of a {@link Contract}.
 *
 * <p>The four transport kinds form a closed set; dispatch code switches on {@link #kind()} and the
 * compiler flags any kind it forgets to handle.
 *
 * <p>Schema accessors return {@code null} when the endpoint declares no schema for that part.
 */
public sealed interface EndpointDefinition
        permits StandardEndpoint, PushEventEndpoint, ChunkedStreamEndpoint, MessageEndpoint {

    String name();

    TransportKind kind();

    HttpMethod method();

    PathPattern path();

    Schema<?> params();

    Schema<?> query();

    Schema<?> headers();
}
