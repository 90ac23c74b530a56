/**
 * Framework-neutral server side of the contract engine.
 *
 * <p>{@link io.contractrpc.server.core.ContractRouter} turns a {@link io.contractrpc.server.core.ServerRequest}
 * into a {@link io.contractrpc.server.core.ServerResponse}. Streaming responses are exposed as
 * {@link java.util.concurrent.Flow.Publisher}s so any HTTP server can drive them; see the servlet module for one
 * adapter.
 */
package io.contractrpc.server.core;
