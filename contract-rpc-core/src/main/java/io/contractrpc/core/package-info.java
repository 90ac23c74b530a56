/**
 * Contract model shared by servers and clients.
 *
 * <p>This module is deliberately framework-neutral. It contains only:
 * <ul>
 *   <li>The contract: endpoint definitions, compiled path patterns and the opaque {@link io.contractrpc.core.Schema} capability</li>
 *   <li>Wire units of the streaming transports (envelopes, chunk frames) and an SSE parser</li>
 *   <li>The error taxonomy and small URL/header/query helpers</li>
 * </ul>
 *
 * <p>HTTP client/server bindings and JSON support live in other modules.
 */
package io.contractrpc.core;
