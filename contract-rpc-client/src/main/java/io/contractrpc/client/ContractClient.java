package io.contractrpc.client;

import io.contractrpc.core.Contract;

import java.util.concurrent.Flow;

/**
 * Calls the endpoints of a {@link Contract} by name.
 *
 * <pre>{@code
 * ContractClient client = ContractClient.builder(contract)
 *     .baseUrl("http://localhost:8080")
 *     .basePath("/api")
 *     .build();
 *
 * EndpointResponse created = client.call("createUser", RequestOptions.builder()
 *     .body(Map.of("name", "Ada", "email", "ada@example.com"))
 *     .build());
 * }</pre>
 */
public interface ContractClient {

    /**
     * Sends one request to a standard endpoint.
     *
     * @throws ClientValidationException if a request part or the response fails its schema
     * @throws HttpStatusException for a non-2xx status the endpoint does not declare
     * @throws IllegalArgumentException if {@code endpoint} is not a standard endpoint of the contract
     */
    EndpointResponse call(String endpoint, RequestOptions options) throws Exception;

    default EndpointResponse call(String endpoint) throws Exception {
        return call(endpoint, RequestOptions.none());
    }

    /**
     * Opens a push-event endpoint when the returned publisher is first subscribed to.
     *
     * @throws ClientValidationException if a request part fails its schema
     */
    Flow.Publisher<ServerEvent> subscribeEvents(String endpoint, RequestOptions options);

    /**
     * Opens a chunked-stream endpoint when the returned publisher is first subscribed to.
     *
     * @throws ClientValidationException if a request part fails its schema
     */
    Flow.Publisher<StreamChunk> subscribeChunks(String endpoint, RequestOptions options);

    /**
     * Creates an unconnected socket for a message endpoint; call {@link TypedWebSocket#connect()} to open it.
     *
     * @throws ClientValidationException if a request part fails its schema
     */
    TypedWebSocket webSocket(String endpoint, RequestOptions options);

    Contract contract();

    static ContractClientBuilder builder(Contract contract) {
        return new ContractClientBuilder(contract);
    }
}
