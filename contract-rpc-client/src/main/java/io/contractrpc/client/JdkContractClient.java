package io.contractrpc.client;

import io.contractrpc.core.ChunkedStreamEndpoint;
import io.contractrpc.core.Contract;
import io.contractrpc.core.EndpointDefinition;
import io.contractrpc.core.MessageEndpoint;
import io.contractrpc.core.Protocol;
import io.contractrpc.core.PushEventEndpoint;
import io.contractrpc.core.Schema;
import io.contractrpc.core.StandardEndpoint;
import io.contractrpc.core.Urls;
import io.contractrpc.json.spi.JsonCodec;

import java.net.http.HttpClient;
import java.util.Objects;
import java.util.concurrent.Flow;

/**
 * {@link ContractClient} over a {@link ClientTransport}, with WebSocket support from the JDK {@link HttpClient}.
 */
public final class JdkContractClient implements ContractClient {

    private final Contract contract;
    private final ClientTransport transport;
    private final HttpClient http;
    private final RequestFactory requests;
    private final JsonCodec json;
    private final boolean validateRequest;
    private final boolean validateResponse;

    JdkContractClient(Contract contract, ClientTransport transport, HttpClient http, RequestFactory requests,
                      JsonCodec json, boolean validateRequest, boolean validateResponse) {
        this.contract = contract;
        this.transport = Objects.requireNonNull(transport, "transport");
        this.http = http;
        this.requests = requests;
        this.json = json;
        this.validateRequest = validateRequest;
        this.validateResponse = validateResponse;
    }

    @Override
    public EndpointResponse call(String name, RequestOptions options) throws Exception {
        StandardEndpoint endpoint = endpoint(name, StandardEndpoint.class);
        TransportRequest req = requests.call(endpoint, options);
        TransportResponse<byte[]> resp = transport.sendBytes(req);

        int status = resp.status();
        Object data = ResponseBodies.decode(status, resp.headers(), resp.body(), json);
        boolean ok = status >= 200 && status < 300;
        if (!ok && !endpoint.responses().containsKey(status)) {
            throw new HttpStatusException(status, data);
        }
        Schema<?> schema = endpoint.responses().get(status);
        if (validateResponse && schema != null && status != Protocol.STATUS_NO_CONTENT) {
            data = Validation.check("response[" + status + "]", schema, data);
        }
        return new EndpointResponse(status, resp.headers(), data);
    }

    @Override
    public Flow.Publisher<ServerEvent> subscribeEvents(String name, RequestOptions options) {
        PushEventEndpoint endpoint = endpoint(name, PushEventEndpoint.class);
        TransportRequest req = requests.build(endpoint, null, options, Protocol.CT_EVENT_STREAM);
        return new EventStreamLoop(transport, req, endpoint, json, validateResponse).publisher();
    }

    @Override
    public Flow.Publisher<StreamChunk> subscribeChunks(String name, RequestOptions options) {
        ChunkedStreamEndpoint endpoint = endpoint(name, ChunkedStreamEndpoint.class);
        TransportRequest req = requests.build(endpoint, endpoint.body(), options, Protocol.CT_NDJSON);
        return new ChunkStreamLoop(transport, req, endpoint, json, validateResponse).publisher();
    }

    @Override
    public TypedWebSocket webSocket(String name, RequestOptions options) {
        MessageEndpoint endpoint = endpoint(name, MessageEndpoint.class);
        HttpClient client = http != null ? http : HttpClient.newHttpClient();
        return new TypedWebSocket(
                client,
                requests.url(Urls.toWebSocketBase(requests.baseUrl()), endpoint, options),
                requests.upgradeHeaders(endpoint, options),
                endpoint,
                json,
                validateRequest,
                validateResponse);
    }

    @Override
    public Contract contract() {
        return contract;
    }

    private <E extends EndpointDefinition> E endpoint(String name, Class<E> type) {
        EndpointDefinition e = contract.endpoint(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown endpoint: " + name));
        if (!type.isInstance(e)) {
            throw new IllegalArgumentException("Endpoint " + name + " is " + e.kind() + ", not " + type.getSimpleName());
        }
        return type.cast(e);
    }
}
