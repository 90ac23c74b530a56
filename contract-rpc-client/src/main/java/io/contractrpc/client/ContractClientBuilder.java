package io.contractrpc.client;

import io.contractrpc.core.BasePath;
import io.contractrpc.core.Contract;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonCodecs;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class ContractClientBuilder {
    private final Contract contract;
    private String baseUrl;
    private BasePath basePath = BasePath.root();
    private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
    private boolean validateRequest = true;
    private boolean validateResponse = true;
    private ClientTransport transport;
    private HttpClient httpClient;
    private JsonCodec json;
    private Duration callTimeout;

    ContractClientBuilder(Contract contract) {
        this.contract = Objects.requireNonNull(contract, "contract");
    }

    /**
     * Origin of the server, e.g. {@code http://localhost:8080}. Message endpoints connect to the matching
     * {@code ws://} or {@code wss://} URL.
     */
    public ContractClientBuilder baseUrl(String baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        return this;
    }

    public ContractClientBuilder basePath(String basePath) {
        this.basePath = BasePath.of(basePath);
        return this;
    }

    public ContractClientBuilder defaultHeader(String name, String value) {
        defaultHeaders.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(value, "value"));
        return this;
    }

    public ContractClientBuilder defaultHeaders(Map<String, String> headers) {
        headers.forEach(this::defaultHeader);
        return this;
    }

    /** Validate params, query, headers and body before sending. Default: {@code true}. */
    public ContractClientBuilder validateRequest(boolean validateRequest) {
        this.validateRequest = validateRequest;
        return this;
    }

    /** Validate responses, events, chunks and server messages after receiving. Default: {@code true}. */
    public ContractClientBuilder validateResponse(boolean validateResponse) {
        this.validateResponse = validateResponse;
        return this;
    }

    public ContractClientBuilder transport(ClientTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return this;
    }

    /**
     * Uses {@code httpClient} for HTTP calls and WebSocket connections.
     */
    public ContractClientBuilder jdkHttpClient(HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.transport = new JdkHttpTransport(httpClient);
        return this;
    }

    /**
     * Upper bound for buffered calls. Push-event and chunked-stream subscriptions are not bounded.
     * Default: none.
     */
    public ContractClientBuilder callTimeout(Duration callTimeout) {
        if (callTimeout != null && (callTimeout.isNegative() || callTimeout.isZero())) {
            throw new IllegalArgumentException("callTimeout must be positive");
        }
        this.callTimeout = callTimeout;
        return this;
    }

    public ContractClientBuilder jsonCodec(JsonCodec json) {
        this.json = Objects.requireNonNull(json, "json");
        return this;
    }

    /**
     * @throws IllegalStateException if no base URL was set
     */
    public ContractClient build() {
        if (baseUrl == null) {
            throw new IllegalStateException("baseUrl is required");
        }
        HttpClient resolvedHttp = httpClient;
        ClientTransport resolved = transport;
        if (resolved == null) {
            resolvedHttp = HttpClient.newHttpClient();
            resolved = new JdkHttpTransport(resolvedHttp);
        } else if (resolvedHttp == null && resolved instanceof JdkHttpTransport jdk) {
            resolvedHttp = jdk.httpClient();
        }
        JsonCodec resolvedJson = json != null ? json : JsonCodecs.discover();
        RequestFactory requests = new RequestFactory(baseUrl, basePath, defaultHeaders, validateRequest, resolvedJson, callTimeout);
        return new JdkContractClient(contract, resolved, resolvedHttp, requests, resolvedJson, validateRequest, validateResponse);
    }
}
