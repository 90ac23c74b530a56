package io.contractrpc.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link ClientTransport} on {@link java.net.http.HttpClient}, the client's default.
 *
 * <p>Headers the JDK client manages itself ({@code Connection}, {@code Content-Length}, {@code Host},
 * {@code Upgrade}, {@code Expect}) are dropped from outgoing requests instead of failing the call.
 */
public final class JdkHttpTransport implements ClientTransport {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpTransport.class);
    private static final Set<String> MANAGED_HEADERS = Set.of("connection", "content-length", "host", "upgrade", "expect");

    private final HttpClient http;

    public JdkHttpTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    HttpClient httpClient() {
        return http;
    }

    @Override
    public TransportResponse<byte[]> sendBytes(TransportRequest request) throws Exception {
        HttpResponse<byte[]> resp = http.send(toHttpRequest(request), HttpResponse.BodyHandlers.ofByteArray());
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(), resp.body() != null ? resp.body() : new byte[0]);
    }

    @Override
    public TransportResponse<InputStream> sendStream(TransportRequest request) throws Exception {
        HttpResponse<InputStream> resp = http.send(toHttpRequest(request), HttpResponse.BodyHandlers.ofInputStream());
        return new TransportResponse<>(resp.statusCode(), resp.headers().map(), resp.body());
    }

    private static HttpRequest toHttpRequest(TransportRequest request) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .method(request.method(), request.body() != null
                        ? HttpRequest.BodyPublishers.ofByteArray(request.body())
                        : HttpRequest.BodyPublishers.noBody());
        if (request.timeout() != null) builder.timeout(request.timeout());

        for (Map.Entry<String, List<String>> header : request.headers().entrySet()) {
            String name = header.getKey();
            if (MANAGED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                LOGGER.debug("Dropping header {} managed by the HTTP client", name);
                continue;
            }
            for (String value : header.getValue()) {
                if (value != null) builder.header(name, value);
            }
        }
        return builder.build();
    }
}
