package io.contractrpc.client;

import io.contractrpc.core.ChunkFrame;
import io.contractrpc.core.ChunkedStreamEndpoint;
import io.contractrpc.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.SubmissionPublisher;

/**
 * Internal implementation of chunked-stream consumption.
 *
 * <p>Reads one JSON frame per line. The publisher completes right after the terminal frame; a body that ends
 * without one fails the publisher, since the server abandoned the stream.
 */
final class ChunkStreamLoop extends StreamLoop<StreamChunk> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkStreamLoop.class);

    private final ClientTransport transport;
    private final TransportRequest request;
    private final ChunkedStreamEndpoint endpoint;
    private final JsonCodec json;
    private final boolean validate;

    ChunkStreamLoop(ClientTransport transport, TransportRequest request, ChunkedStreamEndpoint endpoint, JsonCodec json, boolean validate) {
        super("contract-rpc-chunks-" + endpoint.name());
        this.transport = transport;
        this.request = request;
        this.endpoint = endpoint;
        this.json = json;
        this.validate = validate;
    }

    @Override
    void run(SubmissionPublisher<StreamChunk> pub) {
        try {
            TransportResponse<InputStream> resp = transport.sendStream(request);
            if (resp.status() != 200) {
                pub.closeExceptionally(statusFailure(resp, json));
                return;
            }

            try (BufferedReader reader = new BufferedReader(new InputStreamReader(resp.body(), StandardCharsets.UTF_8))) {
                String line;
                while (!abandoned(pub) && (line = reader.readLine()) != null) {
                    if (line.isBlank()) continue;
                    ChunkFrame frame = ChunkFrame.fromTree(json.readTree(line));
                    if (frame.terminal()) {
                        Object value = frame.value();
                        if (validate && value != null && endpoint.finalResponse() != null) {
                            value = Validation.check("final", endpoint.finalResponse(), value);
                        }
                        pub.submit(new StreamChunk.Final(value));
                        LOGGER.debug("Chunked stream {} finished", endpoint.name());
                        pub.close();
                        return;
                    }
                    Object value = frame.value();
                    if (validate && endpoint.chunk() != null) {
                        value = Validation.check("chunk", endpoint.chunk(), value);
                    }
                    pub.submit(new StreamChunk.Data(value));
                }
            }
            if (!abandoned(pub)) {
                pub.closeExceptionally(new IOException("Chunked stream " + endpoint.name() + " ended without a terminal frame"));
            }
        } catch (Exception e) {
            pub.closeExceptionally(e);
        }
    }
}
