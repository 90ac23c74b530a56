package io.contractrpc.client;

import io.contractrpc.core.PushEventEndpoint;
import io.contractrpc.core.Schema;
import io.contractrpc.core.SseParser;
import io.contractrpc.json.spi.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.concurrent.SubmissionPublisher;

/**
 * Internal implementation of push-event consumption.
 *
 * <p>Each {@code event:}/{@code data:} block becomes one {@link ServerEvent}. The publisher completes when
 * the server ends the stream.
 */
final class EventStreamLoop extends StreamLoop<ServerEvent> {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventStreamLoop.class);

    private final ClientTransport transport;
    private final TransportRequest request;
    private final PushEventEndpoint endpoint;
    private final JsonCodec json;
    private final boolean validate;

    EventStreamLoop(ClientTransport transport, TransportRequest request, PushEventEndpoint endpoint, JsonCodec json, boolean validate) {
        super("contract-rpc-events-" + endpoint.name());
        this.transport = transport;
        this.request = request;
        this.endpoint = endpoint;
        this.json = json;
        this.validate = validate;
    }

    @Override
    void run(SubmissionPublisher<ServerEvent> pub) {
        try {
            TransportResponse<InputStream> resp = transport.sendStream(request);
            if (resp.status() != 200) {
                pub.closeExceptionally(statusFailure(resp, json));
                return;
            }

            try (SseParser parser = new SseParser(resp.body())) {
                SseParser.Event ev;
                while (!abandoned(pub) && (ev = parser.next()) != null) {
                    Object data = json.readTree(ev.data());
                    Schema<?> schema = endpoint.events().get(ev.name());
                    if (validate && schema != null) {
                        data = Validation.check("event[" + ev.name() + "]", schema, data);
                    }
                    pub.submit(new ServerEvent(ev.name(), data));
                }
            }
            LOGGER.debug("Event stream {} ended", endpoint.name());
            pub.close();
        } catch (Exception e) {
            pub.closeExceptionally(e);
        }
    }
}
