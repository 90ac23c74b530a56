package io.contractrpc.client;

import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reads one streaming response on a daemon thread and republishes its items.
 *
 * <p>The request is sent when the first subscriber arrives, so no item is produced before anyone listens.
 * A subscriber that cancels is noticed at the next item; the response body is then closed, which the
 * server observes as a disconnect.
 */
abstract class StreamLoop<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamLoop.class);

    private final String threadName;

    StreamLoop(String threadName) {
        this.threadName = threadName;
    }

    Flow.Publisher<T> publisher() {
        SubmissionPublisher<T> pub = new SubmissionPublisher<>();
        AtomicBoolean started = new AtomicBoolean();
        return subscriber -> {
            pub.subscribe(subscriber);
            if (started.compareAndSet(false, true)) {
                Thread t = new Thread(() -> run(pub), threadName);
                t.setDaemon(true);
                t.start();
            }
        };
    }

    abstract void run(SubmissionPublisher<T> pub);

    static boolean abandoned(SubmissionPublisher<?> pub) {
        return pub.isClosed() || pub.getNumberOfSubscribers() == 0;
    }

    /**
     * Builds the failure for a non-200 streaming response and releases its body.
     */
    static HttpStatusException statusFailure(TransportResponse<InputStream> resp, JsonCodec json) throws IOException {
        byte[] bytes;
        try (InputStream in = resp.body()) {
            bytes = in == null ? new byte[0] : in.readAllBytes();
        }
        Object body;
        try {
            body = ResponseBodies.decode(resp.status(), resp.headers(), bytes, json);
        } catch (JsonException e) {
            LOGGER.debug("Body of status {} is not valid JSON", resp.status(), e);
            body = new String(bytes, StandardCharsets.UTF_8);
        }
        return new HttpStatusException(resp.status(), body);
    }
}
