package io.contractrpc.server.core;

import io.contractrpc.core.ChunkedStreamEndpoint;
import io.contractrpc.core.Contract;
import io.contractrpc.core.HttpMethod;
import io.contractrpc.core.PushEventEndpoint;
import io.contractrpc.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static io.contractrpc.server.core.TestRequests.firstHeader;
import static io.contractrpc.server.core.TestRequests.headers;
import static io.contractrpc.server.core.TestRequests.request;
import static org.assertj.core.api.Assertions.assertThat;

class ContractRouterStreamingTest {

    private final PushEventEndpoint logs = PushEventEndpoint.builder("logs", "/jobs/:id/logs")
            .event("log", TestSchemas.object("line"))
            .build();

    private final ChunkedStreamEndpoint generate = ChunkedStreamEndpoint.builder("generate", HttpMethod.POST, "/generate")
            .body(TestSchemas.object("prompt"))
            .chunk(TestSchemas.object("text"))
            .build();

    private final ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(logs).endpoint(generate).build())
            .pushEvents("logs", (req, emitter, signal) -> {
                Map<String, String> params = req.params();
                emitter.send("log", Map.of("line", "job " + params.get("id") + " started"));
                emitter.close();
                return null;
            })
            .chunkedStream("generate", (req, stream) -> {
                Map<String, Object> body = req.body();
                for (String word : String.valueOf(body.get("prompt")).split(" ")) {
                    stream.send(Map.of("text", word));
                }
                stream.close(Map.of("words", 2));
            })
            .executor(Runnable::run)
            .jsonCodec(new JacksonJsonCodec())
            .build();

    @Test
    void pushEventRouteAnswersWithEventStream() throws Exception {
        ServerResponse resp = router.handle(request("GET", "/jobs/42/logs", headers(), null));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(firstHeader(resp, "Content-Type")).isEqualTo("text/event-stream");
        assertThat(firstHeader(resp, "Cache-Control")).isEqualTo("no-cache");
        assertThat(firstHeader(resp, "Connection")).isEqualTo("keep-alive");
        assertThat(resp.body()).isInstanceOf(ResponseBody.Sse.class);

        TestSubscriber<SseFrame> client = new TestSubscriber<>();
        ((ResponseBody.Sse) resp.body()).publisher().subscribe(client);
        assertThat(client.awaitTermination()).isTrue();
        assertThat(client.items()).containsExactly(new SseFrame("log", "{\"line\":\"job 42 started\"}"));
    }

    @Test
    void chunkedRouteAnswersWithNdjson() throws Exception {
        ServerResponse resp = router.handle(request("POST", "/generate",
                headers("Content-Type", "application/json"), "{\"prompt\":\"hello world\"}"));

        assertThat(resp.status()).isEqualTo(200);
        assertThat(firstHeader(resp, "Content-Type")).isEqualTo("application/x-ndjson");
        assertThat(firstHeader(resp, "Cache-Control")).isEqualTo("no-cache");

        TestSubscriber<String> client = new TestSubscriber<>();
        ((ResponseBody.Ndjson) resp.body()).publisher().subscribe(client);
        assertThat(client.awaitTermination()).isTrue();
        assertThat(client.items()).containsExactly(
                "{\"kind\":\"chunk\",\"value\":{\"text\":\"hello\"}}",
                "{\"kind\":\"chunk\",\"value\":{\"text\":\"world\"}}",
                "{\"kind\":\"final\",\"value\":{\"words\":2}}");
    }

    @Test
    void invalidChunkedBodyIsRejectedBeforeStreaming() {
        ServerResponse resp = router.handle(request("POST", "/generate",
                headers("Content-Type", "application/json"), "{\"temperature\":1}"));

        assertThat(resp.status()).isEqualTo(400);
        assertThat(resp.body()).isInstanceOf(ResponseBody.Bytes.class);
    }
}
