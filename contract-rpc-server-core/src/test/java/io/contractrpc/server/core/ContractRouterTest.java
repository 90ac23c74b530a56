package io.contractrpc.server.core;

import io.contractrpc.core.Contract;
import io.contractrpc.core.HttpMethod;
import io.contractrpc.core.Issue;
import io.contractrpc.core.MessageEndpoint;
import io.contractrpc.core.PushEventEndpoint;
import io.contractrpc.core.RequestValidationException;
import io.contractrpc.core.Schema;
import io.contractrpc.core.StandardEndpoint;
import io.contractrpc.json.jackson.JacksonJsonCodec;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.server.core.message.MessageHandlers;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static io.contractrpc.server.core.TestRequests.firstHeader;
import static io.contractrpc.server.core.TestRequests.headers;
import static io.contractrpc.server.core.TestRequests.readBodyBytes;
import static io.contractrpc.server.core.TestRequests.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContractRouterTest {

    private final JsonCodec json = new JacksonJsonCodec();

    private final StandardEndpoint createUser = StandardEndpoint.builder("createUser", HttpMethod.POST, "/users")
            .body(TestSchemas.object("name", "email"))
            .response(201, TestSchemas.object("id"))
            .build();

    private final StandardEndpoint getPost = StandardEndpoint.builder("getPost", HttpMethod.GET, "/users/:id/posts/:postId")
            .response(200, TestSchemas.object("id", "postId"))
            .build();

    @Test
    void missingBodyFieldIsRejectedBeforeHandlerRuns() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(createUser).build())
                .standard("createUser", req -> {
                    calls.incrementAndGet();
                    return HandlerResponse.created(Map.of("id", 1));
                })
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("POST", "/users", headers("Content-Type", "application/json"), "{\"name\":\"Ada\"}"));

        assertThat(resp.status()).isEqualTo(400);
        Map<String, Object> body = jsonBody(resp);
        assertThat(body.get("error")).isEqualTo("Validation Error");
        assertThat(body.get("field")).isEqualTo("body");
        assertThat((List<?>) body.get("issues")).isNotEmpty();
        assertThat(calls).hasValue(0);
    }

    @Test
    void validRequestReachesHandlerAndResponseIsEncoded() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(createUser).build())
                .standard("createUser", req -> {
                    Map<String, Object> body = req.body();
                    return HandlerResponse.created(Map.of("id", 7, "name", body.get("name")));
                })
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("POST", "/users", headers("Content-Type", "application/json"),
                "{\"name\":\"Ada\",\"email\":\"ada@example.com\"}"));

        assertThat(resp.status()).isEqualTo(201);
        assertThat(firstHeader(resp, "Content-Type")).isEqualTo("application/json");
        assertThat(jsonBody(resp)).containsEntry("id", 7).containsEntry("name", "Ada");
    }

    @Test
    void pathParametersAreCapturedAndDecoded() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(getPost).build())
                .standard("getPost", req -> HandlerResponse.ok(req.params()))
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("GET", "/users/42/posts/a%20b", Map.of(), null));
        assertThat(resp.status()).isEqualTo(200);
        assertThat(jsonBody(resp)).isEqualTo(Map.of("id", "42", "postId", "a b"));

        ServerResponse missing = router.handle(request("GET", "/users/42", Map.of(), null));
        assertThat(missing.status()).isEqualTo(404);
        assertThat(jsonBody(missing)).containsEntry("error", "Not Found")
                .containsEntry("message", "Route not found: GET /users/42");
    }

    @Test
    void paramsSchemaCoercesValues() throws Exception {
        StandardEndpoint byId = StandardEndpoint.builder("byId", HttpMethod.GET, "/items/:id")
                .params(TestSchemas.intField("id"))
                .build();
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(byId).build())
                .standard("byId", req -> HandlerResponse.ok(Map.of("next", req.<Integer>params() + 1)))
                .jsonCodec(json)
                .build();

        assertThat(jsonBody(router.handle(request("GET", "/items/41", Map.of(), null)))).containsEntry("next", 42);

        ServerResponse bad = router.handle(request("GET", "/items/abc", Map.of(), null));
        assertThat(bad.status()).isEqualTo(400);
        assertThat(jsonBody(bad)).containsEntry("field", "params");
    }

    @Test
    void firstRegisteredEndpointHandlesSharedRoute() throws Exception {
        StandardEndpoint a = StandardEndpoint.builder("a", HttpMethod.GET, "/same").build();
        StandardEndpoint b = StandardEndpoint.builder("b", HttpMethod.GET, "/same").build();
        AtomicInteger aCalls = new AtomicInteger();
        AtomicInteger bCalls = new AtomicInteger();
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(a).endpoint(b).build())
                .standard("a", req -> {
                    aCalls.incrementAndGet();
                    return HandlerResponse.ok("a");
                })
                .standard("b", req -> {
                    bCalls.incrementAndGet();
                    return HandlerResponse.ok("b");
                })
                .jsonCodec(json)
                .build();

        router.handle(request("GET", "/same", Map.of(), null));
        router.handle(request("GET", "/same", Map.of(), null));

        assertThat(aCalls).hasValue(2);
        assertThat(bCalls).hasValue(0);
    }

    @Test
    void noContentNeverCarriesBody() {
        StandardEndpoint delete = StandardEndpoint.builder("delete", HttpMethod.DELETE, "/users/:id").build();
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(delete).build())
                .standard("delete", req -> HandlerResponse.of(204, Map.of("ignored", true)).withHeader("X-Deleted", "1"))
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("DELETE", "/users/1", Map.of(), null));
        assertThat(resp.status()).isEqualTo(204);
        assertThat(resp.body()).isInstanceOf(ResponseBody.Empty.class);
        assertThat(firstHeader(resp, "X-Deleted")).isEqualTo("1");
        assertThat(firstHeader(resp, "Content-Type")).isNull();
    }

    @Test
    void responseThatBreaksItsSchemaIsServerFault() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(getPost).build())
                .standard("getPost", req -> HandlerResponse.ok(Map.of("title", "no ids")))
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("GET", "/users/1/posts/2", Map.of(), null));
        assertThat(resp.status()).isEqualTo(500);
        assertThat(jsonBody(resp)).containsEntry("error", "Internal Server Error")
                .containsEntry("message", "Response contract violation for status 200");
    }

    @Test
    void undeclaredStatusIsNotValidated() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(getPost).build())
                .standard("getPost", req -> HandlerResponse.of(404, Map.of("reason", "gone")))
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("GET", "/users/1/posts/2", Map.of(), null));
        assertThat(resp.status()).isEqualTo(404);
        assertThat(jsonBody(resp)).containsEntry("reason", "gone");
    }

    @Test
    void handlerFailureBecomesGenericServerError() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(getPost).build())
                .standard("getPost", req -> {
                    throw new IllegalStateException("database down");
                })
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("GET", "/users/1/posts/2", Map.of(), null));
        assertThat(resp.status()).isEqualTo(500);
        assertThat(jsonBody(resp)).isEqualTo(Map.of("error", "Internal Server Error"));
    }

    @Test
    void malformedJsonBodyIsValidationError() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(createUser).build())
                .standard("createUser", req -> HandlerResponse.created(Map.of("id", 1)))
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("POST", "/users", headers("Content-Type", "application/json"), "{oops"));
        assertThat(resp.status()).isEqualTo(400);
        Map<String, Object> body = jsonBody(resp);
        assertThat(body.get("field")).isEqualTo("body");
        assertThat(((Map<?, ?>) ((List<?>) body.get("issues")).get(0)).get("code")).isEqualTo("invalid_json");
    }

    @Test
    void malformedFormBodyIsValidationError() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(createUser).build())
                .standard("createUser", req -> {
                    calls.incrementAndGet();
                    return HandlerResponse.created(Map.of("id", 1));
                })
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("POST", "/users",
                headers("Content-Type", "application/x-www-form-urlencoded"), "name=%zz&email=x"));
        assertThat(resp.status()).isEqualTo(400);
        Map<String, Object> body = jsonBody(resp);
        assertThat(body.get("field")).isEqualTo("body");
        assertThat(((Map<?, ?>) ((List<?>) body.get("issues")).get(0)).get("code")).isEqualTo("invalid_form");
        assertThat(calls).hasValue(0);
    }

    @Test
    void rejectedPushEventUpgradeIsValidationError() throws Exception {
        AtomicInteger opened = new AtomicInteger();
        PushEventEndpoint feed = PushEventEndpoint.builder("feed", "/feed")
                .query(TestSchemas.object("topic"))
                .event("item", Schema.any())
                .build();
        try (ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(feed).build())
                .pushEvents("feed", (req, emitter, signal) -> {
                    opened.incrementAndGet();
                    return null;
                })
                .jsonCodec(json)
                .build()) {

            ServerResponse resp = router.handle(request("GET", "/feed", Map.of(), null));
            assertThat(resp.status()).isEqualTo(400);
            assertThat(jsonBody(resp)).containsEntry("field", "query");
            assertThat(opened).hasValue(0);
        }
    }

    @Test
    void rejectEncodesAdapterValidationFailures() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(getPost).build())
                .standard("getPost", req -> HandlerResponse.ok(req.params()))
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.reject(new RequestValidationException(RequestValidationException.QUERY,
                List.of(new Issue("invalid_query", List.of(), "Query string is not validly encoded"))));
        assertThat(resp.status()).isEqualTo(400);
        assertThat(jsonBody(resp)).containsEntry("error", "Validation Error").containsEntry("field", "query");
    }

    @Test
    void oversizedBodyIsRejected() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(createUser).build())
                .standard("createUser", req -> HandlerResponse.created(Map.of("id", 1)))
                .jsonCodec(json)
                .maxBodySize(16)
                .build();

        ServerResponse resp = router.handle(request("POST", "/users", headers("Content-Type", "application/json"),
                "{\"name\":\"a very long name\",\"email\":\"x\"}"));
        assertThat(resp.status()).isEqualTo(413);
        assertThat(jsonBody(resp)).containsEntry("error", "Payload Too Large");
    }

    @Test
    void queryAndHeadersAreValidatedWhenDeclared() throws Exception {
        Schema<Map<String, Object>> auth = TestSchemas.object("authorization");
        StandardEndpoint search = StandardEndpoint.builder("search", HttpMethod.GET, "/search")
                .query(TestSchemas.object("q"))
                .headers(auth)
                .build();
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(search).build())
                .standard("search", req -> {
                    Map<String, Object> query = req.query();
                    Map<String, Object> headers = req.headers();
                    return HandlerResponse.ok(Map.of("q", query.get("q"), "tags", query.get("tag"), "auth", headers.get("authorization")));
                })
                .jsonCodec(json)
                .build();

        ServerResponse noQuery = router.handle(request("GET", "/search", headers("Authorization", "t"), null));
        assertThat(jsonBody(noQuery)).containsEntry("field", "query");

        ServerResponse noHeader = router.handle(request("GET", "/search?q=x", Map.of(), null));
        assertThat(jsonBody(noHeader)).containsEntry("field", "headers");

        ServerResponse ok = router.handle(request("GET", "/search?q=x&tag=a&tag=b", headers("Authorization", "t"), null));
        assertThat(jsonBody(ok)).containsEntry("q", "x").containsEntry("tags", List.of("a", "b")).containsEntry("auth", "t");
    }

    @Test
    void basePathIsStrippedBeforeMatching() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(getPost).build())
                .standard("getPost", req -> HandlerResponse.ok(req.params()))
                .basePath("/api/v1/")
                .jsonCodec(json)
                .build();

        assertThat(router.handle(request("GET", "/api/v1/users/1/posts/2", Map.of(), null)).status()).isEqualTo(200);
        assertThat(router.handle(request("GET", "/users/1/posts/2", Map.of(), null)).status()).isEqualTo(404);
    }

    @Test
    void contextFactoryResultReachesHandler() throws Exception {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(getPost).build())
                .standard("getPost", req -> HandlerResponse.ok(Map.of("id", "1", "postId", "2", "user", req.context())))
                .contextFactory((request, name, endpoint) -> name + ":" + request.headers().get("X-User").get(0))
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("GET", "/users/1/posts/2", headers("X-User", "ada"), null));
        assertThat(jsonBody(resp)).containsEntry("user", "getPost:ada");
    }

    @Test
    void textResponsesKeepTheirContentType() {
        StandardEndpoint text = StandardEndpoint.builder("text", HttpMethod.GET, "/text").build();
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(text).build())
                .standard("text", req -> HandlerResponse.ok("plain words").withHeader("Content-Type", "text/plain; charset=utf-8"))
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("GET", "/text", Map.of(), null));
        assertThat(firstHeader(resp, "Content-Type")).isEqualTo("text/plain; charset=utf-8");
        assertThat(new String(readBodyBytes(resp.body()), StandardCharsets.UTF_8)).isEqualTo("plain words");
    }

    @Test
    void messageEndpointOverPlainHttpRequiresUpgrade() throws Exception {
        MessageEndpoint chat = MessageEndpoint.builder("chat", "/chat").build();
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(chat).build())
                .messages("chat", MessageHandlers.builder().build())
                .jsonCodec(json)
                .build();

        ServerResponse resp = router.handle(request("GET", "/chat", Map.of(), null));
        assertThat(resp.status()).isEqualTo(426);
        assertThat(jsonBody(resp)).containsEntry("error", "Upgrade Required");
    }

    @Test
    void unknownMethodIsNotFound() {
        ContractRouter router = ContractRouter.builder(Contract.builder().endpoint(getPost).build())
                .standard("getPost", req -> HandlerResponse.ok(req.params()))
                .jsonCodec(json)
                .build();

        assertThat(router.handle(request("TRACE", "/users/1/posts/2", Map.of(), null)).status()).isEqualTo(404);
    }

    @Test
    void builderRejectsUnboundAndMismatchedEndpoints() {
        Contract contract = Contract.builder()
                .endpoint(getPost)
                .endpoint(PushEventEndpoint.builder("logs", "/logs").build())
                .build();

        assertThatThrownBy(() -> ContractRouter.builder(contract).standard("logs", req -> HandlerResponse.noContent()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("PUSH_EVENT");
        assertThatThrownBy(() -> ContractRouter.builder(contract).standard("missing", req -> HandlerResponse.noContent()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ContractRouter.builder(contract)
                .standard("getPost", req -> HandlerResponse.noContent())
                .jsonCodec(json)
                .build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("logs");
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> jsonBody(ServerResponse resp) throws Exception {
        return (Map<String, Object>) json.readTree(readBodyBytes(resp.body()));
    }
}
