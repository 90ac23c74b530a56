package io.contractrpc.server.core.message;

import io.contractrpc.core.Contract;
import io.contractrpc.core.Envelope;
import io.contractrpc.core.MessageEndpoint;
import io.contractrpc.core.MessageValidationException;
import io.contractrpc.core.RequestValidationException;
import io.contractrpc.json.jackson.JacksonJsonCodec;
import io.contractrpc.json.spi.JsonCodec;
import io.contractrpc.server.core.ContractRouter;
import io.contractrpc.server.core.ServerResponse;
import io.contractrpc.server.core.TestSchemas;
import io.contractrpc.server.core.transport.ConnectionState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static io.contractrpc.server.core.TestRequests.headers;
import static io.contractrpc.server.core.TestRequests.readBodyBytes;
import static io.contractrpc.server.core.TestRequests.request;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MessageRouterTest {

    private final JsonCodec json = new JacksonJsonCodec();

    private final MessageEndpoint chat = MessageEndpoint.builder("chat", "/rooms/:room")
            .query(TestSchemas.object("user"))
            .clientMessage("say", TestSchemas.object("text"))
            .serverMessage("said", TestSchemas.object("user", "text"))
            .build();

    private final Contract contract = Contract.builder().endpoint(chat).build();

    @Test
    void upgradeToUnknownPathIsNotFound() throws Exception {
        MessageRouter router = router(MessageHandlers.builder().build());

        UpgradeOutcome outcome = router.upgrade(request("GET", "/elsewhere", headers(), null));

        assertThat(outcome).isInstanceOf(UpgradeOutcome.Rejected.class);
        ServerResponse resp = ((UpgradeOutcome.Rejected) outcome).response();
        assertThat(resp.status()).isEqualTo(404);
        assertThat(body(resp)).containsEntry("error", "Not Found");
    }

    @Test
    void upgradeWithInvalidQueryIsRejected() throws Exception {
        MessageRouter router = router(MessageHandlers.builder().build());

        UpgradeOutcome outcome = router.upgrade(request("GET", "/rooms/lobby", headers(), null));

        ServerResponse resp = ((UpgradeOutcome.Rejected) outcome).response();
        assertThat(resp.status()).isEqualTo(400);
        assertThat(body(resp)).containsEntry("error", "Validation Error").containsEntry("field", "query");
    }

    @Test
    void acceptedUpgradeCarriesValidatedInput() {
        MessageRouter router = router(MessageHandlers.builder().build());

        UpgradeResult result = accept(router, "/rooms/lobby?user=ada");

        assertThat(result.endpointName()).isEqualTo("chat");
        assertThat(result.params()).isEqualTo(Map.of("room", "lobby"));
        assertThat(result.query()).isEqualTo(Map.of("user", "ada"));
        assertThat(router.isMessageRoute(request("GET", "/rooms/lobby", headers(), null))).isTrue();
        assertThat(router.isMessageRoute(request("GET", "/rooms", headers(), null))).isFalse();
    }

    @Test
    void openHookRunsOnceWithSocketView() {
        AtomicReference<String> room = new AtomicReference<>();
        MessageRouter router = router(MessageHandlers.builder()
                .onOpen(socket -> {
                    Map<String, String> params = socket.params();
                    room.set(params.get("room"));
                    socket.send("said", Map.of("user", "server", "text", "welcome"));
                })
                .build());
        FakeSocket sink = new FakeSocket();

        MessageSession session = router.open(accept(router, "/rooms/lobby?user=ada"), sink);

        assertThat(session.state()).isEqualTo(ConnectionState.OPEN);
        assertThat(room).hasValue("lobby");
        assertThat(sink.sent).containsExactly("{\"type\":\"said\",\"payload\":{\"user\":\"server\",\"text\":\"welcome\"}}");
    }

    @Test
    void validMessageReachesHookWithParsedPayload() {
        List<Envelope> received = new ArrayList<>();
        MessageRouter router = router(MessageHandlers.builder()
                .onMessage((socket, message) -> received.add(message))
                .build());
        MessageSession session = router.open(accept(router, "/rooms/lobby?user=ada"), new FakeSocket());

        session.onMessage("{\"type\":\"say\",\"payload\":{\"text\":\"hi\"}}");

        assertThat(received).containsExactly(new Envelope("say", Map.of("text", "hi")));
    }

    @Test
    void unknownTypeIsAnsweredWithErrorEnvelopeAndSessionStaysOpen() throws Exception {
        AtomicInteger messages = new AtomicInteger();
        MessageRouter router = router(MessageHandlers.builder()
                .onMessage((socket, message) -> messages.incrementAndGet())
                .build());
        FakeSocket sink = new FakeSocket();
        MessageSession session = router.open(accept(router, "/rooms/lobby?user=ada"), sink);

        session.onMessage("{\"type\":\"bogus\",\"payload\":{}}");

        assertThat(messages).hasValue(0);
        assertThat(session.isOpen()).isTrue();
        Map<String, Object> error = envelope(sink.sent.get(0));
        assertThat(error).containsEntry("type", "error");
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = (Map<String, Object>) error.get("payload");
        assertThat(payload).containsEntry("code", "VALIDATION_ERROR")
                .containsEntry("message", "Validation failed for message type: bogus");
        assertThat((List<?>) payload.get("issues")).hasSize(1);
    }

    @Test
    void invalidPayloadGoesToValidationErrorHookWhenPresent() {
        List<MessageValidationException> errors = new ArrayList<>();
        MessageRouter router = router(MessageHandlers.builder()
                .onValidationError((socket, error) -> errors.add(error))
                .build());
        FakeSocket sink = new FakeSocket();
        MessageSession session = router.open(accept(router, "/rooms/lobby?user=ada"), sink);

        session.onMessage("{\"type\":\"say\",\"payload\":{\"txt\":\"typo\"}}");

        assertThat(errors).singleElement().satisfies(e -> {
            assertThat(e.messageType()).isEqualTo("say");
            assertThat(e.issues()).singleElement().satisfies(issue -> assertThat(issue.path()).containsExactly("text"));
        });
        assertThat(sink.sent).isEmpty();
    }

    @Test
    void malformedFrameIsReportedAsUnknownType() {
        List<MessageValidationException> errors = new ArrayList<>();
        MessageRouter router = router(MessageHandlers.builder()
                .onValidationError((socket, error) -> errors.add(error))
                .build());
        MessageSession session = router.open(accept(router, "/rooms/lobby?user=ada"), new FakeSocket());

        session.onMessage("not json");
        session.onMessage("{\"payload\":1}");

        assertThat(errors).hasSize(2).allSatisfy(e -> assertThat(e.messageType()).isEqualTo("unknown"));
    }

    @Test
    void publishReachesOtherSubscribersOnly() {
        MessageRouter router = router(MessageHandlers.builder()
                .onOpen(socket -> socket.subscribe("room:lobby"))
                .onMessage((socket, message) -> socket.publish("room:lobby", "said", message.payload()))
                .build());
        FakeSocket ada = new FakeSocket();
        FakeSocket bob = new FakeSocket();
        FakeSocket eve = new FakeSocket();
        MessageSession adaSession = router.open(accept(router, "/rooms/lobby?user=ada"), ada);
        router.open(accept(router, "/rooms/lobby?user=bob"), bob);
        MessageSession eveSession = router.open(accept(router, "/rooms/lobby?user=eve"), eve);

        eveSession.onClose(1000, "bye");
        adaSession.onMessage("{\"type\":\"say\",\"payload\":{\"text\":\"hi\"}}");

        assertThat(ada.sent).isEmpty();
        assertThat(bob.sent).containsExactly("{\"type\":\"said\",\"payload\":{\"text\":\"hi\"}}");
        assertThat(eve.sent).isEmpty();
        assertThat(eveSession.socket().isSubscribed("room:lobby")).isFalse();
    }

    @Test
    void closeAndDrainHooksRunOnce() {
        AtomicInteger closes = new AtomicInteger();
        AtomicInteger drains = new AtomicInteger();
        AtomicInteger cancellations = new AtomicInteger();
        AtomicReference<String> reason = new AtomicReference<>();
        MessageRouter router = router(MessageHandlers.builder()
                .onOpen(socket -> socket.signal().onCancel(cancellations::incrementAndGet))
                .onDrain(socket -> drains.incrementAndGet())
                .onClose((socket, code, why) -> {
                    closes.incrementAndGet();
                    reason.set(code + " " + why);
                })
                .build());
        FakeSocket sink = new FakeSocket();
        MessageSession session = router.open(accept(router, "/rooms/lobby?user=ada"), sink);

        session.onDrain();
        session.onDrain();
        session.socket().close(4000, "kicked");
        session.onClose(1006, "gone");
        session.onMessage("{\"type\":\"say\",\"payload\":{\"text\":\"late\"}}");

        assertThat(drains).hasValue(1);
        assertThat(closes).hasValue(1);
        assertThat(cancellations).hasValue(1);
        assertThat(reason).hasValue("4000 kicked");
        assertThat(sink.closedWith).isEqualTo("4000 kicked");
        assertThat(session.state()).isEqualTo(ConnectionState.CLOSED);
        assertThat(session.socket().send("said", Map.of())).isFalse();
    }

    @Test
    void failingHookLeavesSessionOpen() {
        AtomicInteger messages = new AtomicInteger();
        MessageRouter router = router(MessageHandlers.builder()
                .onMessage((socket, message) -> {
                    messages.incrementAndGet();
                    throw new IllegalStateException("handler bug");
                })
                .build());
        MessageSession session = router.open(accept(router, "/rooms/lobby?user=ada"), new FakeSocket());

        session.onMessage("{\"type\":\"say\",\"payload\":{\"text\":\"one\"}}");
        session.onMessage("{\"type\":\"say\",\"payload\":{\"text\":\"two\"}}");

        assertThat(messages).hasValue(2);
        assertThat(session.isOpen()).isTrue();
    }

    @Test
    void dataSchemaValidatesConnectionData() {
        MessageRouter router = MessageRouter.builder(contract)
                .handlers("chat", MessageHandlers.builder().build())
                .dataSchema(TestSchemas.object("userId"))
                .jsonCodec(json)
                .build();
        UpgradeResult upgrade = accept(router, "/rooms/lobby?user=ada");

        assertThatThrownBy(() -> router.open(upgrade, new FakeSocket(), Map.of("name", "ada")))
                .isInstanceOfSatisfying(RequestValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("data"));

        MessageSession session = router.open(upgrade, new FakeSocket(), Map.of("userId", 1));
        Map<String, Object> data = session.socket().data();
        assertThat(data).containsEntry("userId", 1);
    }

    @Test
    void contractRouterAppliesMessageDataSchema() {
        ContractRouter contractRouter = ContractRouter.builder(contract)
                .messages("chat", MessageHandlers.builder().build())
                .messageDataSchema(TestSchemas.object("userId"))
                .jsonCodec(json)
                .build();
        MessageRouter router = contractRouter.messageRouter();
        UpgradeResult upgrade = accept(router, "/rooms/lobby?user=ada");

        assertThatThrownBy(() -> router.open(upgrade, new FakeSocket(), Map.of("name", "ada")))
                .isInstanceOfSatisfying(RequestValidationException.class,
                        e -> assertThat(e.field()).isEqualTo("data"));
        Map<String, Object> data = router.open(upgrade, new FakeSocket(), Map.of("userId", 2)).socket().data();
        assertThat(data).containsEntry("userId", 2);
        contractRouter.close();
    }

    @Test
    void builderRequiresHandlersForEveryMessageEndpoint() {
        assertThatThrownBy(() -> MessageRouter.builder(contract).build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("chat");
        assertThatThrownBy(() -> MessageRouter.builder(contract).handlers("missing", MessageHandlers.builder().build()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private MessageRouter router(MessageHandlers handlers) {
        return MessageRouter.builder(contract)
                .handlers("chat", handlers)
                .jsonCodec(json)
                .build();
    }

    private static UpgradeResult accept(MessageRouter router, String pathAndQuery) {
        UpgradeOutcome outcome = router.upgrade(request("GET", pathAndQuery, headers(), null));
        assertThat(outcome).isInstanceOf(UpgradeOutcome.Accepted.class);
        return ((UpgradeOutcome.Accepted) outcome).result();
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> body(ServerResponse resp) throws Exception {
        return (Map<String, Object>) json.readTree(readBodyBytes(resp.body()));
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> envelope(String text) throws Exception {
        return (Map<String, Object>) json.readTree(text);
    }

    static final class FakeSocket implements MessageSocket {
        final List<String> sent = new CopyOnWriteArrayList<>();
        volatile String closedWith;

        @Override
        public void send(String text) throws IOException {
            sent.add(text);
        }

        @Override
        public void close(int code, String reason) {
            closedWith = code + " " + reason;
        }
    }
}
