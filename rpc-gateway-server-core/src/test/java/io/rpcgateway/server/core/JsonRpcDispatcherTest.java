package io.rpcgateway.server.core;

import io.rpcgateway.core.Credential;
import io.rpcgateway.core.RpcException;
import io.rpcgateway.json.jackson.JacksonJsonCodec;
import io.rpcgateway.json.spi.ArrayNode;
import io.rpcgateway.json.spi.JsonCodec;
import io.rpcgateway.json.spi.JsonException;
import io.rpcgateway.json.spi.JsonNode;
import io.rpcgateway.json.spi.ObjectNode;
import io.rpcgateway.server.spi.CommandTable;
import io.rpcgateway.server.spi.ReadinessProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class JsonRpcDispatcherTest {

    private static final String AUTH = BasicAuthGateTest.basic("alice:s3cret");
    private static final String METHOD_NOT_FOUND =
            "{\"result\":null,\"error\":{\"code\":-32601,\"message\":\"Method not found\"},";

    private final JacksonJsonCodec codec = new JacksonJsonCodec();
    private final AtomicInteger authCalls = new AtomicInteger();
    private final AtomicInteger commandCalls = new AtomicInteger();
    private MapCommandTable commands;
    private AuthGate countingGate;

    @BeforeEach
    void setUp() {
        commands = new MapCommandTable()
                .register("ping", params -> {
                    commandCalls.incrementAndGet();
                    return codec.textNode("pong");
                })
                .register("fail", params -> {
                    throw new RpcException(-5, "Invalid address");
                });
        BasicAuthGate real = new BasicAuthGate(Credential.of("alice", "s3cret"));
        countingGate = header -> {
            authCalls.incrementAndGet();
            return real.authorize(header);
        };
    }

    @Test
    void singleRequestRepliesWithResultEnvelope() {
        RecordingExchange exchange = post("{\"method\":\"ping\",\"params\":[],\"id\":1}");

        boolean ok = dispatcher().handle(facade(exchange));

        assertThat(ok).isTrue();
        assertThat(exchange.status).isEqualTo(200);
        assertThat(exchange.responseHeader("Content-Type")).isEqualTo("application/json");
        assertThat(exchange.responseText()).isEqualTo("{\"result\":\"pong\",\"error\":null,\"id\":1}");
    }

    @Test
    void batchFailureDoesNotSuppressSiblingSuccess() {
        RecordingExchange exchange = post("[{\"method\":\"bad\"},{\"method\":\"ping\",\"params\":[],\"id\":2}]");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(200);
        assertThat(exchange.responseText()).isEqualTo("["
                + METHOD_NOT_FOUND + "\"id\":null},"
                + "{\"result\":\"pong\",\"error\":null,\"id\":2}]");
    }

    @Test
    void batchWithMalformedElementRepliesPerElement() {
        RecordingExchange exchange = post("[1,{\"method\":\"ping\",\"id\":\"a\"},{\"method\":\"fail\",\"id\":3}]");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(200);
        assertThat(exchange.responseText()).isEqualTo("["
                + "{\"result\":null,\"error\":{\"code\":-32600,\"message\":\"Invalid Request object\"},\"id\":null},"
                + "{\"result\":\"pong\",\"error\":null,\"id\":\"a\"},"
                + "{\"result\":null,\"error\":{\"code\":-5,\"message\":\"Invalid address\"},\"id\":3}]");
    }

    @Test
    void emptyBatchRepliesWithEmptyArray() {
        RecordingExchange exchange = post("[]");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(200);
        assertThat(exchange.responseText()).isEqualTo("[]");
    }

    @Test
    void unknownMethodMapsToNotFound() {
        RecordingExchange exchange = post("{\"method\":\"bad\",\"params\":[],\"id\":3}");

        boolean ok = dispatcher().handle(facade(exchange));

        assertThat(ok).isFalse();
        assertThat(exchange.status).isEqualTo(404);
        assertThat(exchange.responseText()).isEqualTo(METHOD_NOT_FOUND + "\"id\":3}");
    }

    /**
     * Parse errors and warmup share the generic 500 status with real server failures. Clients are
     * expected to branch on the envelope's error code, which stays distinct.
     */
    @Test
    void malformedJsonIsParseErrorWithGenericServerErrorStatus() {
        RecordingExchange exchange = post("{\"method\":");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(500);
        assertThat(exchange.responseText())
                .isEqualTo("{\"result\":null,\"error\":{\"code\":-32700,\"message\":\"Parse error\"},\"id\":null}");
        assertThat(commandCalls).hasValue(0);
    }

    @Test
    void emptyBodyIsParseError() {
        RecordingExchange exchange = post("");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(500);
        assertThat(errorCode(exchange)).isEqualTo(-32700);
    }

    @Test
    void warmupRejectsWithoutTouchingCommandTable() {
        WarmupStatus warmup = new WarmupStatus("Loading block index...");
        RecordingExchange exchange = post("{\"method\":\"ping\",\"params\":[],\"id\":1}");

        dispatcher(commands, warmup).handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(500);
        assertThat(exchange.responseText())
                .isEqualTo("{\"result\":null,\"error\":{\"code\":-28,\"message\":\"Loading block index...\"},\"id\":null}");
        assertThat(commandCalls).hasValue(0);

        warmup.finish();
        RecordingExchange after = post("{\"method\":\"ping\",\"params\":[],\"id\":1}");
        dispatcher(commands, warmup).handle(facade(after));
        assertThat(after.status).isEqualTo(200);
    }

    @Test
    void nonContainerTopLevelIsInvalidRequest() {
        RecordingExchange exchange = post("42");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(400);
        assertThat(exchange.responseText()).isEqualTo(
                "{\"result\":null,\"error\":{\"code\":-32600,\"message\":\"Top-level object parse error\"},\"id\":null}");
    }

    @Test
    void missingMethodEchoesId() {
        RecordingExchange exchange = post("{\"id\":9}");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(400);
        assertThat(exchange.responseText()).isEqualTo(
                "{\"result\":null,\"error\":{\"code\":-32600,\"message\":\"Missing method\"},\"id\":9}");
    }

    @Test
    void scalarParamsAreInvalidRequest() {
        RecordingExchange exchange = post("{\"method\":\"ping\",\"params\":\"x\",\"id\":1}");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(400);
        assertThat(errorCode(exchange)).isEqualTo(-32600);
        assertThat(commandCalls).hasValue(0);
    }

    @Test
    void applicationErrorIsCarriedVerbatim() {
        RecordingExchange exchange = post("{\"method\":\"fail\",\"params\":[],\"id\":\"x\"}");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(500);
        assertThat(exchange.responseText()).isEqualTo(
                "{\"result\":null,\"error\":{\"code\":-5,\"message\":\"Invalid address\"},\"id\":\"x\"}");
    }

    @Test
    void unexpectedFailureBecomesParseErrorEnvelope() {
        CommandTable exploding = (method, params) -> {
            throw new IllegalStateException("kaboom");
        };
        RecordingExchange exchange = post("{\"method\":\"anything\",\"id\":4}");

        dispatcher(exploding, ReadinessProvider.alwaysReady()).handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(500);
        assertThat(exchange.responseText()).isEqualTo(
                "{\"result\":null,\"error\":{\"code\":-32700,\"message\":\"kaboom\"},\"id\":4}");
        assertThat(exchange.sendCount()).isEqualTo(1);
    }

    @Test
    void nullResultIsRepliedAsJsonNull() {
        CommandTable nothing = (method, params) -> null;
        RecordingExchange exchange = post("{\"method\":\"anything\",\"id\":5}");

        dispatcher(nothing, ReadinessProvider.alwaysReady()).handle(facade(exchange));

        assertThat(exchange.responseText()).isEqualTo("{\"result\":null,\"error\":null,\"id\":5}");
    }

    @Test
    void getIsRejectedWithoutConsultingAuthGate() {
        RecordingExchange exchange = new RecordingExchange("GET",
                RecordingExchange.headers("Authorization", AUTH), "{\"method\":\"ping\"}");

        boolean ok = dispatcher().handle(facade(exchange));

        assertThat(ok).isFalse();
        assertThat(exchange.status).isEqualTo(405);
        assertThat(exchange.responseText()).isEqualTo(JsonRpcDispatcher.BAD_METHOD_MESSAGE);
        assertThat(authCalls).hasValue(0);
        assertThat(exchange.bodyOpened()).isFalse();
    }

    @Test
    void headAndPutAreRejectedToo() {
        for (String method : new String[] {"HEAD", "PUT", "DELETE"}) {
            RecordingExchange exchange = new RecordingExchange(method, RecordingExchange.headers(), "");
            dispatcher().handle(facade(exchange));
            assertThat(exchange.status).isEqualTo(405);
        }
        assertThat(authCalls).hasValue(0);
    }

    @Test
    void missingAuthorizationIsUnauthorizedWithoutReadingBody() {
        RecordingExchange exchange = RecordingExchange.post("{\"method\":\"ping\"}");

        dispatcher().handle(facade(exchange));

        assertThat(exchange.status).isEqualTo(401);
        assertThat(exchange.bodyOpened()).isFalse();
        assertThat(authCalls).hasValue(0);
    }

    @Test
    void wrongCredentialIsDelayedThenUnauthorized() {
        RecordingExchange exchange = RecordingExchange.post("{\"method\":\"ping\"}",
                "Authorization", BasicAuthGateTest.basic("alice:guess"));
        Duration delay = Duration.ofMillis(100);

        long start = System.nanoTime();
        dispatcher(commands, ReadinessProvider.alwaysReady(), delay).handle(facade(exchange));
        long elapsedMillis = (System.nanoTime() - start) / 1_000_000;

        assertThat(exchange.status).isEqualTo(401);
        assertThat(elapsedMillis).isGreaterThanOrEqualTo(delay.toMillis());
        assertThat(authCalls).hasValue(1);
        assertThat(exchange.bodyOpened()).isFalse();
        assertThat(commandCalls).hasValue(0);
    }

    @Test
    void statusMappingTable() {
        assertThat(JsonRpcDispatcher.statusFor(new RpcException.InvalidRequest("x").error())).isEqualTo(400);
        assertThat(JsonRpcDispatcher.statusFor(new RpcException.MethodNotFound("x").error())).isEqualTo(404);
        assertThat(JsonRpcDispatcher.statusFor(new RpcException.ParseError("x").error())).isEqualTo(500);
        assertThat(JsonRpcDispatcher.statusFor(new RpcException.InWarmup("x").error())).isEqualTo(500);
        assertThat(JsonRpcDispatcher.statusFor(new RpcException(-8, "x").error())).isEqualTo(500);
    }

    @Test
    void serializationFailureSendsOneContentTypeWithTheErrorReply() {
        GatewayContext context = GatewayContext.builder()
                .eventLoop(new InlineEventLoop())
                .commands(commands)
                .codec(new FirstWriteFailsCodec(codec))
                .build();
        RecordingExchange exchange = post("{\"method\":\"ping\",\"id\":1}");

        boolean ok = new JsonRpcDispatcher(context, countingGate).handle(facade(exchange));

        assertThat(ok).isFalse();
        assertThat(exchange.status).isEqualTo(500);
        assertThat(exchange.responseHeaders.get("Content-Type")).containsExactly("application/json");
        assertThat(errorCode(exchange)).isEqualTo(-32700);
    }

    private JsonRpcDispatcher dispatcher() {
        return dispatcher(commands, ReadinessProvider.alwaysReady());
    }

    private JsonRpcDispatcher dispatcher(CommandTable table, ReadinessProvider readiness) {
        return dispatcher(table, readiness, Duration.ZERO);
    }

    private JsonRpcDispatcher dispatcher(CommandTable table, ReadinessProvider readiness, Duration authDelay) {
        GatewayContext context = GatewayContext.builder()
                .config(GatewayConfig.builder().authFailureDelay(authDelay).build())
                .eventLoop(new InlineEventLoop())
                .commands(table)
                .readiness(readiness)
                .codec(codec)
                .build();
        return new JsonRpcDispatcher(context, countingGate);
    }

    private static RecordingExchange post(String body) {
        return RecordingExchange.post(body, "Authorization", AUTH);
    }

    private static RequestFacade facade(RecordingExchange exchange) {
        return new RequestFacade(exchange, new InlineEventLoop());
    }

    private long errorCode(RecordingExchange exchange) {
        try {
            JsonNode reply = codec.readTree(exchange.responseText());
            return reply.get("error").get("code").asLong();
        } catch (Exception e) {
            throw new AssertionError("reply is not JSON: " + exchange.responseText(), e);
        }
    }

    /** Delegates to a real codec but fails the first serialization. */
    private static final class FirstWriteFailsCodec implements JsonCodec {
        private final JsonCodec delegate;
        private final AtomicInteger writes = new AtomicInteger();

        FirstWriteFailsCodec(JsonCodec delegate) {
            this.delegate = delegate;
        }

        @Override
        public byte[] writeBytes(JsonNode value) throws JsonException {
            if (writes.getAndIncrement() == 0) {
                throw new JsonException("serializer unavailable");
            }
            return delegate.writeBytes(value);
        }

        @Override
        public String writeString(JsonNode value) throws JsonException {
            return delegate.writeString(value);
        }

        @Override
        public JsonNode readTree(String json) throws JsonException {
            return delegate.readTree(json);
        }

        @Override
        public ObjectNode createObjectNode() {
            return delegate.createObjectNode();
        }

        @Override
        public ArrayNode createArrayNode() {
            return delegate.createArrayNode();
        }

        @Override
        public JsonNode nullNode() {
            return delegate.nullNode();
        }

        @Override
        public JsonNode textNode(String value) {
            return delegate.textNode(value);
        }

        @Override
        public JsonNode numberNode(long value) {
            return delegate.numberNode(value);
        }
    }
}
