package io.rpcgateway.server.core;

import io.rpcgateway.core.Protocol;
import io.rpcgateway.core.RpcError;
import io.rpcgateway.core.RpcErrorCode;
import io.rpcgateway.core.RpcException;
import io.rpcgateway.json.spi.ArrayNode;
import io.rpcgateway.json.spi.JsonCodec;
import io.rpcgateway.json.spi.JsonException;
import io.rpcgateway.json.spi.JsonNode;
import io.rpcgateway.json.spi.ObjectNode;
import io.rpcgateway.server.spi.CommandTable;
import io.rpcgateway.server.spi.ReadinessProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Iterator;
import java.util.Objects;

/**
 * Handles one JSON-RPC exchange: method check, authorization, parse, warmup check, single or batch
 * execution through the {@link CommandTable}, and the reply.
 *
 * <p>Only POST is served. Requests with a missing or wrong {@code Authorization} header are rejected
 * before the body is read; wrong credentials are additionally delayed by
 * {@link GatewayConfig#authFailureDelay()}. Error replies are always JSON-RPC envelopes. Their HTTP
 * status is 400 for invalid requests, 404 for unknown methods, and 500 for everything else,
 * including parse errors and warmup.
 */
public final class JsonRpcDispatcher {
    private static final Logger log = LoggerFactory.getLogger(JsonRpcDispatcher.class);

    static final String BAD_METHOD_MESSAGE = "JSONRPC server handles only POST requests";

    private final AuthGate authGate;
    private final CommandTable commands;
    private final ReadinessProvider readiness;
    private final JsonCodec codec;
    private final Duration authFailureDelay;

    public JsonRpcDispatcher(GatewayContext context, AuthGate authGate) {
        Objects.requireNonNull(context, "context");
        this.authGate = Objects.requireNonNull(authGate, "authGate");
        this.commands = context.commands();
        this.readiness = context.readiness();
        this.codec = context.codec();
        this.authFailureDelay = context.config().authFailureDelay();
    }

    /**
     * Handle the exchange and write exactly one reply.
     *
     * @return true if a successful JSON-RPC reply was sent
     */
    public boolean handle(RequestFacade req) {
        if (req.method() != HttpMethod.POST) {
            req.writeHeader(Protocol.H_CONTENT_TYPE, Protocol.CT_TEXT);
            req.writeReply(Protocol.HTTP_BAD_METHOD, BAD_METHOD_MESSAGE);
            return false;
        }

        String authHeader = req.header(Protocol.H_AUTHORIZATION).orElse(null);
        if (authHeader == null) {
            req.writeReply(Protocol.HTTP_UNAUTHORIZED);
            return false;
        }
        if (!authGate.authorize(authHeader)) {
            log.warn("Incorrect RPC password attempt from {}", req.peer());
            throttle();
            req.writeReply(Protocol.HTTP_UNAUTHORIZED);
            return false;
        }

        JsonNode id = codec.nullNode();
        try {
            JsonNode request = parse(req.readBody());

            ReadinessProvider.Readiness status = readiness.status();
            if (!status.ready()) {
                throw new RpcException.InWarmup(status.statusText());
            }

            JsonNode reply;
            if (request.isObject()) {
                id = JsonRpcRequest.idOf(request, codec);
                RpcOutcome outcome = execute(request);
                if (outcome instanceof RpcOutcome.Failure failure) {
                    return errorReply(req, failure.error(), failure.id());
                }
                reply = toEnvelope(outcome);
            } else if (request.isArray()) {
                reply = executeBatch(request);
            } else {
                throw new RpcException.InvalidRequest("Top-level object parse error");
            }

            byte[] body = codec.writeBytes(reply);
            req.writeHeader(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
            req.writeReply(Protocol.HTTP_OK, body);
            return true;
        } catch (RpcException e) {
            return errorReply(req, e.error(), id);
        } catch (Exception e) {
            log.debug("Unexpected failure handling RPC request from {}", req.peer(), e);
            return errorReply(req, new RpcError(RpcErrorCode.PARSE_ERROR, String.valueOf(e.getMessage())), id);
        }
    }

    /**
     * Execute one request value, turning every failure into a {@link RpcOutcome.Failure}.
     */
    RpcOutcome execute(JsonNode value) {
        JsonNode id = JsonRpcRequest.idOf(value, codec);
        try {
            JsonRpcRequest request = JsonRpcRequest.parse(value, codec);
            JsonNode result = commands.execute(request.method(), request.params());
            return new RpcOutcome.Success(id, result);
        } catch (RpcException e) {
            return new RpcOutcome.Failure(id, e.error());
        } catch (RuntimeException e) {
            return new RpcOutcome.Failure(id, new RpcError(RpcErrorCode.PARSE_ERROR, String.valueOf(e.getMessage())));
        }
    }

    private ArrayNode executeBatch(JsonNode batch) {
        ArrayNode replies = codec.createArrayNode();
        for (Iterator<JsonNode> it = batch.elements(); it.hasNext(); ) {
            replies.add(toEnvelope(execute(it.next())));
        }
        return replies;
    }

    private ObjectNode toEnvelope(RpcOutcome outcome) {
        ObjectNode reply = codec.createObjectNode();
        if (outcome instanceof RpcOutcome.Success success) {
            reply.set(Protocol.F_RESULT, success.result());
            reply.putNull(Protocol.F_ERROR);
        } else if (outcome instanceof RpcOutcome.Failure failure) {
            reply.putNull(Protocol.F_RESULT);
            reply.set(Protocol.F_ERROR, toErrorObject(failure.error()));
        }
        reply.set(Protocol.F_ID, outcome.id());
        return reply;
    }

    private ObjectNode toErrorObject(RpcError error) {
        return codec.createObjectNode()
                .put(Protocol.F_CODE, error.code())
                .put(Protocol.F_MESSAGE, error.message());
    }

    private boolean errorReply(RequestFacade req, RpcError error, JsonNode id) {
        byte[] body;
        try {
            body = codec.writeBytes(toEnvelope(new RpcOutcome.Failure(id, error)));
        } catch (JsonException e) {
            log.warn("Failed to serialize RPC error reply", e);
            req.writeReply(Protocol.HTTP_INTERNAL_SERVER_ERROR);
            return false;
        }
        req.writeHeader(Protocol.H_CONTENT_TYPE, Protocol.CT_JSON);
        req.writeReply(statusFor(error), body);
        return false;
    }

    static int statusFor(RpcError error) {
        if (error.is(RpcErrorCode.INVALID_REQUEST)) return Protocol.HTTP_BAD_REQUEST;
        if (error.is(RpcErrorCode.METHOD_NOT_FOUND)) return Protocol.HTTP_NOT_FOUND;
        return Protocol.HTTP_INTERNAL_SERVER_ERROR;
    }

    private JsonNode parse(String body) {
        try {
            return codec.readTree(body);
        } catch (JsonException e) {
            throw new RpcException.ParseError("Parse error");
        }
    }

    private void throttle() {
        if (authFailureDelay.isZero()) return;
        try {
            Thread.sleep(authFailureDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
