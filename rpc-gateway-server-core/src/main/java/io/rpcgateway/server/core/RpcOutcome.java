package io.rpcgateway.server.core;

import io.rpcgateway.core.RpcError;
import io.rpcgateway.json.spi.JsonNode;

/**
 * Result of executing one request envelope: a value or an error, always with the request id.
 */
public sealed interface RpcOutcome permits RpcOutcome.Success, RpcOutcome.Failure {

    JsonNode id();

    record Success(JsonNode id, JsonNode result) implements RpcOutcome {}

    record Failure(JsonNode id, RpcError error) implements RpcOutcome {}
}
