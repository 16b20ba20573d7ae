package io.rpcgateway.server.core;

import io.rpcgateway.core.Protocol;
import io.rpcgateway.core.RpcException;
import io.rpcgateway.json.spi.JsonCodec;
import io.rpcgateway.json.spi.JsonNode;

import java.util.Objects;

/**
 * Parsed JSON-RPC request envelope {@code {method, params, id}}.
 *
 * @param method command name
 * @param params array or object, an empty array when the client sent none
 * @param id request id copied verbatim, JSON null when absent
 */
public record JsonRpcRequest(String method, JsonNode params, JsonNode id) {

    public JsonRpcRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(params, "params");
        Objects.requireNonNull(id, "id");
    }

    /**
     * Returns the id of a request value before validating anything else, so that error replies can
     * still echo it.
     */
    static JsonNode idOf(JsonNode value, JsonCodec codec) {
        if (value != null && value.isObject()) {
            JsonNode id = value.get(Protocol.F_ID);
            if (id != null) return id;
        }
        return codec.nullNode();
    }

    /**
     * Validate and unpack a request envelope.
     *
     * @throws RpcException.InvalidRequest if the value is not a well-formed request object
     */
    static JsonRpcRequest parse(JsonNode value, JsonCodec codec) {
        if (value == null || !value.isObject()) {
            throw new RpcException.InvalidRequest("Invalid Request object");
        }
        JsonNode id = idOf(value, codec);

        JsonNode method = value.get(Protocol.F_METHOD);
        if (method == null || method.isNull()) {
            throw new RpcException.InvalidRequest("Missing method");
        }
        if (!method.isTextual()) {
            throw new RpcException.InvalidRequest("Method must be a string");
        }

        JsonNode params = value.get(Protocol.F_PARAMS);
        if (params == null || params.isNull()) {
            params = codec.createArrayNode();
        } else if (!params.isArray() && !params.isObject()) {
            throw new RpcException.InvalidRequest("Params must be an array or object");
        }
        return new JsonRpcRequest(method.asText(), params, id);
    }
}
