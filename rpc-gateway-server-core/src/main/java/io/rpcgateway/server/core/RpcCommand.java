package io.rpcgateway.server.core;

import io.rpcgateway.json.spi.JsonNode;

/**
 * A single command served by {@link MapCommandTable}.
 */
@FunctionalInterface
public interface RpcCommand {

    /**
     * @param params array or object parameters, never null
     * @return the result, {@code null} for JSON null
     * @throws Exception any failure; an {@link io.rpcgateway.core.RpcException} keeps its code
     */
    JsonNode execute(JsonNode params) throws Exception;
}
