package io.rpcgateway.server.spi;

import io.rpcgateway.core.RpcException;
import io.rpcgateway.json.spi.JsonNode;

/**
 * Command dispatch SPI: maps a JSON-RPC method name to a handler and executes it.
 *
 * <p>The gateway treats the table as opaque. Implementations must be safe to call from several
 * worker threads at once.
 */
public interface CommandTable {

    /**
     * Execute a command.
     *
     * @param method the requested method name
     * @param params the request parameters, a JSON array or object (never null)
     * @return the command result; {@code null} is replied as JSON null
     * @throws RpcException for any failure the client should see, including
     *         {@link RpcException.MethodNotFound} for unknown methods
     */
    JsonNode execute(String method, JsonNode params) throws RpcException;
}
