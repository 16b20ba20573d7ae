package io.rpcgateway.server.core;

import io.rpcgateway.core.RpcErrorCode;
import io.rpcgateway.core.RpcException;
import io.rpcgateway.json.spi.JsonCodec;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Commands every gateway serves: {@code ping}, {@code uptime} and {@code help}.
 */
public final class BuiltinCommands {
    private BuiltinCommands() {
    }

    public static MapCommandTable registerAll(MapCommandTable table, JsonCodec codec, Clock clock) {
        Instant started = clock.instant();

        table.register("ping", params -> {
            requireNoParams("ping", params.size());
            return codec.nullNode();
        });
        table.register("uptime", params -> {
            requireNoParams("uptime", params.size());
            return codec.numberNode(Duration.between(started, clock.instant()).getSeconds());
        });
        table.register("help", params -> {
            requireNoParams("help", params.size());
            return codec.textNode(String.join("\n", table.names()));
        });
        return table;
    }

    private static void requireNoParams(String command, int count) {
        if (count != 0) {
            throw new RpcException(RpcErrorCode.INVALID_PARAMS, command + " takes no parameters");
        }
    }
}
