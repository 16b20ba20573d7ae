package io.rpcgateway.server.core;

import io.rpcgateway.core.RpcErrorCode;
import io.rpcgateway.core.RpcException;
import io.rpcgateway.json.spi.JsonNode;
import io.rpcgateway.server.spi.CommandTable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link CommandTable} backed by a concurrent map of named {@link RpcCommand}s.
 *
 * <p>Unknown methods fail with {@code METHOD_NOT_FOUND}. A command failing with anything other than
 * an {@link RpcException} is reported as {@code MISC_ERROR} carrying the failure message.
 */
public final class MapCommandTable implements CommandTable {
    private final Map<String, RpcCommand> commands = new ConcurrentHashMap<>();

    public MapCommandTable register(String name, RpcCommand command) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(command, "command");
        if (commands.putIfAbsent(name, command) != null) {
            throw new IllegalArgumentException("command already registered: " + name);
        }
        return this;
    }

    public boolean unregister(String name) {
        return commands.remove(name) != null;
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(commands.keySet());
        Collections.sort(names);
        return names;
    }

    @Override
    public JsonNode execute(String method, JsonNode params) {
        RpcCommand command = commands.get(method);
        if (command == null) {
            throw new RpcException.MethodNotFound("Method not found");
        }
        try {
            return command.execute(params);
        } catch (RpcException e) {
            throw e;
        } catch (Exception e) {
            throw new RpcException(RpcErrorCode.MISC_ERROR, String.valueOf(e.getMessage()), e);
        }
    }
}
