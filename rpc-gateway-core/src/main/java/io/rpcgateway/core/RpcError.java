package io.rpcgateway.core;

import java.util.Objects;

/**
 * JSON-RPC error object: {@code {code, message}}.
 */
public record RpcError(int code, String message) {

    public RpcError {
        Objects.requireNonNull(message, "message");
    }

    public RpcError(RpcErrorCode code, String message) {
        this(code.code(), message);
    }

    public boolean is(RpcErrorCode wellKnown) {
        return code == wellKnown.code();
    }
}
