package io.rpcgateway.core;

/**
 * Well-known JSON-RPC error codes produced by the gateway itself.
 *
 * <p>Application handlers may return any other integer code; those pass through the gateway unchanged.
 */
public enum RpcErrorCode {
    INVALID_REQUEST(-32600),
    METHOD_NOT_FOUND(-32601),
    INVALID_PARAMS(-32602),
    INTERNAL_ERROR(-32603),
    PARSE_ERROR(-32700),
    /** Catch-all for handler failures that carry no code of their own. */
    MISC_ERROR(-1),
    /** Server is still starting up and does not execute commands yet. */
    IN_WARMUP(-28);

    private final int code;

    RpcErrorCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
