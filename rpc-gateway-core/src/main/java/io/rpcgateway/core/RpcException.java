package io.rpcgateway.core;

import java.util.Objects;

/**
 * Unchecked exception carrying a JSON-RPC error.
 *
 * <p>Command handlers throw it to report application errors; the gateway throws the nested
 * subclasses for protocol-level failures. The error is forwarded verbatim into the reply envelope.
 */
public class RpcException extends RuntimeException {
    private final RpcError error;

    public RpcException(RpcError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public RpcException(int code, String message) {
        this(new RpcError(code, message));
    }

    public RpcException(RpcErrorCode code, String message) {
        this(new RpcError(code, message));
    }

    public RpcException(RpcErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.error = new RpcError(code, message);
    }

    public RpcError error() {
        return error;
    }

    public int code() {
        return error.code();
    }

    /**
     * Raised when the request body is not valid JSON.
     */
    public static class ParseError extends RpcException {
        public ParseError(String message) {
            super(RpcErrorCode.PARSE_ERROR, message);
        }
    }

    /**
     * Raised when the request is valid JSON but not a well-formed request envelope.
     */
    public static class InvalidRequest extends RpcException {
        public InvalidRequest(String message) {
            super(RpcErrorCode.INVALID_REQUEST, message);
        }
    }

    /**
     * Raised when no command is registered under the requested method name.
     */
    public static class MethodNotFound extends RpcException {
        public MethodNotFound(String message) {
            super(RpcErrorCode.METHOD_NOT_FOUND, message);
        }
    }

    /**
     * Raised while the server is still warming up; the message carries the current startup status.
     */
    public static class InWarmup extends RpcException {
        public InWarmup(String statusText) {
            super(RpcErrorCode.IN_WARMUP, statusText);
        }
    }
}
