package io.rpcgateway.core;

/**
 * JSON-RPC over HTTP protocol constants (header names, envelope fields, and status codes).
 *
 * <p>This module intentionally contains no HTTP server bindings and no JSON library dependencies.
 * It only models protocol-level concerns shared by the gateway and its transports.
 */
public final class Protocol {
    private Protocol() {}

    // HTTP headers
    public static final String H_AUTHORIZATION = "Authorization";
    public static final String H_CONTENT_TYPE = "Content-Type";

    // Content types
    public static final String CT_JSON = "application/json";
    public static final String CT_TEXT = "text/plain; charset=utf-8";

    /** Scheme prefix of an HTTP Basic authorization header, including the separating space. */
    public static final String BASIC_SCHEME = "Basic ";

    // Request envelope fields
    public static final String F_METHOD = "method";
    public static final String F_PARAMS = "params";
    public static final String F_ID = "id";

    // Reply envelope fields
    public static final String F_RESULT = "result";
    public static final String F_ERROR = "error";
    public static final String F_CODE = "code";
    public static final String F_MESSAGE = "message";

    // HTTP status codes
    public static final int HTTP_OK = 200;
    public static final int HTTP_BAD_REQUEST = 400;
    public static final int HTTP_UNAUTHORIZED = 401;
    public static final int HTTP_NOT_FOUND = 404;
    public static final int HTTP_BAD_METHOD = 405;
    public static final int HTTP_INTERNAL_SERVER_ERROR = 500;
}
