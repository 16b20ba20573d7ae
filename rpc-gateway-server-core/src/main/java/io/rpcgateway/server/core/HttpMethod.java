package io.rpcgateway.server.core;

import java.util.Locale;

/**
 * Request methods the gateway distinguishes; anything else is {@link #UNKNOWN}.
 */
public enum HttpMethod {
    UNKNOWN,
    GET,
    POST,
    HEAD,
    PUT;

    public static HttpMethod parse(String raw) {
        if (raw == null) return UNKNOWN;
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "GET" -> GET;
            case "POST" -> POST;
            case "HEAD" -> HEAD;
            case "PUT" -> PUT;
            default -> UNKNOWN;
        };
    }
}
