package io.rpcgateway.server.core;

/**
 * Handler registered for a URL path prefix.
 */
@FunctionalInterface
public interface HttpRequestHandler {

    /**
     * @param request the exchange; the handler must reply exactly once
     * @param pathRemainder the request path after the matched prefix
     * @return true if the request was served successfully
     */
    boolean handle(RequestFacade request, String pathRemainder);
}
