package io.rpcgateway.server.spi;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.List;
import java.util.Map;

/**
 * Raw request/response handle of one in-flight HTTP exchange, supplied by the transport.
 *
 * <p>The gateway never calls this directly from handler code; it wraps it in a request facade that
 * enforces single reads and a single reply, and sends the response from the event-loop thread.
 */
public interface HttpExchange {

    /**
     * Request method as sent by the client (for example {@code "POST"}).
     */
    String method();

    URI uri();

    /**
     * Printable peer address, used for logging only.
     */
    String peer();

    /**
     * Request headers. Lookups through this map may be case-sensitive; callers normalize.
     */
    Map<String, List<String>> requestHeaders();

    /**
     * Request body stream; may be empty but never null.
     */
    InputStream requestBody();

    /**
     * Write the complete response and release the exchange.
     *
     * @throws IOException if the connection is gone
     */
    void sendResponse(int status, Map<String, List<String>> headers, byte[] body) throws IOException;
}
