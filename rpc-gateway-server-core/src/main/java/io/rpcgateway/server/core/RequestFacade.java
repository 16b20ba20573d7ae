package io.rpcgateway.server.core;

import io.rpcgateway.core.Headers;
import io.rpcgateway.server.spi.EventLoop;
import io.rpcgateway.server.spi.HttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-use wrapper around one in-flight HTTP exchange.
 *
 * <p>The body can be read once; later reads return an empty string. Response headers may be added
 * until the reply is written. {@link #writeReply} may be called exactly once, from any thread: the
 * actual write is handed to the event-loop thread. Any call after the reply fails with
 * {@link IllegalStateException}, except {@link #replySent()}.
 *
 * <p>A facade is used by one handler thread at a time.
 */
public final class RequestFacade {
    private static final Logger log = LoggerFactory.getLogger(RequestFacade.class);

    enum State {
        OPEN,
        BODY_CONSUMED,
        HEADER_WRITTEN,
        CLOSED
    }

    private final HttpExchange exchange;
    private final EventLoop loop;
    private final Map<String, List<String>> responseHeaders = new LinkedHashMap<>();
    private final AtomicReference<State> state = new AtomicReference<>(State.OPEN);
    private boolean bodyRead;

    public RequestFacade(HttpExchange exchange, EventLoop loop) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.loop = Objects.requireNonNull(loop, "loop");
    }

    public HttpMethod method() {
        checkOpen();
        return HttpMethod.parse(exchange.method());
    }

    public URI uri() {
        checkOpen();
        return exchange.uri();
    }

    public String peer() {
        checkOpen();
        return exchange.peer();
    }

    /**
     * Case-insensitive request header lookup; absence is not an error.
     */
    public Optional<String> header(String name) {
        checkOpen();
        return Headers.firstValue(exchange.requestHeaders(), name);
    }

    /**
     * Read the whole request body as UTF-8. Returns an empty string on every call after the first.
     */
    public String readBody() throws IOException {
        checkOpen();
        if (bodyRead) {
            return "";
        }
        bodyRead = true;
        advance(State.BODY_CONSUMED);
        try (InputStream in = exchange.requestBody()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public void writeHeader(String name, String value) {
        checkOpen();
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        responseHeaders.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        advance(State.HEADER_WRITTEN);
    }

    public void writeReply(int status) {
        writeReply(status, new byte[0]);
    }

    public void writeReply(int status, String body) {
        writeReply(status, body.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Send the response. Ownership of the exchange passes back to the transport.
     */
    public void writeReply(int status, byte[] body) {
        Objects.requireNonNull(body, "body");
        if (state.getAndSet(State.CLOSED) == State.CLOSED) {
            throw new IllegalStateException("request already replied to");
        }
        Map<String, List<String>> headers = new LinkedHashMap<>(responseHeaders);
        String peer = exchange.peer();
        Runnable send = () -> {
            try {
                exchange.sendResponse(status, headers, body);
            } catch (IOException e) {
                log.debug("Failed to send reply to {}", peer, e);
            }
        };
        if (loop.inEventLoop()) {
            send.run();
        } else {
            loop.execute(send);
        }
    }

    public boolean replySent() {
        return state.get() == State.CLOSED;
    }

    State state() {
        return state.get();
    }

    private void checkOpen() {
        if (state.get() == State.CLOSED) {
            throw new IllegalStateException("request already replied to");
        }
    }

    private void advance(State next) {
        State current = state.get();
        while (current != State.CLOSED) {
            if (state.compareAndSet(current, next)) return;
            current = state.get();
        }
        throw new IllegalStateException("request already replied to");
    }
}
