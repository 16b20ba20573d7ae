package io.rpcgateway.javalin;

import io.javalin.http.Context;
import io.rpcgateway.server.spi.HttpExchange;

import java.io.InputStream;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * {@link HttpExchange} over a Javalin {@link Context} running in async mode.
 *
 * <p>Request line and headers are captured on the server thread. {@link #sendResponse} only records
 * the reply and completes {@link #completion()} on the responder executor, so the socket write never
 * happens on the caller's thread.
 */
final class JavalinHttpExchange implements HttpExchange {

    private record Reply(int status, Map<String, List<String>> headers, byte[] body) {}

    private final Context ctx;
    private final Executor responder;
    private final String method;
    private final URI uri;
    private final String peer;
    private final Map<String, List<String>> headers;
    private final CompletableFuture<Reply> reply = new CompletableFuture<>();

    JavalinHttpExchange(Context ctx, Executor responder) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.responder = Objects.requireNonNull(responder, "responder");
        this.method = ctx.method().name();
        this.uri = URI.create(ctx.fullUrl());
        this.peer = ctx.ip();
        this.headers = toHeaders(ctx);
    }

    @Override
    public String method() {
        return method;
    }

    @Override
    public URI uri() {
        return uri;
    }

    @Override
    public String peer() {
        return peer;
    }

    @Override
    public Map<String, List<String>> requestHeaders() {
        return headers;
    }

    @Override
    public InputStream requestBody() {
        return ctx.bodyInputStream();
    }

    @Override
    public void sendResponse(int status, Map<String, List<String>> headers, byte[] body) {
        Reply r = new Reply(status, headers, body);
        try {
            reply.completeAsync(() -> r, responder);
        } catch (RejectedExecutionException e) {
            reply.complete(r);
        }
    }

    /**
     * Future handed to {@link Context#future}; applies the reply to the context once it is sent.
     */
    CompletableFuture<Void> completion() {
        return reply.thenAccept(this::apply);
    }

    private void apply(Reply r) {
        ctx.status(r.status());
        for (Map.Entry<String, List<String>> e : r.headers().entrySet()) {
            for (String v : e.getValue()) {
                ctx.header(e.getKey(), v);
            }
        }
        ctx.result(r.body());
    }

    private static Map<String, List<String>> toHeaders(Context ctx) {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : ctx.headerMap().entrySet()) {
            headers.put(e.getKey(), List.of(e.getValue()));
        }
        return headers;
    }
}
