package io.rpcgateway.javalin;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.rpcgateway.core.Protocol;
import io.rpcgateway.server.core.GatewayConfig;
import io.rpcgateway.server.core.HttpHandlerRegistry;
import io.rpcgateway.server.core.RequestFacade;
import io.rpcgateway.server.core.WorkerPools;
import io.rpcgateway.server.spi.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * HTTP transport on Javalin.
 *
 * <p>Jetty's own threads parse requests and write responses; the gateway loop never touches a socket.
 * Every request is answered asynchronously: the handler registry is consulted on the server thread,
 * the matched handler runs on a bounded worker pool, and the reply it writes through
 * {@link RequestFacade} passes through the loop before completing the Javalin future. A handler that
 * returns without replying gets an empty 500.
 */
public final class JavalinHttpTransport implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JavalinHttpTransport.class);

    private final GatewayConfig config;
    private final HttpHandlerRegistry handlers;
    private final EventLoop loop;
    private Javalin app;
    private ExecutorService workers;

    public JavalinHttpTransport(GatewayConfig config, HttpHandlerRegistry handlers, EventLoop loop) {
        this.config = Objects.requireNonNull(config, "config");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.loop = Objects.requireNonNull(loop, "loop");
    }

    public synchronized void start() {
        if (app != null) {
            throw new IllegalStateException("transport already started");
        }
        workers = WorkerPools.newBoundedExecutor("rpc-worker", config.workerThreads());
        Javalin javalin = Javalin.create(cfg -> cfg.showJavalinBanner = false);
        // the registry does the routing; every method reaches it so it can answer 404/405 itself
        for (String path : new String[] {"/", "/*"}) {
            javalin.get(path, this::accept);
            javalin.post(path, this::accept);
            javalin.put(path, this::accept);
            javalin.delete(path, this::accept);
            javalin.patch(path, this::accept);
            javalin.head(path, this::accept);
        }
        javalin.start(config.bindAddress(), config.port());
        app = javalin;
        log.info("Bound RPC transport to {}:{}", config.bindAddress(), port());
    }

    /**
     * Returns the bound port, useful when configured with port 0.
     */
    public synchronized int port() {
        if (app == null) {
            throw new IllegalStateException("transport not started");
        }
        return app.port();
    }

    public synchronized void stop() {
        if (app == null) return;
        app.stop();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        app = null;
        log.info("Stopped RPC transport");
    }

    @Override
    public void close() {
        stop();
    }

    private void accept(Context ctx) {
        JavalinHttpExchange exchange = new JavalinHttpExchange(ctx, workers);
        ctx.future(exchange::completion);

        RequestFacade request = new RequestFacade(exchange, loop);
        Optional<HttpHandlerRegistry.Match> match = handlers.find(ctx.path());
        if (match.isEmpty()) {
            request.writeReply(Protocol.HTTP_NOT_FOUND);
            return;
        }
        HttpHandlerRegistry.Match m = match.get();
        try {
            workers.execute(() -> run(request, m));
        } catch (RejectedExecutionException e) {
            log.warn("Request from {} rejected, worker pool is shut down", exchange.peer());
            request.writeReply(Protocol.HTTP_INTERNAL_SERVER_ERROR);
        }
    }

    private static void run(RequestFacade request, HttpHandlerRegistry.Match match) {
        try {
            match.handler().handle(request, match.pathRemainder());
        } catch (RuntimeException e) {
            log.warn("Request handler failed", e);
        } finally {
            if (!request.replySent()) {
                request.writeReply(Protocol.HTTP_INTERNAL_SERVER_ERROR);
            }
        }
    }
}
