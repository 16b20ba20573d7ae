package io.rpcgateway.server.core;

import io.rpcgateway.core.Credential;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Lifecycle of the JSON-RPC endpoint: wires the dispatcher into the transport's handler registry and
 * registers the event-loop timer provider.
 */
public final class RpcGateway {
    private static final Logger log = LoggerFactory.getLogger(RpcGateway.class);

    static final String PATH = "/";

    private final GatewayContext context;
    private final HttpHandlerRegistry handlers;
    private final CredentialInitializer credentials;
    private volatile JsonRpcDispatcher dispatcher;

    public RpcGateway(GatewayContext context, HttpHandlerRegistry handlers, CredentialInitializer credentials) {
        this.context = Objects.requireNonNull(context, "context");
        this.handlers = Objects.requireNonNull(handlers, "handlers");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
    }

    /**
     * Start serving. The transport and event loop must already be running.
     *
     * @return false if the configured credential is unacceptable; nothing is registered then
     */
    public boolean start() {
        log.info("Starting HTTP RPC server");
        Optional<Credential> credential = credentials.initialize(context.config());
        if (credential.isEmpty()) {
            return false;
        }
        JsonRpcDispatcher d = new JsonRpcDispatcher(context, new BasicAuthGate(credential.get()));
        handlers.register(PATH, true, (request, path) -> d.handle(request));
        context.timers().register(TimerProvider.onEventLoop(TimerProvider.HTTP, context.eventLoop()));
        dispatcher = d;
        return true;
    }

    public void interrupt() {
        log.info("Interrupting HTTP RPC server");
    }

    public void stop() {
        log.info("Stopping HTTP RPC server");
        handlers.unregister(PATH, true);
        if (dispatcher != null) {
            context.timers().cancelPending();
            context.timers().unregister(TimerProvider.HTTP);
            dispatcher = null;
        }
    }

    public boolean isRunning() {
        return dispatcher != null;
    }
}
