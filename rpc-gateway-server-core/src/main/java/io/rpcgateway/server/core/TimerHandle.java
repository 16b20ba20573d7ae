package io.rpcgateway.server.core;

/**
 * Owner's handle to one deferred callback.
 *
 * <p>The callback fires at most once. Closing the handle before it fires guarantees it never runs;
 * closing it afterwards is a no-op.
 */
public interface TimerHandle extends AutoCloseable {

    @Override
    void close();
}
