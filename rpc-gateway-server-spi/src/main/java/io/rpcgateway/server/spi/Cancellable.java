package io.rpcgateway.server.spi;

/**
 * Handle to a task scheduled on an {@link EventLoop}.
 */
@FunctionalInterface
public interface Cancellable {

    /**
     * Cancel the task if it has not started yet.
     *
     * @return {@code true} if the task will not run because of this call
     */
    boolean cancel();
}
