package io.rpcgateway.server.spi;

import java.time.Duration;

/**
 * The single I/O event-loop thread that owns network writes and timer firing.
 *
 * <p>Every method is safe to call from any thread and none of them blocks waiting for the loop.
 * Tasks run one at a time on the loop thread. Tasks scheduled with equal deadlines run in
 * submission order.
 */
public interface EventLoop {

    /**
     * Run a task on the loop thread as soon as possible.
     */
    void execute(Runnable task);

    /**
     * Run a task on the loop thread once {@code delay} has elapsed.
     *
     * @param task the task; ownership passes to the loop
     * @param delay minimum delay, {@link Duration#ZERO} for "as soon as possible"
     * @return a handle that prevents the task from running if cancelled in time
     */
    Cancellable schedule(Runnable task, Duration delay);

    /**
     * Returns true when called from the loop thread itself.
     */
    boolean inEventLoop();
}
