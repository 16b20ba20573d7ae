package io.rpcgateway.server.core;

import io.rpcgateway.server.spi.Cancellable;
import io.rpcgateway.server.spi.EventLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Reference {@link EventLoop} backed by a single-threaded scheduled executor.
 *
 * <p>A task that throws is logged and dropped; the loop thread keeps running.
 */
public final class SingleThreadEventLoop implements EventLoop, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);

    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread loopThread;

    public SingleThreadEventLoop(String name) {
        Objects.requireNonNull(name, "name");
        this.executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = WorkerPools.namedThreadFactory(name).newThread(runnable);
            loopThread = thread;
            return thread;
        });
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public Cancellable schedule(Runnable task, Duration delay) {
        long nanos = delay == null ? 0 : Math.max(0, delay.toNanos());
        ScheduledFuture<?> future = executor.schedule(guarded(task), nanos, TimeUnit.NANOSECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Stops accepting tasks and drops pending timers. Tasks already running complete.
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Runnable guarded(Runnable task) {
        Objects.requireNonNull(task, "task");
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Event loop task failed", e);
            }
        };
    }
}
