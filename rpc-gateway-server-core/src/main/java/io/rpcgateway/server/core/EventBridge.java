package io.rpcgateway.server.core;

import io.rpcgateway.server.spi.Cancellable;
import io.rpcgateway.server.spi.EventLoop;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cross-thread trigger that runs a callback on the event-loop thread, now or after a delay.
 *
 * <p>{@link #trigger(Duration)} may be called from any thread, holds no lock and never waits for the
 * loop. With {@code deleteWhenTriggered} the bridge is one-shot: the first firing consumes the callback
 * and releases the bridge. {@link #close()} cancels anything still pending; the callback reference is
 * read exactly once per firing on the loop thread, so a close that happens before that read wins.
 */
public final class EventBridge implements TimerHandle {
    private final EventLoop loop;
    private final boolean deleteWhenTriggered;
    private final AtomicReference<Runnable> callback;
    private final AtomicReference<Cancellable> pending = new AtomicReference<>();
    private final AtomicBoolean released = new AtomicBoolean();

    public EventBridge(EventLoop loop, boolean deleteWhenTriggered, Runnable callback) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.deleteWhenTriggered = deleteWhenTriggered;
        this.callback = new AtomicReference<>(Objects.requireNonNull(callback, "callback"));
    }

    /**
     * Schedule the callback on the loop thread.
     *
     * @param delay {@code null} or zero to fire as soon as possible
     * @throws IllegalStateException if the bridge was already released
     */
    public void trigger(Duration delay) {
        if (released.get()) {
            throw new IllegalStateException("event bridge already released");
        }
        Duration effective = delay == null || delay.isNegative() ? Duration.ZERO : delay;
        Cancellable previous = pending.getAndSet(loop.schedule(this::fire, effective));
        if (deleteWhenTriggered && previous != null) {
            // one-shot bridges keep only the latest deadline
            previous.cancel();
        }
    }

    /**
     * Returns true once the bridge was closed or, for one-shot bridges, has fired.
     */
    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (!released.compareAndSet(false, true)) return;
        callback.set(null);
        Cancellable c = pending.getAndSet(null);
        if (c != null) c.cancel();
    }

    private void fire() {
        Runnable cb = deleteWhenTriggered ? callback.getAndSet(null) : callback.get();
        if (cb == null) return;
        try {
            cb.run();
        } finally {
            if (deleteWhenTriggered) {
                released.set(true);
                pending.set(null);
            }
        }
    }
}
