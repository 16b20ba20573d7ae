package io.rpcgateway.server.core;

import io.rpcgateway.server.spi.EventLoop;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Named timer capability: a function that arms a one-shot callback after a delay.
 *
 * @param name registry key, for example {@code "HTTP"}
 * @param factory arms the timer and returns its handle
 */
public record TimerProvider(String name, BiFunction<Duration, Runnable, TimerHandle> factory) {

    public static final String HTTP = "HTTP";

    public TimerProvider {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
    }

    public TimerHandle newTimer(Duration delay, Runnable callback) {
        return factory.apply(delay, callback);
    }

    /**
     * Provider whose timers fire on the given event loop, built on one-shot {@link EventBridge}s.
     */
    public static TimerProvider onEventLoop(String name, EventLoop loop) {
        Objects.requireNonNull(loop, "loop");
        return new TimerProvider(name, (delay, callback) -> {
            EventBridge bridge = new EventBridge(loop, true, callback);
            bridge.trigger(delay);
            return bridge;
        });
    }
}
