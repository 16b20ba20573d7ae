package io.rpcgateway.server.core;

import io.rpcgateway.server.spi.Cancellable;
import io.rpcgateway.server.spi.EventLoop;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventBridgeTest {

    private final ManualEventLoop loop = new ManualEventLoop();

    @Test
    void immediateTriggerFiresOnLoop() {
        AtomicBoolean onLoop = new AtomicBoolean();
        EventBridge bridge = new EventBridge(loop, true, () -> onLoop.set(loop.inEventLoop()));

        bridge.trigger(null);
        assertThat(onLoop).isFalse();

        loop.advance(Duration.ZERO);
        assertThat(onLoop).isTrue();
    }

    @Test
    void delayedTriggerWaitsForDeadline() {
        AtomicInteger fired = new AtomicInteger();
        EventBridge bridge = new EventBridge(loop, true, fired::incrementAndGet);

        bridge.trigger(Duration.ofSeconds(5));
        loop.advance(Duration.ofMillis(4999));
        assertThat(fired).hasValue(0);

        loop.advance(Duration.ofMillis(1));
        assertThat(fired).hasValue(1);
    }

    @Test
    void oneShotFiresOnceAndReleasesItself() {
        AtomicInteger fired = new AtomicInteger();
        EventBridge bridge = new EventBridge(loop, true, fired::incrementAndGet);

        bridge.trigger(Duration.ofMillis(10));
        loop.advance(Duration.ofSeconds(1));

        assertThat(fired).hasValue(1);
        assertThat(bridge.isReleased()).isTrue();
        assertThatThrownBy(() -> bridge.trigger(Duration.ZERO)).isInstanceOf(IllegalStateException.class);
        bridge.close();
        loop.advance(Duration.ofSeconds(1));
        assertThat(fired).hasValue(1);
    }

    @Test
    void retriggeringOneShotKeepsOnlyLatestDeadline() {
        AtomicInteger fired = new AtomicInteger();
        EventBridge bridge = new EventBridge(loop, true, fired::incrementAndGet);

        bridge.trigger(Duration.ofSeconds(1));
        bridge.trigger(Duration.ofSeconds(3));
        loop.advance(Duration.ofSeconds(2));
        assertThat(fired).hasValue(0);

        loop.advance(Duration.ofSeconds(1));
        assertThat(fired).hasValue(1);
        assertThat(loop.pendingCount()).isZero();
    }

    @Test
    void closeBeforeFiringCancels() {
        AtomicInteger fired = new AtomicInteger();
        EventBridge bridge = new EventBridge(loop, true, fired::incrementAndGet);

        bridge.trigger(Duration.ofSeconds(1));
        bridge.close();
        loop.advance(Duration.ofSeconds(10));

        assertThat(fired).hasValue(0);
        assertThat(loop.pendingCount()).isZero();
    }

    @Test
    void closeAfterTaskQueuedButBeforeRunStillCancels() {
        AtomicInteger fired = new AtomicInteger();
        UncancellableLoop stubborn = new UncancellableLoop(loop);
        EventBridge bridge = new EventBridge(stubborn, true, fired::incrementAndGet);

        bridge.trigger(Duration.ZERO);
        bridge.close();
        loop.advance(Duration.ZERO);

        assertThat(fired).hasValue(0);
    }

    @Test
    void reusableBridgeFiresPerTriggerInOrder() {
        List<Integer> order = new ArrayList<>();
        AtomicInteger counter = new AtomicInteger();
        EventBridge bridge = new EventBridge(loop, false, () -> order.add(counter.incrementAndGet()));

        bridge.trigger(Duration.ofMillis(10));
        bridge.trigger(Duration.ofMillis(10));
        loop.advance(Duration.ofMillis(10));

        assertThat(order).containsExactly(1, 2);
        assertThat(bridge.isReleased()).isFalse();
    }

    /** Schedules normally but refuses every cancellation, so the queued task still runs. */
    private static final class UncancellableLoop implements EventLoop {
        private final EventLoop delegate;

        UncancellableLoop(EventLoop delegate) {
            this.delegate = delegate;
        }

        @Override
        public void execute(Runnable task) {
            delegate.execute(task);
        }

        @Override
        public Cancellable schedule(Runnable task, Duration delay) {
            delegate.schedule(task, delay);
            return () -> false;
        }

        @Override
        public boolean inEventLoop() {
            return delegate.inEventLoop();
        }
    }
}
