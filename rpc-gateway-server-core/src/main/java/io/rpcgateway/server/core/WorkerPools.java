package io.rpcgateway.server.core;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread factories and bounded pools for request handling.
 */
public final class WorkerPools {
    private WorkerPools() {
    }

    /**
     * Fixed-size pool of daemon threads named {@code prefix-N}.
     */
    public static ExecutorService newBoundedExecutor(String namePrefix, int threads) {
        Objects.requireNonNull(namePrefix, "namePrefix");
        if (threads <= 0) throw new IllegalArgumentException("threads must be positive");
        return Executors.newFixedThreadPool(threads, new NamedThreadFactory(namePrefix));
    }

    static ThreadFactory namedThreadFactory(String namePrefix) {
        return new NamedThreadFactory(Objects.requireNonNull(namePrefix, "namePrefix"));
    }

    private static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        private NamedThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
