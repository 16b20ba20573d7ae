package io.rpcgateway.server.core;

import io.rpcgateway.core.RpcErrorCode;
import io.rpcgateway.core.RpcException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Directory of named {@link TimerProvider}s.
 *
 * <p>Several providers may be registered at once; the most recently registered one is the
 * active provider used by {@link #newTimer(Duration, Runnable)} and {@link #runLater}.
 * All methods are thread-safe.
 */
public final class TimerRegistry {
    private final Map<String, TimerProvider> providers = new LinkedHashMap<>();
    private final Map<String, TimerHandle> deadlineTimers = new HashMap<>();

    public synchronized void register(TimerProvider provider) {
        Objects.requireNonNull(provider, "provider");
        // re-registering moves the provider to the end, making it active
        providers.remove(provider.name());
        providers.put(provider.name(), provider);
    }

    public synchronized boolean unregister(String name) {
        return providers.remove(name) != null;
    }

    public synchronized Optional<TimerProvider> active() {
        TimerProvider last = null;
        for (TimerProvider p : providers.values()) {
            last = p;
        }
        return Optional.ofNullable(last);
    }

    public synchronized Optional<TimerProvider> provider(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    public synchronized List<String> names() {
        return new ArrayList<>(providers.keySet());
    }

    /**
     * Arm a timer with the active provider.
     *
     * @throws RpcException with {@link RpcErrorCode#INTERNAL_ERROR} if no provider is registered
     */
    public TimerHandle newTimer(Duration delay, Runnable callback) {
        TimerProvider provider = active().orElseThrow(() ->
                new RpcException(RpcErrorCode.INTERNAL_ERROR, "No timer handler registered for RPC"));
        return provider.newTimer(delay, callback);
    }

    /**
     * Arm a timer with a specific provider.
     *
     * @throws IllegalArgumentException if no provider has that name
     */
    public TimerHandle newTimer(String providerName, Duration delay, Runnable callback) {
        TimerProvider provider = provider(providerName).orElseThrow(() ->
                new IllegalArgumentException("unknown timer provider: " + providerName));
        return provider.newTimer(delay, callback);
    }

    /**
     * Run {@code callback} after {@code delay}, replacing and cancelling any timer previously
     * scheduled under the same key.
     */
    public void runLater(String key, Duration delay, Runnable callback) {
        Objects.requireNonNull(key, "key");
        TimerHandle handle = newTimer(delay, callback);
        TimerHandle previous;
        synchronized (this) {
            previous = deadlineTimers.put(key, handle);
        }
        if (previous != null) previous.close();
    }

    /**
     * Cancel every timer scheduled through {@link #runLater}.
     */
    public void cancelPending() {
        List<TimerHandle> handles;
        synchronized (this) {
            handles = new ArrayList<>(deadlineTimers.values());
            deadlineTimers.clear();
        }
        handles.forEach(TimerHandle::close);
    }
}
