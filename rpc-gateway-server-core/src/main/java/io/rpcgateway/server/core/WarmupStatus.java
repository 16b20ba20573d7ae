package io.rpcgateway.server.core;

import io.rpcgateway.server.spi.ReadinessProvider;

import java.util.Objects;

/**
 * Settable readiness provider: starts warming up and is switched to ready once startup completes.
 */
public final class WarmupStatus implements ReadinessProvider {
    private volatile Readiness current;

    public WarmupStatus(String initialStatus) {
        this.current = Readiness.warmingUp(Objects.requireNonNull(initialStatus, "initialStatus"));
    }

    /**
     * Update the status text reported while warming up. Ignored once finished.
     */
    public synchronized void setStatus(String statusText) {
        Objects.requireNonNull(statusText, "statusText");
        if (!current.ready()) {
            current = Readiness.warmingUp(statusText);
        }
    }

    public synchronized void finish() {
        current = Readiness.done();
    }

    @Override
    public Readiness status() {
        return current;
    }
}
