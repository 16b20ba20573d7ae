package io.rpcgateway.server.spi;

import java.util.Objects;

/**
 * Reports whether the process has finished warming up and may execute commands.
 *
 * <p>Implementations manage their own synchronization; the gateway queries them once per request.
 */
public interface ReadinessProvider {

    /**
     * Returns the current readiness state.
     */
    Readiness status();

    /**
     * Readiness snapshot.
     *
     * @param ready whether commands may execute
     * @param statusText human-readable startup status, replied to clients while not ready
     */
    record Readiness(boolean ready, String statusText) {
        public Readiness {
            Objects.requireNonNull(statusText, "statusText");
        }

        public static Readiness done() {
            return new Readiness(true, "Done loading");
        }

        public static Readiness warmingUp(String statusText) {
            return new Readiness(false, statusText);
        }
    }

    /**
     * Provider that always reports ready.
     */
    static ReadinessProvider alwaysReady() {
        Readiness done = Readiness.done();
        return () -> done;
    }
}
