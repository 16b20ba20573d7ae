package io.rpcgateway.server.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Gateway settings.
 *
 * <p>Use {@link #builder()} to create instances:
 * <pre>{@code
 * GatewayConfig config = GatewayConfig.builder()
 *     .rpcUser("bitcoinrpc")
 *     .rpcPassword(password)
 *     .port(8332)
 *     .build();
 * }</pre>
 */
public final class GatewayConfig {

    public static final String DEFAULT_BIND_ADDRESS = "127.0.0.1";
    public static final int DEFAULT_PORT = 8332;
    public static final Duration DEFAULT_AUTH_FAILURE_DELAY = Duration.ofMillis(250);
    public static final int DEFAULT_WORKER_THREADS = 4;

    private final String rpcUser;
    private final String rpcPassword;
    private final String bindAddress;
    private final int port;
    private final Duration authFailureDelay;
    private final int workerThreads;
    private final boolean requirePassword;

    private GatewayConfig(Builder builder) {
        this.rpcUser = builder.rpcUser;
        this.rpcPassword = builder.rpcPassword;
        this.bindAddress = builder.bindAddress;
        this.port = builder.port;
        this.authFailureDelay = builder.authFailureDelay;
        this.workerThreads = builder.workerThreads;
        this.requirePassword = builder.requirePassword;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String rpcUser() {
        return rpcUser;
    }

    public String rpcPassword() {
        return rpcPassword;
    }

    public String bindAddress() {
        return bindAddress;
    }

    public int port() {
        return port;
    }

    /** Fixed pause before answering a request with bad credentials. */
    public Duration authFailureDelay() {
        return authFailureDelay;
    }

    public int workerThreads() {
        return workerThreads;
    }

    /** Whether startup refuses an empty password or one equal to the user name. */
    public boolean requirePassword() {
        return requirePassword;
    }

    /**
     * Builder for {@link GatewayConfig}.
     */
    public static final class Builder {
        private String rpcUser = "";
        private String rpcPassword = "";
        private String bindAddress = DEFAULT_BIND_ADDRESS;
        private int port = DEFAULT_PORT;
        private Duration authFailureDelay = DEFAULT_AUTH_FAILURE_DELAY;
        private int workerThreads = DEFAULT_WORKER_THREADS;
        private boolean requirePassword = true;

        private Builder() {
        }

        public Builder rpcUser(String rpcUser) {
            this.rpcUser = Objects.requireNonNull(rpcUser, "rpcUser");
            return this;
        }

        public Builder rpcPassword(String rpcPassword) {
            this.rpcPassword = Objects.requireNonNull(rpcPassword, "rpcPassword");
            return this;
        }

        /** Sets the listen address. Default: 127.0.0.1. */
        public Builder bindAddress(String bindAddress) {
            this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
            return this;
        }

        /** Sets the listen port; 0 picks a free port. Default: 8332. */
        public Builder port(int port) {
            if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
            this.port = port;
            return this;
        }

        /** Sets the delay before rejecting bad credentials. Default: 250 ms. */
        public Builder authFailureDelay(Duration authFailureDelay) {
            Objects.requireNonNull(authFailureDelay, "authFailureDelay");
            if (authFailureDelay.isNegative()) throw new IllegalArgumentException("authFailureDelay must not be negative");
            this.authFailureDelay = authFailureDelay;
            return this;
        }

        /** Sets the request worker pool size. Default: 4. */
        public Builder workerThreads(int workerThreads) {
            if (workerThreads <= 0) throw new IllegalArgumentException("workerThreads must be positive");
            this.workerThreads = workerThreads;
            return this;
        }

        public Builder requirePassword(boolean requirePassword) {
            this.requirePassword = requirePassword;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(this);
        }
    }
}
