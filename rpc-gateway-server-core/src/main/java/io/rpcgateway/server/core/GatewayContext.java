package io.rpcgateway.server.core;

import io.rpcgateway.json.spi.JsonCodec;
import io.rpcgateway.server.spi.CommandTable;
import io.rpcgateway.server.spi.EventLoop;
import io.rpcgateway.server.spi.ReadinessProvider;

import java.util.Objects;

/**
 * Everything the gateway shares across requests, built once at startup and passed explicitly.
 */
public final class GatewayContext {
    private final GatewayConfig config;
    private final EventLoop eventLoop;
    private final TimerRegistry timers;
    private final CommandTable commands;
    private final ReadinessProvider readiness;
    private final JsonCodec codec;

    private GatewayContext(Builder builder) {
        this.config = builder.config != null ? builder.config : GatewayConfig.builder().build();
        this.eventLoop = Objects.requireNonNull(builder.eventLoop, "eventLoop");
        this.timers = builder.timers != null ? builder.timers : new TimerRegistry();
        this.commands = Objects.requireNonNull(builder.commands, "commands");
        this.readiness = builder.readiness != null ? builder.readiness : ReadinessProvider.alwaysReady();
        this.codec = Objects.requireNonNull(builder.codec, "codec");
    }

    public static Builder builder() {
        return new Builder();
    }

    public GatewayConfig config() {
        return config;
    }

    public EventLoop eventLoop() {
        return eventLoop;
    }

    public TimerRegistry timers() {
        return timers;
    }

    public CommandTable commands() {
        return commands;
    }

    public ReadinessProvider readiness() {
        return readiness;
    }

    public JsonCodec codec() {
        return codec;
    }

    /**
     * Builder for {@link GatewayContext}. Event loop, command table and codec are required.
     */
    public static final class Builder {
        private GatewayConfig config;
        private EventLoop eventLoop;
        private TimerRegistry timers;
        private CommandTable commands;
        private ReadinessProvider readiness;
        private JsonCodec codec;

        private Builder() {
        }

        public Builder config(GatewayConfig config) {
            this.config = config;
            return this;
        }

        public Builder eventLoop(EventLoop eventLoop) {
            this.eventLoop = eventLoop;
            return this;
        }

        /** Sets the timer registry. Default: a new, empty registry. */
        public Builder timers(TimerRegistry timers) {
            this.timers = timers;
            return this;
        }

        public Builder commands(CommandTable commands) {
            this.commands = commands;
            return this;
        }

        /** Sets the readiness provider. Default: {@link ReadinessProvider#alwaysReady()}. */
        public Builder readiness(ReadinessProvider readiness) {
            this.readiness = readiness;
            return this;
        }

        public Builder codec(JsonCodec codec) {
            this.codec = codec;
            return this;
        }

        public GatewayContext build() {
            return new GatewayContext(this);
        }
    }
}
