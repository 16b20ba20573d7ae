package io.rpcgateway.javalin;

import io.rpcgateway.json.jackson.JacksonJsonCodec;
import io.rpcgateway.server.core.BuiltinCommands;
import io.rpcgateway.server.core.CredentialInitializer;
import io.rpcgateway.server.core.GatewayConfig;
import io.rpcgateway.server.core.GatewayContext;
import io.rpcgateway.server.core.HttpHandlerRegistry;
import io.rpcgateway.server.core.MapCommandTable;
import io.rpcgateway.server.core.RpcGateway;
import io.rpcgateway.server.core.SingleThreadEventLoop;
import io.rpcgateway.server.core.Slf4jOperatorNotifier;
import io.rpcgateway.server.core.WarmupStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/**
 * Standalone gateway serving the built-in commands.
 *
 * <p>Usage: {@code GatewayServer [config.yml]}, defaulting to {@code rpc-gateway.yml} in the working
 * directory.
 */
public final class GatewayServer {
    private static final Logger log = LoggerFactory.getLogger(GatewayServer.class);
    private static final String DEFAULT_CONFIG = "rpc-gateway.yml";

    private GatewayServer() {
    }

    public static void main(String[] args) throws IOException {
        Path configPath = Path.of(args.length > 0 ? args[0] : DEFAULT_CONFIG);
        GatewayConfig config = YamlGatewayConfigLoader.load(configPath);

        SingleThreadEventLoop loop = new SingleThreadEventLoop("rpc-loop");
        JacksonJsonCodec codec = new JacksonJsonCodec();
        WarmupStatus warmup = new WarmupStatus("Starting...");
        MapCommandTable commands = BuiltinCommands.registerAll(new MapCommandTable(), codec, Clock.systemUTC());
        GatewayContext context = GatewayContext.builder()
                .config(config)
                .eventLoop(loop)
                .commands(commands)
                .readiness(warmup)
                .codec(codec)
                .build();

        HttpHandlerRegistry handlers = new HttpHandlerRegistry();
        JavalinHttpTransport transport = new JavalinHttpTransport(config, handlers, loop);
        RpcGateway gateway = new RpcGateway(context, handlers, new CredentialInitializer(new Slf4jOperatorNotifier()));

        if (!gateway.start()) {
            loop.close();
            System.exit(1);
            return;
        }
        transport.start();
        warmup.finish();
        log.info("RPC gateway ready on {}:{}", config.bindAddress(), transport.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            gateway.interrupt();
            gateway.stop();
            transport.stop();
            loop.close();
        }, "rpc-shutdown"));
    }
}
