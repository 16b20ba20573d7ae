package io.rpcgateway.server.core;

import io.rpcgateway.server.spi.OperatorNotifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Operator notifier for headless deployments: messages go to the log.
 */
public final class Slf4jOperatorNotifier implements OperatorNotifier {
    private static final Logger log = LoggerFactory.getLogger(Slf4jOperatorNotifier.class);

    @Override
    public void notify(Severity severity, String message) {
        switch (severity) {
            case INFO -> log.info(message);
            case WARNING -> log.warn(message);
            case ERROR -> log.error(message);
        }
    }
}
