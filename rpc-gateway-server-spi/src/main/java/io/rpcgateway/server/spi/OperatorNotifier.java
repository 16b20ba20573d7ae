package io.rpcgateway.server.spi;

/**
 * Display or notification channel used to warn the operator at startup.
 */
@FunctionalInterface
public interface OperatorNotifier {

    enum Severity {
        INFO,
        WARNING,
        ERROR
    }

    void notify(Severity severity, String message);
}
