package io.rpcgateway.server.core;

/**
 * Decides whether an {@code Authorization} header value grants access.
 *
 * <p>Implementations are pure: no logging, throttling or state. The dispatcher applies the
 * failure delay.
 */
@FunctionalInterface
public interface AuthGate {

    boolean authorize(String headerValue);
}
