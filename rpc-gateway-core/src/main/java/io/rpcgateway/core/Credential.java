package io.rpcgateway.core;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Immutable {@code user:pass} secret the gateway authorizes requests against.
 *
 * <p>An empty credential never authorizes anything.
 */
public final class Credential {
    private static final Credential EMPTY = new Credential("");

    private final String userColonPass;

    private Credential(String userColonPass) {
        this.userColonPass = userColonPass;
    }

    public static Credential of(String user, String password) {
        Objects.requireNonNull(user, "user");
        Objects.requireNonNull(password, "password");
        return new Credential(user + ":" + password);
    }

    public static Credential empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return userColonPass.isEmpty();
    }

    /**
     * Returns a fresh copy of the UTF-8 encoded {@code user:pass} bytes.
     */
    public byte[] bytes() {
        return userColonPass.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return isEmpty() ? "Credential[empty]" : "Credential[****]";
    }
}
