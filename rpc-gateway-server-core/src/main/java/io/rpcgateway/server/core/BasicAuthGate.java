package io.rpcgateway.server.core;

import io.rpcgateway.core.Credential;
import io.rpcgateway.core.Protocol;

import java.security.MessageDigest;
import java.util.Base64;
import java.util.Objects;

/**
 * HTTP Basic authorization against a fixed {@link Credential}.
 *
 * <p>The decoded {@code user:pass} is compared with {@link MessageDigest#isEqual}, stored value first:
 * the comparison always walks the full stored credential and folds a length mismatch into the result.
 * An empty credential rejects everything.
 */
public final class BasicAuthGate implements AuthGate {
    private final Credential credential;

    public BasicAuthGate(Credential credential) {
        this.credential = Objects.requireNonNull(credential, "credential");
    }

    @Override
    public boolean authorize(String headerValue) {
        if (credential.isEmpty()) return false;
        if (headerValue == null || !headerValue.startsWith(Protocol.BASIC_SCHEME)) return false;

        String userPass64 = headerValue.substring(Protocol.BASIC_SCHEME.length()).trim();
        byte[] supplied;
        try {
            supplied = Base64.getDecoder().decode(userPass64);
        } catch (IllegalArgumentException e) {
            return false;
        }
        return MessageDigest.isEqual(credential.bytes(), supplied);
    }
}
