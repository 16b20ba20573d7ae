package io.rpcgateway.server.core;

import io.rpcgateway.core.Credential;
import io.rpcgateway.server.spi.OperatorNotifier;

import java.security.SecureRandom;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds the RPC credential from configuration and refuses weak setups.
 *
 * <p>When a password is required but missing, or equal to the user name, the operator is told how to
 * fix the configuration, with a freshly generated random password as a suggestion, and no credential
 * is produced.
 */
public final class CredentialInitializer {
    static final int SUGGESTED_PASSWORD_BYTES = 32;

    private final OperatorNotifier notifier;
    private final SecureRandom random;

    public CredentialInitializer(OperatorNotifier notifier) {
        this(notifier, new SecureRandom());
    }

    CredentialInitializer(OperatorNotifier notifier, SecureRandom random) {
        this.notifier = Objects.requireNonNull(notifier, "notifier");
        this.random = Objects.requireNonNull(random, "random");
    }

    public Optional<Credential> initialize(GatewayConfig config) {
        String user = config.rpcUser();
        String password = config.rpcPassword();
        if ((password.isEmpty() || user.equals(password)) && config.requirePassword()) {
            notifier.notify(OperatorNotifier.Severity.ERROR, weakPasswordMessage(suggestPassword()));
            return Optional.empty();
        }
        return Optional.of(Credential.of(user, password));
    }

    String suggestPassword() {
        byte[] bytes = new byte[SUGGESTED_PASSWORD_BYTES];
        random.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    private static String weakPasswordMessage(String suggestion) {
        return "To use the RPC gateway you must set an rpc password in the configuration file.\n"
                + "It is recommended you use the following random password:\n"
                + "rpc:\n"
                + "  user: rpcuser\n"
                + "  password: " + suggestion + "\n"
                + "(you do not need to remember this password)\n"
                + "The username and password MUST NOT be the same.\n"
                + "If the file does not exist, create it with owner-readable-only file permissions.";
    }
}
