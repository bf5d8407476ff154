package io.authkeys.credential;

import io.authkeys.model.HostAccount;

public class AuthenticationExhaustedException extends Exception {
    private final HostAccount target;
    private final int attempts;

    public AuthenticationExhaustedException(HostAccount target, int attempts, Throwable cause) {
        super("Authentication exhausted for " + target.key() + " after " + attempts + " password attempt(s)", cause);
        this.target = target;
        this.attempts = attempts;
    }

    public HostAccount target() {
        return target;
    }

    public int attempts() {
        return attempts;
    }
}
