package io.authkeys.transport;

import io.authkeys.security.SensitiveDataMasker;

public record Credential(
        Kind kind,
        String privateKeyPath,
        String password
) {
    public enum Kind {
        PRIVATE_KEY,
        PASSWORD
    }

    public static Credential privateKey(String path) {
        return new Credential(Kind.PRIVATE_KEY, path, null);
    }

    public static Credential password(String secret) {
        return new Credential(Kind.PASSWORD, null, secret);
    }

    @Override
    public String toString() {
        return SensitiveDataMasker.describe(this);
    }
}
