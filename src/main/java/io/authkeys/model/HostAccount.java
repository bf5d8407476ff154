package io.authkeys.model;

public record HostAccount(
        String host,
        String account
) {
    /** Credential cache key, {@code account@host}. */
    public String key() {
        return account + "@" + host;
    }

    @Override
    public String toString() {
        return key();
    }
}
