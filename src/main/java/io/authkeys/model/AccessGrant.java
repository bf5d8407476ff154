package io.authkeys.model;

public record AccessGrant(
        String host,
        String username
) {
    public HostAccount target() {
        return new HostAccount(host, username);
    }
}
