package io.authkeys.model;

public record BindingKey(
        String host,
        String account,
        String keyMaterial
) {
    public HostAccount target() {
        return new HostAccount(host, account);
    }
}
