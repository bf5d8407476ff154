package io.authkeys.model;

public record DiscoveredBinding(
        String host,
        String account,
        String keyType,
        String keyMaterial,
        String comment
) {
    public BindingKey key() {
        return new BindingKey(host, account, keyMaterial);
    }

    public HostAccount target() {
        return new HostAccount(host, account);
    }
}
