package io.authkeys.model;

public record ReconciliationResult(
        String host,
        String account,
        String keyType,
        String keyMaterial,
        String comment,
        BindingStatus status
) {
    public BindingKey key() {
        return new BindingKey(host, account, keyMaterial);
    }

    public HostAccount target() {
        return new HostAccount(host, account);
    }
}
