package io.authkeys.model;

public record ExpectedBinding(
        String host,
        String account,
        String keyType,
        String keyMaterial,
        String identityLabel,
        String email
) {
    public BindingKey key() {
        return new BindingKey(host, account, keyMaterial);
    }

    public HostAccount target() {
        return new HostAccount(host, account);
    }
}
