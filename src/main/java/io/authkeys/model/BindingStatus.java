package io.authkeys.model;

public enum BindingStatus {
    MATCHED,
    MISSING,
    UNAUTHORIZED;

    /** Statuses whose keys belong in the desired file. */
    public boolean desired() {
        return this != UNAUTHORIZED;
    }
}
