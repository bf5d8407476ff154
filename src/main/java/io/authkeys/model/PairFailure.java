package io.authkeys.model;

public record PairFailure(
        String host,
        String account,
        String phase,
        String errorType,
        String message
) {
    public static final String PHASE_FETCH = "FETCH";
    public static final String PHASE_REMEDIATE = "REMEDIATE";

    public static PairFailure of(HostAccount target, String phase, Throwable error) {
        String message = error.getMessage() == null || error.getMessage().isBlank()
                ? error.getClass().getSimpleName()
                : error.getMessage();
        return new PairFailure(target.host(), target.account(), phase, error.getClass().getSimpleName(), message);
    }

    public HostAccount target() {
        return new HostAccount(host, account);
    }
}
