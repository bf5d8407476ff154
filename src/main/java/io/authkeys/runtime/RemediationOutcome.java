package io.authkeys.runtime;

import io.authkeys.model.HostAccount;
import io.authkeys.model.PairFailure;

import java.util.List;

public record RemediationOutcome(
        List<HostAccount> applied,
        List<PairFailure> failures
) {
    public static RemediationOutcome empty() {
        return new RemediationOutcome(List.of(), List.of());
    }
}
