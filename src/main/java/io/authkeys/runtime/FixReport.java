package io.authkeys.runtime;

import java.util.List;

public record FixReport(
        AuditReport audit,
        List<RemediationPlan> plans,
        Decision decision,
        RemediationOutcome outcome
) {
    public enum Decision {
        APPLIED,
        DECLINED,
        NOTHING_TO_DO
    }
}
