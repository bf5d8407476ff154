package io.authkeys.runtime;

import io.authkeys.model.BindingStatus;
import io.authkeys.model.HostAccount;
import io.authkeys.model.PairFailure;
import io.authkeys.model.ReconciliationResult;

import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record AuditReport(
        Instant startedAt,
        Instant finishedAt,
        List<HostAccount> universe,
        Map<BindingStatus, Long> counts,
        List<ReconciliationResult> results,
        List<PairFailure> failures,
        List<HostAccount> undeclaredGrants
) {
    public static AuditReport of(
            Instant startedAt,
            Instant finishedAt,
            List<HostAccount> universe,
            List<ReconciliationResult> results,
            List<PairFailure> failures,
            List<HostAccount> undeclaredGrants
    ) {
        Map<BindingStatus, Long> counts = new EnumMap<>(BindingStatus.class);
        for (BindingStatus status : BindingStatus.values()) {
            counts.put(status, 0L);
        }
        for (ReconciliationResult result : results) {
            counts.merge(result.status(), 1L, Long::sum);
        }
        return new AuditReport(
                startedAt,
                finishedAt,
                List.copyOf(universe),
                counts,
                List.copyOf(results),
                List.copyOf(failures),
                List.copyOf(undeclaredGrants)
        );
    }

    public long count(BindingStatus status) {
        return counts.getOrDefault(status, 0L);
    }

    public boolean clean() {
        return failures.isEmpty() && count(BindingStatus.MISSING) == 0 && count(BindingStatus.UNAUTHORIZED) == 0;
    }
}
