package io.authkeys.runtime;

import io.authkeys.codec.AuthorizedKeyEntry;
import io.authkeys.codec.AuthorizedKeysCodec;
import io.authkeys.model.BindingStatus;
import io.authkeys.model.HostAccount;
import io.authkeys.model.ReconciliationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns classification into whole-file replacements. Only MATCHED and MISSING
 * keys are written, so uploading a plan revokes every UNAUTHORIZED key on that
 * account.
 */
public final class RemediationPlanner {
    private RemediationPlanner() {
    }

    public static List<RemediationPlan> plan(Collection<ReconciliationResult> results) {
        return plan(results, false);
    }

    /**
     * @param revokeOrphaned also plan an empty file for accounts holding only
     *                       UNAUTHORIZED keys
     */
    public static List<RemediationPlan> plan(Collection<ReconciliationResult> results, boolean revokeOrphaned) {
        Map<HostAccount, List<ReconciliationResult>> byTarget = new LinkedHashMap<>();
        for (ReconciliationResult result : results) {
            byTarget.computeIfAbsent(result.target(), ignored -> new ArrayList<>()).add(result);
        }
        List<RemediationPlan> plans = new ArrayList<>();
        for (Map.Entry<HostAccount, List<ReconciliationResult>> entry : byTarget.entrySet()) {
            List<AuthorizedKeyEntry> entries = new ArrayList<>();
            int added = 0;
            int revoked = 0;
            for (ReconciliationResult result : entry.getValue()) {
                if (result.status() == BindingStatus.UNAUTHORIZED) {
                    revoked++;
                    continue;
                }
                if (result.status() == BindingStatus.MISSING) {
                    added++;
                }
                entries.add(new AuthorizedKeyEntry(result.keyType(), result.keyMaterial(), result.comment()));
            }
            if (entries.isEmpty() && !revokeOrphaned) {
                continue;
            }
            plans.add(new RemediationPlan(
                    entry.getKey(),
                    List.copyOf(entries),
                    AuthorizedKeysCodec.serialize(entries),
                    added,
                    revoked
            ));
        }
        return plans;
    }
}
