package io.authkeys.runtime;

import io.authkeys.model.BindingKey;
import io.authkeys.model.BindingStatus;
import io.authkeys.model.DiscoveredBinding;
import io.authkeys.model.ExpectedBinding;
import io.authkeys.model.ReconciliationResult;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classifies expected against discovered bindings on (host, account, material).
 * Key type and comment ride along for display and never take part in matching.
 */
public final class ReconciliationEngine {
    private ReconciliationEngine() {
    }

    public static List<ReconciliationResult> classify(
            Collection<ExpectedBinding> expected,
            Collection<DiscoveredBinding> discovered
    ) {
        Map<BindingKey, ExpectedBinding> expectedByKey = new LinkedHashMap<>();
        for (ExpectedBinding binding : expected) {
            expectedByKey.putIfAbsent(binding.key(), binding);
        }
        Map<BindingKey, DiscoveredBinding> discoveredByKey = new LinkedHashMap<>();
        for (DiscoveredBinding binding : discovered) {
            discoveredByKey.putIfAbsent(binding.key(), binding);
        }

        List<ReconciliationResult> out = new ArrayList<>(expectedByKey.size() + discoveredByKey.size());
        for (ExpectedBinding binding : expectedByKey.values()) {
            BindingStatus status = discoveredByKey.containsKey(binding.key())
                    ? BindingStatus.MATCHED
                    : BindingStatus.MISSING;
            out.add(new ReconciliationResult(
                    binding.host(),
                    binding.account(),
                    binding.keyType(),
                    binding.keyMaterial(),
                    binding.identityLabel(),
                    status
            ));
        }
        for (DiscoveredBinding binding : discoveredByKey.values()) {
            if (expectedByKey.containsKey(binding.key())) {
                continue;
            }
            out.add(new ReconciliationResult(
                    binding.host(),
                    binding.account(),
                    binding.keyType(),
                    binding.keyMaterial(),
                    binding.comment(),
                    BindingStatus.UNAUTHORIZED
            ));
        }
        return out;
    }
}
