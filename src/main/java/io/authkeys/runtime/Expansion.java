package io.authkeys.runtime;

import io.authkeys.model.ExpectedBinding;
import io.authkeys.model.HostAccount;

import java.util.List;
import java.util.Set;

/**
 * @param universe every declared (host, account) pair, in policy order
 * @param expected bindings the policy asks for
 * @param undeclaredGrants granted pairs that no host entry declares
 */
public record Expansion(
        List<HostAccount> universe,
        Set<ExpectedBinding> expected,
        List<HostAccount> undeclaredGrants
) {
}
