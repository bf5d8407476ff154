package io.authkeys.runtime;

import io.authkeys.model.AccessGrant;
import io.authkeys.model.ExpectedBinding;
import io.authkeys.model.HostAccount;
import io.authkeys.model.HostSpec;
import io.authkeys.model.Identity;
import io.authkeys.model.KeyRecord;
import io.authkeys.model.Policy;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class ConfigExpander {
    private ConfigExpander() {
    }

    public static Expansion expand(Policy policy) {
        List<HostAccount> universe = universe(policy);
        Set<HostAccount> declared = new LinkedHashSet<>(universe);
        Set<ExpectedBinding> expected = new LinkedHashSet<>();
        Set<HostAccount> undeclared = new LinkedHashSet<>();
        for (Identity identity : policy.users()) {
            for (KeyRecord key : identity.keys()) {
                if (key.admin()) {
                    for (HostAccount target : universe) {
                        expected.add(binding(target, key, identity));
                    }
                    continue;
                }
                for (AccessGrant grant : key.access()) {
                    HostAccount target = grant.target();
                    expected.add(binding(target, key, identity));
                    if (!declared.contains(target)) {
                        undeclared.add(target);
                    }
                }
            }
        }
        return new Expansion(universe, expected, new ArrayList<>(undeclared));
    }

    public static List<HostAccount> universe(Policy policy) {
        Set<HostAccount> out = new LinkedHashSet<>();
        for (HostSpec host : policy.hosts()) {
            for (String account : host.users()) {
                out.add(new HostAccount(host.host(), account));
            }
        }
        return new ArrayList<>(out);
    }

    private static ExpectedBinding binding(HostAccount target, KeyRecord key, Identity identity) {
        return new ExpectedBinding(
                target.host(),
                target.account(),
                key.type(),
                key.key(),
                key.hostname(),
                identity.email()
        );
    }
}
