package io.authkeys.runtime;

import io.authkeys.model.DiscoveredBinding;
import io.authkeys.model.HostAccount;
import io.authkeys.model.PairFailure;

import java.util.List;
import java.util.Set;

/**
 * Everything the fetch phase learned, handed to reconciliation once every task has joined.
 *
 * @param fetched pairs whose file was read (an absent file counts as read)
 */
public record FetchContext(
        List<HostAccount> universe,
        Set<HostAccount> fetched,
        List<DiscoveredBinding> discovered,
        List<PairFailure> failures
) {
}
