package io.authkeys.runtime;

import io.authkeys.model.DiscoveredBinding;
import io.authkeys.model.HostAccount;
import io.authkeys.model.PairFailure;
import io.authkeys.observability.RunEvent;
import io.authkeys.observability.RunReporter;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

public final class FetchCoordinator {
    private final RemoteKeyFetcher fetcher;
    private final RunReporter reporter;
    private final int maxParallel;

    public FetchCoordinator(RemoteKeyFetcher fetcher, RunReporter reporter, int maxParallel) {
        this.fetcher = fetcher;
        this.reporter = reporter == null ? RunReporter.none() : reporter;
        this.maxParallel = maxParallel;
    }

    public FetchContext fetchAll(List<HostAccount> universe) throws InterruptedException {
        PairTaskGroup.Outcome<List<DiscoveredBinding>> outcome =
                PairTaskGroup.runAll(PairFailure.PHASE_FETCH, universe, maxParallel, fetcher::fetch);
        List<DiscoveredBinding> discovered = new ArrayList<>();
        for (Map.Entry<HostAccount, List<DiscoveredBinding>> entry : outcome.results().entrySet()) {
            discovered.addAll(entry.getValue());
        }
        for (PairFailure failure : outcome.failures()) {
            reporter.record(RunEvent.of("fetch", failure.target(), "failed",
                    Map.of("error", failure.errorType(), "message", failure.message())));
        }
        return new FetchContext(
                List.copyOf(universe),
                new LinkedHashSet<>(outcome.results().keySet()),
                discovered,
                outcome.failures()
        );
    }
}
