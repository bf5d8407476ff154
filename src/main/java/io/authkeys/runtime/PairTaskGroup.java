package io.authkeys.runtime;

import io.authkeys.model.HostAccount;
import io.authkeys.model.PairFailure;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one task per (host, account) pair and joins them at a single point.
 *
 * <p>A failing task is recorded as a {@link PairFailure} and never cancels its
 * siblings. Results are keyed by pair and returned in submission order, not in
 * completion order. Interrupting the joining thread cancels every task still
 * running.
 */
final class PairTaskGroup {
    interface PairTask<T> {
        T run(HostAccount target) throws Exception;
    }

    record Outcome<T>(
            Map<HostAccount, T> results,
            List<PairFailure> failures
    ) {
    }

    private PairTaskGroup() {
    }

    static <T> Outcome<T> runAll(
            String phase,
            Collection<HostAccount> targets,
            int maxParallel,
            PairTask<T> task
    ) throws InterruptedException {
        Map<HostAccount, T> results = new LinkedHashMap<>();
        List<PairFailure> failures = new ArrayList<>();
        if (targets.isEmpty()) {
            return new Outcome<>(results, failures);
        }
        int threads = maxParallel <= 0 ? targets.size() : Math.min(maxParallel, targets.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads, namedThreads(phase));
        Map<HostAccount, Future<T>> futures = new LinkedHashMap<>();
        try {
            for (HostAccount target : targets) {
                futures.put(target, executor.submit(() -> task.run(target)));
            }
            for (Map.Entry<HostAccount, Future<T>> entry : futures.entrySet()) {
                try {
                    results.put(entry.getKey(), entry.getValue().get());
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() == null ? e : e.getCause();
                    failures.add(PairFailure.of(entry.getKey(), phase, cause));
                }
            }
        } catch (InterruptedException e) {
            for (Future<T> future : futures.values()) {
                future.cancel(true);
            }
            throw e;
        } finally {
            executor.shutdownNow();
        }
        return new Outcome<>(results, failures);
    }

    private static ThreadFactory namedThreads(String phase) {
        AtomicInteger counter = new AtomicInteger();
        String prefix = "authkeys-" + phase.toLowerCase(Locale.ROOT) + "-";
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
