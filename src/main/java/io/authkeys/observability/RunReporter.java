package io.authkeys.observability;

import java.util.List;

/**
 * Sink for run progress. Passed into each component; implementations must be
 * safe to call from concurrent pair tasks.
 */
public interface RunReporter {
    void record(RunEvent event);

    static RunReporter none() {
        return event -> {
        };
    }

    static RunReporter fanOut(RunReporter... reporters) {
        List<RunReporter> targets = List.of(reporters);
        return event -> {
            for (RunReporter reporter : targets) {
                reporter.record(event);
            }
        };
    }
}
