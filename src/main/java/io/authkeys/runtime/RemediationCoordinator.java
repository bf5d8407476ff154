package io.authkeys.runtime;

import io.authkeys.credential.CredentialBroker;
import io.authkeys.model.HostAccount;
import io.authkeys.model.PairFailure;
import io.authkeys.observability.RunEvent;
import io.authkeys.observability.RunReporter;
import io.authkeys.transport.RemotePaths;
import io.authkeys.transport.RemoteSession;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Uploads planned files, one concurrent task per account. The remote file is replaced wholesale. */
public final class RemediationCoordinator {
    private final CredentialBroker credentials;
    private final StagingArea staging;
    private final RunReporter reporter;
    private final int maxParallel;

    public RemediationCoordinator(CredentialBroker credentials, StagingArea staging, RunReporter reporter, int maxParallel) {
        this.credentials = credentials;
        this.staging = staging;
        this.reporter = reporter == null ? RunReporter.none() : reporter;
        this.maxParallel = maxParallel;
    }

    public RemediationOutcome apply(List<RemediationPlan> plans) throws InterruptedException {
        if (plans.isEmpty()) {
            return RemediationOutcome.empty();
        }
        Map<HostAccount, RemediationPlan> byTarget = new LinkedHashMap<>();
        for (RemediationPlan plan : plans) {
            byTarget.put(plan.target(), plan);
        }
        PairTaskGroup.Outcome<String> outcome = PairTaskGroup.runAll(
                PairFailure.PHASE_REMEDIATE,
                byTarget.keySet(),
                maxParallel,
                target -> upload(byTarget.get(target))
        );
        // Recorded after the join; the outcome above is already final.
        for (Map.Entry<HostAccount, String> applied : outcome.results().entrySet()) {
            RemediationPlan plan = byTarget.get(applied.getKey());
            reporter.record(RunEvent.of("remediate", applied.getKey(), "ok", Map.of(
                    "path", applied.getValue(),
                    "keys", plan.entries().size(),
                    "added", plan.added(),
                    "revoked", plan.revoked()
            )));
        }
        for (PairFailure failure : outcome.failures()) {
            reporter.record(RunEvent.of("remediate", failure.target(), "failed",
                    Map.of("error", failure.errorType(), "message", failure.message())));
        }
        return new RemediationOutcome(new ArrayList<>(outcome.results().keySet()), outcome.failures());
    }

    private String upload(RemediationPlan plan) throws Exception {
        HostAccount target = plan.target();
        String remotePath = RemotePaths.authorizedKeys(target.account());
        try (RemoteSession session = credentials.authenticate(target)) {
            Path staged = staging.stage(target, plan.content());
            try {
                session.upload(staged, remotePath);
            } finally {
                Files.deleteIfExists(staged);
            }
        }
        return remotePath;
    }
}
