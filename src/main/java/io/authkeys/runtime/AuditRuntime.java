package io.authkeys.runtime;

import io.authkeys.config.AuthKeysConfig;
import io.authkeys.credential.CredentialBroker;
import io.authkeys.credential.PromptBroker;
import io.authkeys.model.BindingStatus;
import io.authkeys.model.ExpectedBinding;
import io.authkeys.model.HostAccount;
import io.authkeys.model.PairFailure;
import io.authkeys.model.Policy;
import io.authkeys.model.ReconciliationResult;
import io.authkeys.observability.RunEvent;
import io.authkeys.observability.RunReporter;
import io.authkeys.transport.SshTransport;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The two operations offered to the CLI.
 *
 * <p>{@link #audit(Policy)} expands the policy, fetches every declared account and
 * classifies the result. {@link #fix(Policy, FixOptions, FixConfirmation)} runs an
 * audit, plans full replacements and uploads them once confirmed. Phases never
 * overlap: every fetch task has joined before classification, and classification
 * is complete before the first upload starts.
 */
public final class AuditRuntime implements AutoCloseable {
    private final AuthKeysConfig config;
    private final PromptBroker prompts;
    private final RunReporter reporter;
    private final CredentialBroker credentials;
    private final Object stagingLock;
    private StagingArea staging;

    public AuditRuntime(
            AuthKeysConfig config,
            SshTransport transport,
            PromptBroker prompts,
            RunReporter reporter,
            Map<String, String> credentialSeed
    ) {
        this.config = config;
        this.prompts = prompts;
        this.reporter = reporter == null ? RunReporter.none() : reporter;
        this.credentials = new CredentialBroker(transport, config.privateKeyPath(), prompts, this.reporter, credentialSeed);
        this.stagingLock = new Object();
    }

    public CredentialBroker credentials() {
        return credentials;
    }

    public PromptBroker prompts() {
        return prompts;
    }

    /** Fetch phase only: what is on the hosts right now, without classification. */
    public FetchContext discover(Policy policy) throws InterruptedException {
        FetchCoordinator coordinator = new FetchCoordinator(
                new RemoteKeyFetcher(credentials, reporter),
                reporter,
                config.maxParallel()
        );
        return coordinator.fetchAll(ConfigExpander.universe(policy));
    }

    public AuditReport audit(Policy policy) throws InterruptedException {
        Instant startedAt = Instant.now();
        Expansion expansion = ConfigExpander.expand(policy);
        reporter.record(RunEvent.of("audit", "start", Map.of(
                "pairs", expansion.universe().size(),
                "expected", expansion.expected().size()
        )));
        for (HostAccount undeclared : expansion.undeclaredGrants()) {
            reporter.record(RunEvent.of("policy.undeclared_grant", undeclared, "not_fetched"));
        }

        FetchCoordinator coordinator = new FetchCoordinator(
                new RemoteKeyFetcher(credentials, reporter),
                reporter,
                config.maxParallel()
        );
        FetchContext fetch = coordinator.fetchAll(expansion.universe());

        // Pairs that could not be read are reported as failures, not as missing keys.
        Set<HostAccount> failed = fetch.failures().stream()
                .map(PairFailure::target)
                .collect(Collectors.toSet());
        List<ExpectedBinding> auditable = expansion.expected().stream()
                .filter(binding -> !failed.contains(binding.target()))
                .toList();
        List<ReconciliationResult> results = ReconciliationEngine.classify(auditable, fetch.discovered());

        AuditReport report = AuditReport.of(
                startedAt,
                Instant.now(),
                expansion.universe(),
                results,
                fetch.failures(),
                expansion.undeclaredGrants()
        );
        reporter.record(RunEvent.of("audit", "done", Map.of(
                "matched", report.count(BindingStatus.MATCHED),
                "missing", report.count(BindingStatus.MISSING),
                "unauthorized", report.count(BindingStatus.UNAUTHORIZED),
                "failures", report.failures().size()
        )));
        return report;
    }

    public FixReport fix(Policy policy, FixOptions options, FixConfirmation confirmation) throws InterruptedException {
        AuditReport audit = audit(policy);
        Set<HostAccount> declared = new HashSet<>(audit.universe());
        List<RemediationPlan> plans = new ArrayList<>();
        for (RemediationPlan plan : RemediationPlanner.plan(audit.results(), options.revokeOrphaned())) {
            if (!declared.contains(plan.target())) {
                // Never read, so a full replacement would drop keys nobody has seen.
                reporter.record(RunEvent.of("fix.undeclared_pair", plan.target(), "skipped"));
                continue;
            }
            if (options.force() || plan.changesRemote()) {
                plans.add(plan);
            }
        }
        if (plans.isEmpty()) {
            reporter.record(RunEvent.of("fix", "nothing_to_do", Map.of()));
            return new FixReport(audit, plans, FixReport.Decision.NOTHING_TO_DO, RemediationOutcome.empty());
        }
        if (!confirmation.approve(plans)) {
            reporter.record(RunEvent.of("fix", "declined", Map.of("plans", plans.size())));
            return new FixReport(audit, plans, FixReport.Decision.DECLINED, RemediationOutcome.empty());
        }
        RemediationCoordinator coordinator = new RemediationCoordinator(credentials, staging(), reporter, config.maxParallel());
        RemediationOutcome outcome = coordinator.apply(plans);
        reporter.record(RunEvent.of("fix", "applied", Map.of(
                "uploaded", outcome.applied().size(),
                "failures", outcome.failures().size()
        )));
        return new FixReport(audit, plans, FixReport.Decision.APPLIED, outcome);
    }

    /** Stops prompting and removes staged files. Safe to call from a shutdown hook. */
    public void cancel() {
        prompts.close();
        close();
    }

    @Override
    public void close() {
        synchronized (stagingLock) {
            if (staging != null) {
                staging.close();
                staging = null;
            }
        }
    }

    private StagingArea staging() {
        synchronized (stagingLock) {
            if (staging == null) {
                staging = StagingArea.create(config.stagingRoot(), AuthKeysConfig.DEFAULT_STAGING_PREFIX, reporter);
            }
            return staging;
        }
    }
}
