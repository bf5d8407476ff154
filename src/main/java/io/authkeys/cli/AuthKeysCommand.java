package io.authkeys.cli;

import io.authkeys.config.AuthKeysConfig;
import io.authkeys.config.CredentialSeedLoader;
import io.authkeys.config.PolicyLoader;
import io.authkeys.credential.ConsolePrompter;
import io.authkeys.credential.PromptBroker;
import io.authkeys.credential.PromptUnavailableException;
import io.authkeys.credential.TerminalPrompter;
import io.authkeys.model.BindingStatus;
import io.authkeys.model.Policy;
import io.authkeys.observability.AuditLogger;
import io.authkeys.observability.ConsoleReporter;
import io.authkeys.observability.RunReporter;
import io.authkeys.runtime.AuditReport;
import io.authkeys.runtime.AuditRuntime;
import io.authkeys.runtime.ConfigExpander;
import io.authkeys.runtime.Expansion;
import io.authkeys.runtime.FetchContext;
import io.authkeys.runtime.FixConfirmation;
import io.authkeys.runtime.FixOptions;
import io.authkeys.runtime.FixReport;
import io.authkeys.transport.JschTransport;
import io.authkeys.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
        name = "authkeys",
        mixinStandardHelpOptions = true,
        description = "Audit and reconcile authorized_keys across a fleet of hosts",
        subcommands = {
                AuthKeysCommand.AuditCommand.class,
                AuthKeysCommand.FixCommand.class,
                AuthKeysCommand.DiscoverCommand.class,
                AuthKeysCommand.ExpectedCommand.class
        }
)
public final class AuthKeysCommand implements Runnable {
    static final int EXIT_OK = 0;
    static final int EXIT_DRIFT = 2;
    static final int EXIT_DECLINED = 3;

    @Option(names = {"--policy"}, description = "Policy file (YAML or JSON)", defaultValue = "config.yaml")
    String policy;

    @Option(names = {"--passwords"}, description = "Password seed file", defaultValue = "passwords.yaml")
    String passwords;

    @Option(names = {"--settings"}, description = "Settings file (YAML)")
    String settings;

    @Option(names = {"-i", "--identity"}, description = "Private key used for key-based login on every host")
    String identity;

    @Option(names = {"--timeout-ms"}, description = "Per-connection timeout in milliseconds")
    Integer timeoutMs;

    @Option(names = {"--max-parallel"}, description = "Cap on concurrent host tasks (0 = one per account)")
    Integer maxParallel;

    @Option(names = {"--audit-log"}, description = "Append JSONL audit events to this file")
    String auditLog;

    @Option(names = {"--no-prompt"}, description = "Never prompt for passwords")
    boolean noPrompt;

    @Option(names = {"-v", "--verbose"}, description = "Print progress events to stderr")
    boolean verbose;

    @Option(names = {"--json"}, description = "Print reports as JSON")
    boolean json;

    PrintStream out = System.out;

    @Override
    public void run() {
        out.println("Use subcommands: audit | fix | discover | expected");
    }

    Policy loadPolicy() {
        return PolicyLoader.load(Paths.get(policy));
    }

    AuthKeysConfig config() {
        AuthKeysConfig config = AuthKeysConfig.load(settings == null ? null : Paths.get(settings));
        if (identity != null) {
            config = config.withPrivateKeyPath(identity);
        }
        if (timeoutMs != null) {
            config = config.withConnectTimeoutMs(timeoutMs);
        }
        if (maxParallel != null) {
            config = config.withMaxParallel(maxParallel);
        }
        if (auditLog != null) {
            config = config.withAuditLog(Path.of(auditLog));
        }
        return config;
    }

    RunReporter reporter(AuthKeysConfig config) {
        List<RunReporter> reporters = new ArrayList<>();
        if (config.auditLog() != null) {
            reporters.add(new AuditLogger(config.auditLog()));
        }
        if (verbose) {
            reporters.add(new ConsoleReporter(System.err));
        }
        return RunReporter.fanOut(reporters.toArray(new RunReporter[0]));
    }

    AuditRuntime runtime(AuthKeysConfig config) {
        TerminalPrompter terminal = noPrompt ? TerminalPrompter.unavailable() : ConsolePrompter.system();
        AuditRuntime runtime = new AuditRuntime(
                config,
                new JschTransport(config),
                new PromptBroker(terminal),
                reporter(config),
                CredentialSeedLoader.load(Paths.get(passwords))
        );
        Runtime.getRuntime().addShutdownHook(new Thread(runtime::cancel, "authkeys-shutdown"));
        return runtime;
    }

    void printAudit(AuditReport report) {
        if (!report.results().isEmpty()) {
            out.print(ReportTables.results(report.results()));
        }
        out.printf("matched=%d missing=%d unauthorized=%d failures=%d%n",
                report.count(BindingStatus.MATCHED),
                report.count(BindingStatus.MISSING),
                report.count(BindingStatus.UNAUTHORIZED),
                report.failures().size());
        if (!report.failures().isEmpty()) {
            out.println("Unreachable or failed accounts:");
            out.print(ReportTables.failures(report.failures()));
        }
        if (!report.undeclaredGrants().isEmpty()) {
            out.println("Grants to accounts not declared under hosts (never fetched or rewritten):");
            out.print(ReportTables.pairs(report.undeclaredGrants()));
        }
    }

    @Command(name = "audit", description = "Fetch every declared account and classify its keys")
    static final class AuditCommand implements Callable<Integer> {
        @ParentCommand
        AuthKeysCommand parent;

        @Override
        public Integer call() throws Exception {
            Policy policy = parent.loadPolicy();
            AuditReport report;
            try (AuditRuntime runtime = parent.runtime(parent.config())) {
                report = runtime.audit(policy);
            }
            if (parent.json) {
                parent.out.println(Jsons.toJson(report));
            } else {
                parent.printAudit(report);
            }
            return report.clean() ? EXIT_OK : EXIT_DRIFT;
        }
    }

    @Command(name = "fix", description = "Audit, then rewrite authorized_keys files to match the policy")
    static final class FixCommand implements Callable<Integer> {
        @ParentCommand
        AuthKeysCommand parent;

        @Option(names = {"-y", "--yes"}, description = "Apply without asking for confirmation")
        boolean yes;

        @Option(names = {"--force"}, description = "Upload files that are already up to date")
        boolean force;

        @Option(names = {"--revoke-orphaned"}, description = "Empty the file of accounts holding only unauthorized keys")
        boolean revokeOrphaned;

        @Override
        public Integer call() throws Exception {
            Policy policy = parent.loadPolicy();
            FixReport report;
            try (AuditRuntime runtime = parent.runtime(parent.config())) {
                FixConfirmation confirmation = yes ? FixConfirmation.always() : plans -> {
                    parent.out.println("Planned changes:");
                    parent.out.print(ReportTables.plans(plans));
                    parent.out.flush();
                    return askUser(runtime, plans.size());
                };
                report = runtime.fix(policy, new FixOptions(force, revokeOrphaned), confirmation);
            }
            if (parent.json) {
                parent.out.println(Jsons.toJson(report));
            } else {
                parent.printAudit(report.audit());
                printOutcome(report);
            }
            if (report.decision() == FixReport.Decision.DECLINED) {
                return EXIT_DECLINED;
            }
            boolean failed = !report.audit().failures().isEmpty() || !report.outcome().failures().isEmpty();
            return failed ? EXIT_DRIFT : EXIT_OK;
        }

        private boolean askUser(AuditRuntime runtime, int planCount) throws InterruptedException {
            try {
                return runtime.prompts().confirm("Upload " + planCount + " authorized_keys file(s)? (y/N): ");
            } catch (PromptUnavailableException e) {
                parent.out.println("Cannot ask for confirmation (" + e.getMessage() + "); re-run with --yes to apply.");
                return false;
            }
        }

        private void printOutcome(FixReport report) {
            switch (report.decision()) {
                case NOTHING_TO_DO -> parent.out.println("Nothing to fix.");
                case DECLINED -> parent.out.println("Fix cancelled; no remote file was changed.");
                case APPLIED -> {
                    parent.out.printf("Uploaded %d file(s).%n", report.outcome().applied().size());
                    if (!report.outcome().failures().isEmpty()) {
                        parent.out.println("Upload failures:");
                        parent.out.print(ReportTables.failures(report.outcome().failures()));
                    }
                }
            }
        }
    }

    @Command(name = "discover", description = "Fetch and list the keys currently installed on every declared account")
    static final class DiscoverCommand implements Callable<Integer> {
        @ParentCommand
        AuthKeysCommand parent;

        @Override
        public Integer call() throws Exception {
            Policy policy = parent.loadPolicy();
            FetchContext fetch;
            try (AuditRuntime runtime = parent.runtime(parent.config())) {
                fetch = runtime.discover(policy);
            }
            if (parent.json) {
                parent.out.println(Jsons.toJson(fetch));
            } else {
                parent.out.print(ReportTables.discovered(fetch.discovered()));
                if (!fetch.failures().isEmpty()) {
                    parent.out.print(ReportTables.failures(fetch.failures()));
                }
            }
            return fetch.failures().isEmpty() ? EXIT_OK : EXIT_DRIFT;
        }
    }

    @Command(name = "expected", description = "List the bindings the policy expects, without contacting any host")
    static final class ExpectedCommand implements Callable<Integer> {
        @ParentCommand
        AuthKeysCommand parent;

        @Override
        public Integer call() {
            Expansion expansion = ConfigExpander.expand(parent.loadPolicy());
            if (parent.json) {
                parent.out.println(Jsons.toJson(expansion));
            } else {
                parent.out.print(ReportTables.expected(expansion.expected()));
                if (!expansion.undeclaredGrants().isEmpty()) {
                    parent.out.println("Grants to accounts not declared under hosts:");
                    parent.out.print(ReportTables.pairs(expansion.undeclaredGrants()));
                }
            }
            return EXIT_OK;
        }
    }
}
