package io.authkeys.runtime;

import io.authkeys.config.AuthKeysConfig;
import io.authkeys.credential.PromptBroker;
import io.authkeys.credential.PromptUnavailableException;
import io.authkeys.credential.ScriptedTerminal;
import io.authkeys.model.AccessGrant;
import io.authkeys.model.BindingStatus;
import io.authkeys.model.DiscoveredBinding;
import io.authkeys.model.HostAccount;
import io.authkeys.model.HostSpec;
import io.authkeys.model.Identity;
import io.authkeys.model.KeyRecord;
import io.authkeys.model.PairFailure;
import io.authkeys.model.Policy;
import io.authkeys.model.ReconciliationResult;
import io.authkeys.observability.RunReporter;
import io.authkeys.transport.InMemoryTransport;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class AuditRuntimeTest {
    private static final HostAccount DB1_DEPLOY = new HostAccount("db1", "deploy");
    private static final HostAccount DB2_DEPLOY = new HostAccount("db2", "deploy");

    @Test
    void auditFlagsForeignKeyAndFixRemovesIt() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport()
                .acceptKey(DB1_DEPLOY)
                .file(DB1_DEPLOY, "ssh-ed25519 K1 alice@laptop\nssh-rsa K2 mallory\n");
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            Policy policy = policy(List.of(new HostSpec("db1", List.of("deploy"))));

            AuditReport audit = runtime.audit(policy);

            Assertions.assertEquals(List.of(
                    new ReconciliationResult("db1", "deploy", "ssh-ed25519", "K1", "alice-laptop", BindingStatus.MATCHED),
                    new ReconciliationResult("db1", "deploy", "ssh-rsa", "K2", "mallory", BindingStatus.UNAUTHORIZED)
            ), audit.results());
            Assertions.assertFalse(audit.clean());

            FixReport fix = runtime.fix(policy, FixOptions.defaults(), FixConfirmation.always());

            Assertions.assertEquals(FixReport.Decision.APPLIED, fix.decision());
            Assertions.assertEquals(List.of(DB1_DEPLOY), fix.outcome().applied());
            Assertions.assertEquals(List.of("deploy@db1"), transport.uploads());
            Assertions.assertEquals("ssh-ed25519 K1 alice-laptop\n", transport.file(DB1_DEPLOY));

            AuditReport after = runtime.audit(policy);
            Assertions.assertTrue(after.clean());
            Assertions.assertEquals(1L, after.count(BindingStatus.MATCHED));

            FixReport again = runtime.fix(policy, FixOptions.defaults(), FixConfirmation.always());
            Assertions.assertEquals(FixReport.Decision.NOTHING_TO_DO, again.decision());
            Assertions.assertEquals(1, transport.uploads().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void absentFileMeansEveryExpectedKeyIsMissing() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport().acceptKey(DB1_DEPLOY);
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            Policy policy = policy(List.of(new HostSpec("db1", List.of("deploy"))));

            AuditReport audit = runtime.audit(policy);

            Assertions.assertTrue(audit.failures().isEmpty());
            Assertions.assertEquals(1L, audit.count(BindingStatus.MISSING));

            runtime.fix(policy, FixOptions.defaults(), FixConfirmation.always());
            Assertions.assertEquals("ssh-ed25519 K1 alice-laptop\n", transport.file(DB1_DEPLOY));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreachableHostIsIsolatedFromTheRestOfTheFleet() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport()
                .acceptKey(DB1_DEPLOY)
                .acceptKey(DB2_DEPLOY)
                .unreachable("db2");
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            Policy policy = policy(List.of(
                    new HostSpec("db1", List.of("deploy")),
                    new HostSpec("db2", List.of("deploy"))
            ), List.of(new AccessGrant("db1", "deploy"), new AccessGrant("db2", "deploy")));

            AuditReport audit = runtime.audit(policy);

            Assertions.assertEquals(1, audit.failures().size());
            PairFailure failure = audit.failures().get(0);
            Assertions.assertEquals(DB2_DEPLOY, failure.target());
            Assertions.assertEquals(PairFailure.PHASE_FETCH, failure.phase());
            Assertions.assertEquals("TransportException", failure.errorType());
            // db2 was never read, so nothing about it is classified or planned
            Assertions.assertEquals(List.of(DB1_DEPLOY), audit.results().stream().map(ReconciliationResult::target).toList());

            FixReport fix = runtime.fix(policy, FixOptions.defaults(), FixConfirmation.always());
            Assertions.assertEquals(List.of(DB1_DEPLOY), fix.plans().stream().map(RemediationPlan::target).toList());
            Assertions.assertEquals(List.of("deploy@db1"), transport.uploads());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void uploadFailureOnOneAccountDoesNotStopOthers() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport()
                .acceptKey(DB1_DEPLOY)
                .acceptKey(DB2_DEPLOY)
                .withoutSshDirectory(DB1_DEPLOY);
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            Policy policy = policy(List.of(
                    new HostSpec("db1", List.of("deploy")),
                    new HostSpec("db2", List.of("deploy"))
            ), List.of(new AccessGrant("db1", "deploy"), new AccessGrant("db2", "deploy")));

            FixReport fix = runtime.fix(policy, FixOptions.defaults(), FixConfirmation.always());

            Assertions.assertEquals(FixReport.Decision.APPLIED, fix.decision());
            Assertions.assertEquals(List.of(DB2_DEPLOY), fix.outcome().applied());
            Assertions.assertEquals(1, fix.outcome().failures().size());
            Assertions.assertEquals(PairFailure.PHASE_REMEDIATE, fix.outcome().failures().get(0).phase());
            Assertions.assertEquals(DB1_DEPLOY, fix.outcome().failures().get(0).target());
            Assertions.assertNull(transport.file(DB1_DEPLOY));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void declinedFixLeavesRemoteFilesUntouched() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        String original = "ssh-rsa K2 mallory\n";
        InMemoryTransport transport = new InMemoryTransport().acceptKey(DB1_DEPLOY).file(DB1_DEPLOY, original);
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            Policy policy = policy(List.of(new HostSpec("db1", List.of("deploy"))));

            FixReport fix = runtime.fix(policy, FixOptions.defaults(), plans -> false);

            Assertions.assertEquals(FixReport.Decision.DECLINED, fix.decision());
            Assertions.assertEquals(1, fix.plans().size());
            Assertions.assertTrue(transport.uploads().isEmpty());
            Assertions.assertEquals(original, transport.file(DB1_DEPLOY));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void upToDateFilesAreOnlyRewrittenWhenForced() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport()
                .acceptKey(DB1_DEPLOY)
                .file(DB1_DEPLOY, "ssh-ed25519 K1 alice@laptop\n");
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            Policy policy = policy(List.of(new HostSpec("db1", List.of("deploy"))));

            FixReport unforced = runtime.fix(policy, FixOptions.defaults(), FixConfirmation.always());
            Assertions.assertEquals(FixReport.Decision.NOTHING_TO_DO, unforced.decision());
            Assertions.assertTrue(transport.uploads().isEmpty());

            FixReport forced = runtime.fix(policy, new FixOptions(true, false), FixConfirmation.always());
            Assertions.assertEquals(FixReport.Decision.APPLIED, forced.decision());
            Assertions.assertEquals("ssh-ed25519 K1 alice-laptop\n", transport.file(DB1_DEPLOY));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stagedFilesAreRemovedAfterUpload() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport().acceptKey(DB1_DEPLOY);
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal())) {
            try (AuditRuntime runtime = runtime(root, transport, prompts)) {
                runtime.fix(policy(List.of(new HostSpec("db1", List.of("deploy")))),
                        FixOptions.defaults(), FixConfirmation.always());

                Assertions.assertEquals(1, transport.stagedPaths().size());
                for (String staged : transport.stagedPaths()) {
                    Assertions.assertFalse(Files.exists(Path.of(staged)));
                }
            }
            try (Stream<Path> left = Files.list(root)) {
                Assertions.assertEquals(0, left.count());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void passwordIsAskedOnceAcrossFetchAndUpload() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport().acceptPassword(DB1_DEPLOY, "pw");
        ScriptedTerminal terminal = new ScriptedTerminal("pw");
        try (PromptBroker prompts = new PromptBroker(terminal);
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            FixReport fix = runtime.fix(policy(List.of(new HostSpec("db1", List.of("deploy")))),
                    FixOptions.defaults(), FixConfirmation.always());

            Assertions.assertEquals(List.of(DB1_DEPLOY), fix.outcome().applied());
            Assertions.assertEquals(1, terminal.prompts().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void grantsToUndeclaredAccountsAreReportedButNotContacted() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport().acceptKey(DB1_DEPLOY);
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            Policy policy = policy(List.of(new HostSpec("db1", List.of("deploy"))),
                    List.of(new AccessGrant("db1", "deploy"), new AccessGrant("db9", "root")));

            AuditReport audit = runtime.audit(policy);

            Assertions.assertEquals(List.of(new HostAccount("db9", "root")), audit.undeclaredGrants());
            Assertions.assertEquals(List.of(DB1_DEPLOY), audit.universe());
            Assertions.assertTrue(audit.failures().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void undeclaredGrantsAreClassifiedMissingButNeverRewritten() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport()
                .acceptKey(DB1_DEPLOY)
                .file(DB1_DEPLOY, "ssh-ed25519 K1 alice@laptop\n");
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            Policy policy = policy(List.of(new HostSpec("db1", List.of("deploy"))),
                    List.of(new AccessGrant("db1", "deploy"), new AccessGrant("db9", "root")));

            AuditReport audit = runtime.audit(policy);

            Assertions.assertEquals(List.of(
                    new ReconciliationResult("db1", "deploy", "ssh-ed25519", "K1", "alice-laptop", BindingStatus.MATCHED),
                    new ReconciliationResult("db9", "root", "ssh-ed25519", "K1", "alice-laptop", BindingStatus.MISSING)
            ), audit.results());
            Assertions.assertEquals(1L, audit.count(BindingStatus.MISSING));
            Assertions.assertFalse(audit.clean());

            FixReport fix = runtime.fix(policy, FixOptions.defaults(), FixConfirmation.always());

            Assertions.assertEquals(FixReport.Decision.NOTHING_TO_DO, fix.decision());
            Assertions.assertTrue(transport.uploads().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void repeatedMaterialInOneFileIsDiscoveredOnce() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport()
                .acceptKey(DB1_DEPLOY)
                .file(DB1_DEPLOY, "ssh-ed25519 K1 first\nssh-rsa K1 second\nssh-rsa K2 mallory\n");
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            FetchContext fetch = runtime.discover(policy(List.of(new HostSpec("db1", List.of("deploy")))));

            Assertions.assertEquals(List.of(
                    new DiscoveredBinding("db1", "deploy", "ssh-ed25519", "K1", "first"),
                    new DiscoveredBinding("db1", "deploy", "ssh-rsa", "K2", "mallory")
            ), fetch.discovered());
            Assertions.assertEquals(Set.of(DB1_DEPLOY), fetch.fetched());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void auditingUnchangedHostsTwiceGivesTheSameResults() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport()
                .acceptKey(DB1_DEPLOY)
                .acceptKey(DB2_DEPLOY)
                .file(DB1_DEPLOY, "ssh-ed25519 K1 alice@laptop\nssh-rsa K2 mallory\n")
                .file(DB2_DEPLOY, "ssh-rsa K3 bob\n");
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            Policy policy = policy(List.of(
                    new HostSpec("db1", List.of("deploy")),
                    new HostSpec("db2", List.of("deploy"))
            ), List.of(new AccessGrant("db1", "deploy"), new AccessGrant("db2", "deploy")));

            AuditReport first = runtime.audit(policy);
            AuditReport second = runtime.audit(policy);

            Assertions.assertEquals(first.results(), second.results());
            Assertions.assertEquals(first.counts(), second.counts());
            Assertions.assertEquals(4, first.results().size());
            Assertions.assertTrue(transport.uploads().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelStopsPromptingAndRemovesStagingDirectory() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport()
                .acceptKey(DB1_DEPLOY)
                .acceptPassword(DB2_DEPLOY, "pw");
        ScriptedTerminal terminal = new ScriptedTerminal("pw");
        try (PromptBroker prompts = new PromptBroker(terminal);
             AuditRuntime runtime = runtime(root, transport, prompts)) {
            runtime.fix(policy(List.of(new HostSpec("db1", List.of("deploy")))),
                    FixOptions.defaults(), FixConfirmation.always());
            try (Stream<Path> staged = Files.list(root)) {
                Assertions.assertEquals(1, staged.count());
            }

            runtime.cancel();

            try (Stream<Path> left = Files.list(root)) {
                Assertions.assertEquals(0, left.count());
            }
            Assertions.assertTrue(prompts.isClosed());
            Assertions.assertThrows(PromptUnavailableException.class, () -> prompts.requestSecret("pw: "));

            AuditReport audit = runtime.audit(policy(List.of(new HostSpec("db2", List.of("deploy"))),
                    List.of(new AccessGrant("db2", "deploy"))));
            Assertions.assertEquals(1, audit.failures().size());
            Assertions.assertEquals("AuthenticationExhaustedException", audit.failures().get(0).errorType());
            Assertions.assertTrue(terminal.prompts().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failingReporterDoesNotTurnAnUploadIntoAFailure() throws Exception {
        Path root = Files.createTempDirectory("authkeys-runtime-");
        InMemoryTransport transport = new InMemoryTransport().acceptKey(DB1_DEPLOY);
        RunReporter brokenLog = event -> {
            if (event.action().equals("remediate")) {
                throw new IllegalStateException("Failed to write audit log");
            }
        };
        try (PromptBroker prompts = new PromptBroker(new ScriptedTerminal());
             AuditRuntime runtime = new AuditRuntime(
                     AuthKeysConfig.defaults().withPrivateKeyPath("/keys/id_ed25519").withStagingRoot(root),
                     transport, prompts, brokenLog, Map.of())) {
            Policy policy = policy(List.of(new HostSpec("db1", List.of("deploy"))));

            Assertions.assertThrows(IllegalStateException.class,
                    () -> runtime.fix(policy, FixOptions.defaults(), FixConfirmation.always()));

            Assertions.assertEquals(List.of("deploy@db1"), transport.uploads());
            Assertions.assertEquals("ssh-ed25519 K1 alice-laptop\n", transport.file(DB1_DEPLOY));
            Assertions.assertEquals(0, transport.openSessions());
        } finally {
            deleteRecursively(root);
        }
    }

    private static AuditRuntime runtime(Path root, InMemoryTransport transport, PromptBroker prompts) {
        AuthKeysConfig config = AuthKeysConfig.defaults()
                .withPrivateKeyPath("/keys/id_ed25519")
                .withStagingRoot(root);
        return new AuditRuntime(config, transport, prompts, RunReporter.none(), Map.of());
    }

    private static Policy policy(List<HostSpec> hosts) {
        return policy(hosts, List.of(new AccessGrant("db1", "deploy")));
    }

    private static Policy policy(List<HostSpec> hosts, List<AccessGrant> grants) {
        KeyRecord k1 = new KeyRecord("ssh-ed25519", "K1", "alice-laptop", false, grants);
        return new Policy(hosts, List.of(new Identity("alice@example.com", "Alice", List.of(k1))));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
