package io.authkeys.credential;

import io.authkeys.model.HostAccount;
import io.authkeys.observability.RunEvent;
import io.authkeys.observability.RunReporter;
import io.authkeys.security.SensitiveDataMasker;
import io.authkeys.transport.AuthenticationFailedException;
import io.authkeys.transport.Credential;
import io.authkeys.transport.RemoteSession;
import io.authkeys.transport.SshTransport;
import io.authkeys.transport.TransportException;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Opens authenticated sessions for pair tasks.
 *
 * <p>Key-based login is tried first with the single configured private key. When
 * the server rejects it the task takes the prompt lock and makes up to
 * {@value #MAX_PASSWORD_ATTEMPTS} password attempts: a cached secret first, then
 * interactive prompts. The lock is held until the pair is resolved, so a second
 * task for the same pair finds the secret cached and never prompts.
 *
 * <p>One instance serves a whole run; the secret cache only grows.
 */
public final class CredentialBroker {
    public static final int MAX_PASSWORD_ATTEMPTS = 3;

    private final SshTransport transport;
    private final String privateKeyPath;
    private final PromptBroker prompts;
    private final RunReporter reporter;
    private final ConcurrentMap<String, String> secrets;
    private final ReentrantLock promptLock;

    public CredentialBroker(
            SshTransport transport,
            String privateKeyPath,
            PromptBroker prompts,
            RunReporter reporter,
            Map<String, String> seed
    ) {
        this.transport = transport;
        this.privateKeyPath = privateKeyPath == null || privateKeyPath.isBlank() ? null : privateKeyPath;
        this.prompts = prompts;
        this.reporter = reporter == null ? RunReporter.none() : reporter;
        this.secrets = new ConcurrentHashMap<>();
        this.promptLock = new ReentrantLock(true);
        if (seed != null) {
            seed.forEach((key, secret) -> {
                if (key != null && secret != null) {
                    secrets.put(key, secret);
                }
            });
        }
    }

    public RemoteSession authenticate(HostAccount target)
            throws AuthenticationExhaustedException, TransportException, InterruptedException {
        AuthenticationFailedException keyFailure = null;
        if (privateKeyPath != null) {
            Credential key = Credential.privateKey(privateKeyPath);
            try {
                RemoteSession session = transport.connect(target, key);
                return opened(session, RunEvent.of("auth.key", target, "ok",
                        Map.of("credential", SensitiveDataMasker.describe(key))));
            } catch (AuthenticationFailedException e) {
                keyFailure = e;
                reporter.record(RunEvent.of("auth.key", target, "rejected",
                        Map.of("credential", SensitiveDataMasker.describe(key))));
            }
        }
        promptLock.lockInterruptibly();
        try {
            return authenticateWithPassword(target, keyFailure);
        } finally {
            promptLock.unlock();
        }
    }

    public boolean hasSecret(HostAccount target) {
        return secrets.containsKey(target.key());
    }

    public Set<String> cachedPairs() {
        return Set.copyOf(secrets.keySet());
    }

    private RemoteSession authenticateWithPassword(HostAccount target, AuthenticationFailedException keyFailure)
            throws AuthenticationExhaustedException, TransportException, InterruptedException {
        Exception lastFailure = keyFailure;
        String cached = secrets.get(target.key());
        int attempts = 0;
        while (attempts < MAX_PASSWORD_ATTEMPTS) {
            String secret;
            boolean fromCache = attempts == 0 && cached != null;
            if (fromCache) {
                secret = cached;
            } else {
                try {
                    secret = prompts.requestSecret("Password for " + target.key() + ": ");
                } catch (PromptUnavailableException e) {
                    reporter.record(RunEvent.of("auth.password", target, "prompt_unavailable",
                            Map.of("attempts", attempts)));
                    throw new AuthenticationExhaustedException(target, attempts, e);
                }
            }
            attempts++;
            try {
                RemoteSession session = transport.connect(target, Credential.password(secret));
                secrets.put(target.key(), secret);
                return opened(session, RunEvent.of("auth.password", target, "ok",
                        Map.of("attempt", attempts, "cached", fromCache)));
            } catch (AuthenticationFailedException e) {
                lastFailure = e;
                reporter.record(RunEvent.of("auth.password", target, "rejected",
                        Map.of("attempt", attempts, "cached", fromCache)));
                if (!fromCache) {
                    tellUser("Authentication failed for " + target.key() + ", please try again.");
                }
            }
        }
        reporter.record(RunEvent.of("auth.exhausted", target, "failed", Map.of("attempts", attempts)));
        throw new AuthenticationExhaustedException(target, attempts, lastFailure);
    }

    /** Hands the session out only once its event is recorded; a failing reporter must not leak it. */
    private RemoteSession opened(RemoteSession session, RunEvent event) {
        try {
            reporter.record(event);
        } catch (RuntimeException e) {
            session.close();
            throw e;
        }
        return session;
    }

    private void tellUser(String message) throws InterruptedException {
        try {
            prompts.notice(message);
        } catch (PromptUnavailableException e) {
            // The next requestSecret call reports the closed prompt as exhaustion.
            reporter.record(RunEvent.of("auth.notice", "dropped", Map.of("reason", String.valueOf(e.getMessage()))));
        }
    }
}
