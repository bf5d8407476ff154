package io.authkeys.runtime;

import io.authkeys.codec.AuthorizedKeyEntry;
import io.authkeys.codec.AuthorizedKeysCodec;
import io.authkeys.credential.CredentialBroker;
import io.authkeys.model.DiscoveredBinding;
import io.authkeys.model.HostAccount;
import io.authkeys.observability.RunEvent;
import io.authkeys.observability.RunReporter;
import io.authkeys.transport.RemotePaths;
import io.authkeys.transport.RemoteSession;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class RemoteKeyFetcher {
    private final CredentialBroker credentials;
    private final RunReporter reporter;

    public RemoteKeyFetcher(CredentialBroker credentials, RunReporter reporter) {
        this.credentials = credentials;
        this.reporter = reporter == null ? RunReporter.none() : reporter;
    }

    public List<DiscoveredBinding> fetch(HostAccount target) throws Exception {
        reporter.record(RunEvent.of("fetch", target, "start"));
        String path = RemotePaths.authorizedKeys(target.account());
        Optional<String> content;
        try (RemoteSession session = credentials.authenticate(target)) {
            content = session.read(path);
        }
        if (content.isEmpty()) {
            reporter.record(RunEvent.of("fetch", target, "absent", Map.of("path", path)));
        }
        Map<String, DiscoveredBinding> byMaterial = new LinkedHashMap<>();
        for (AuthorizedKeyEntry entry : AuthorizedKeysCodec.parse(content.orElse(""))) {
            byMaterial.putIfAbsent(entry.material(), new DiscoveredBinding(
                    target.host(),
                    target.account(),
                    entry.type(),
                    entry.material(),
                    entry.comment()
            ));
        }
        reporter.record(RunEvent.of("fetch", target, "ok", Map.of(
                "keys", byMaterial.size(),
                "material", List.copyOf(byMaterial.keySet())
        )));
        return new ArrayList<>(byMaterial.values());
    }
}
