package io.authkeys.config;

import com.fasterxml.jackson.databind.JsonNode;
import io.authkeys.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads the password seed file:
 *
 * <pre>
 * hosts:
 *   - ip: db1
 *     credentials:
 *       - user: deploy
 *         password: ...
 * </pre>
 *
 * into {@code account@host -> password}.
 */
public final class CredentialSeedLoader {
    private CredentialSeedLoader() {
    }

    public static Map<String, String> load(Path file) {
        if (file == null || !Files.exists(file)) {
            return Map.of();
        }
        JsonNode root;
        try {
            root = Jsons.yamlMapper().readTree(file.toFile());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read password file: " + file, e);
        }
        return fromTree(root);
    }

    static Map<String, String> fromTree(JsonNode root) {
        Map<String, String> out = new LinkedHashMap<>();
        if (root == null || root.isMissingNode() || root.isNull()) {
            return out;
        }
        for (JsonNode hostEntry : root.path("hosts")) {
            String host = hostEntry.path("ip").asText("");
            if (host.isBlank()) {
                host = hostEntry.path("host").asText("");
            }
            if (host.isBlank()) {
                continue;
            }
            for (JsonNode credential : hostEntry.path("credentials")) {
                String user = credential.path("user").asText("");
                String password = credential.path("password").asText("");
                if (user.isBlank() || password.isEmpty()) {
                    continue;
                }
                out.put(user.trim() + "@" + host.trim(), password);
            }
        }
        return out;
    }
}
