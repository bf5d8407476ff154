package io.authkeys.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.authkeys.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public final class AuthKeysConfig {
    public static final int DEFAULT_PORT = 22;
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 10_000;
    public static final int DEFAULT_MAX_PARALLEL = 0;
    public static final String DEFAULT_STAGING_PREFIX = "authkeys-";

    private final String privateKeyPath;
    private final int port;
    private final int connectTimeoutMs;
    private final int maxParallel;
    private final boolean strictHostKeyChecking;
    private final String knownHostsPath;
    private final Path auditLog;
    private final Path stagingRoot;

    public AuthKeysConfig(
            String privateKeyPath,
            int port,
            int connectTimeoutMs,
            int maxParallel,
            boolean strictHostKeyChecking,
            String knownHostsPath,
            Path auditLog,
            Path stagingRoot
    ) {
        this.privateKeyPath = privateKeyPath == null || privateKeyPath.isBlank() ? null : privateKeyPath.trim();
        this.port = port <= 0 ? DEFAULT_PORT : port;
        this.connectTimeoutMs = connectTimeoutMs <= 0 ? DEFAULT_CONNECT_TIMEOUT_MS : connectTimeoutMs;
        this.maxParallel = Math.max(0, maxParallel);
        this.strictHostKeyChecking = strictHostKeyChecking;
        this.knownHostsPath = knownHostsPath == null || knownHostsPath.isBlank() ? null : knownHostsPath.trim();
        this.auditLog = auditLog;
        this.stagingRoot = stagingRoot;
    }

    public static AuthKeysConfig defaults() {
        return new AuthKeysConfig(null, DEFAULT_PORT, DEFAULT_CONNECT_TIMEOUT_MS, DEFAULT_MAX_PARALLEL, false, null, null, null);
    }

    /** Reads an optional YAML settings file; a missing path yields {@link #defaults()}. */
    public static AuthKeysConfig load(Path settingsFile) {
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults();
        }
        Settings settings;
        try {
            settings = Jsons.yamlMapper().readValue(settingsFile.toFile(), Settings.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + settingsFile, e);
        }
        if (settings == null) {
            return defaults();
        }
        return new AuthKeysConfig(
                expandHome(settings.sshPrivateKeyPath()),
                settings.port() == null ? DEFAULT_PORT : settings.port(),
                settings.connectTimeoutMs() == null ? DEFAULT_CONNECT_TIMEOUT_MS : settings.connectTimeoutMs(),
                settings.maxParallel() == null ? DEFAULT_MAX_PARALLEL : settings.maxParallel(),
                Boolean.TRUE.equals(settings.strictHostKeyChecking()),
                expandHome(settings.knownHosts()),
                settings.auditLog() == null || settings.auditLog().isBlank() ? null : Paths.get(expandHome(settings.auditLog())),
                null
        );
    }

    public AuthKeysConfig withPrivateKeyPath(String value) {
        return new AuthKeysConfig(expandHome(value), port, connectTimeoutMs, maxParallel, strictHostKeyChecking, knownHostsPath, auditLog, stagingRoot);
    }

    public AuthKeysConfig withConnectTimeoutMs(int value) {
        return new AuthKeysConfig(privateKeyPath, port, value, maxParallel, strictHostKeyChecking, knownHostsPath, auditLog, stagingRoot);
    }

    public AuthKeysConfig withMaxParallel(int value) {
        return new AuthKeysConfig(privateKeyPath, port, connectTimeoutMs, value, strictHostKeyChecking, knownHostsPath, auditLog, stagingRoot);
    }

    public AuthKeysConfig withAuditLog(Path value) {
        return new AuthKeysConfig(privateKeyPath, port, connectTimeoutMs, maxParallel, strictHostKeyChecking, knownHostsPath, value, stagingRoot);
    }

    public AuthKeysConfig withStagingRoot(Path value) {
        return new AuthKeysConfig(privateKeyPath, port, connectTimeoutMs, maxParallel, strictHostKeyChecking, knownHostsPath, auditLog, value);
    }

    static String expandHome(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        if (value.equals("~") || value.startsWith("~/")) {
            return System.getProperty("user.home") + value.substring(1);
        }
        return value;
    }

    public String privateKeyPath() {
        return privateKeyPath;
    }

    public int port() {
        return port;
    }

    public int connectTimeoutMs() {
        return connectTimeoutMs;
    }

    /** Upper bound on concurrent pair tasks; {@code 0} runs one task per pair. */
    public int maxParallel() {
        return maxParallel;
    }

    public boolean strictHostKeyChecking() {
        return strictHostKeyChecking;
    }

    public String knownHostsPath() {
        return knownHostsPath;
    }

    public Path auditLog() {
        return auditLog;
    }

    /** Parent for the per-run staging directory; {@code null} means the system temp dir. */
    public Path stagingRoot() {
        return stagingRoot;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Settings(
            @JsonProperty("ssh_private_key_path") String sshPrivateKeyPath,
            @JsonProperty("port") Integer port,
            @JsonProperty("connect_timeout_ms") Integer connectTimeoutMs,
            @JsonProperty("max_parallel") Integer maxParallel,
            @JsonProperty("strict_host_key_checking") Boolean strictHostKeyChecking,
            @JsonProperty("known_hosts") String knownHosts,
            @JsonProperty("audit_log") String auditLog
    ) {
    }
}
