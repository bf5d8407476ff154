package io.authkeys.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.authkeys.security.SensitiveDataMasker;
import io.authkeys.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/** Appends one JSON line per {@link RunEvent} to the audit log file. */
public final class AuditLogger implements RunReporter {
    private final Path auditFile;
    private final String runId;

    public AuditLogger(Path auditFile) {
        this(auditFile, "run_" + UUID.randomUUID());
    }

    public AuditLogger(Path auditFile, String runId) {
        this.auditFile = auditFile;
        this.runId = runId;
        try {
            Path parent = auditFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize audit log file: " + auditFile, e);
        }
    }

    @Override
    public synchronized void record(RunEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("run_id", runId);
        row.put("action", event.action());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write audit log", e);
        }
    }

    public String runId() {
        return runId;
    }

    public Path auditFile() {
        return auditFile;
    }

    private static JsonNode sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Jsons.mapper().createObjectNode();
        }
        return SensitiveDataMasker.masked(Jsons.mapper().valueToTree(input));
    }
}
