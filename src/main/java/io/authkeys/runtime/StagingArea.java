package io.authkeys.runtime;

import io.authkeys.model.HostAccount;
import io.authkeys.observability.RunEvent;
import io.authkeys.observability.RunReporter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Comparator;
import java.util.Map;
import java.util.stream.Stream;

/** Per-run local directory for rendered files waiting to be uploaded. */
public final class StagingArea implements AutoCloseable {
    private final Path directory;
    private final RunReporter reporter;

    private StagingArea(Path directory, RunReporter reporter) {
        this.directory = directory;
        this.reporter = reporter == null ? RunReporter.none() : reporter;
    }

    public static StagingArea create(Path parent, String prefix, RunReporter reporter) {
        try {
            Path dir = parent == null
                    ? Files.createTempDirectory(prefix)
                    : Files.createTempDirectory(Files.createDirectories(parent), prefix);
            return new StagingArea(dir, reporter);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create staging directory", e);
        }
    }

    public Path directory() {
        return directory;
    }

    public Path stage(HostAccount target, String content) throws IOException {
        Path file = directory.resolve(target.key() + ".authorized_keys");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        restrictPermissions(file);
        return file;
    }

    /** Best-effort removal of the directory and anything still staged in it. */
    @Override
    public void close() {
        if (!Files.exists(directory)) {
            return;
        }
        int removed = 0;
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                if (Files.deleteIfExists(path) && !path.equals(directory)) {
                    removed++;
                }
            }
        } catch (IOException e) {
            reporter.record(RunEvent.of("staging.cleanup", "failed", Map.of(
                    "dir", directory.toString(),
                    "error", String.valueOf(e.getMessage())
            )));
            return;
        }
        reporter.record(RunEvent.of("staging.cleanup", "ok", Map.of(
                "dir", directory.toString(),
                "leftover", removed
        )));
    }

    private static void restrictPermissions(Path file) throws IOException {
        if (Files.getFileStore(file).supportsFileAttributeView("posix")) {
            Files.setPosixFilePermissions(file, PosixFilePermissions.fromString("rw-------"));
        }
    }
}
