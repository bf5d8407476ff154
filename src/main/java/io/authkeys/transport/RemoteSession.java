package io.authkeys.transport;

import java.nio.file.Path;
import java.util.Optional;

public interface RemoteSession extends AutoCloseable {
    /** Returns the file's text, or empty when the file does not exist. */
    Optional<String> read(String remotePath) throws TransportException;

    /** Replaces {@code remotePath} with the content of {@code localFile}. */
    void upload(Path localFile, String remotePath) throws TransportException;

    @Override
    void close();
}
