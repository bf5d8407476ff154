package io.authkeys.transport;

import com.jcraft.jsch.ChannelSftp;
import com.jcraft.jsch.JSch;
import com.jcraft.jsch.JSchException;
import com.jcraft.jsch.Session;
import com.jcraft.jsch.SftpException;
import io.authkeys.config.AuthKeysConfig;
import io.authkeys.model.HostAccount;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;

/** {@link SshTransport} over JSch SFTP channels. */
public final class JschTransport implements SshTransport {
    static final int SERVER_ALIVE_COUNT_MAX = 3;

    private final int port;
    private final int connectTimeoutMs;
    private final boolean strictHostKeyChecking;
    private final String knownHostsPath;

    public JschTransport(AuthKeysConfig config) {
        this(config.port(), config.connectTimeoutMs(), config.strictHostKeyChecking(), config.knownHostsPath());
    }

    public JschTransport(int port, int connectTimeoutMs, boolean strictHostKeyChecking, String knownHostsPath) {
        this.port = port;
        this.connectTimeoutMs = Math.max(0, connectTimeoutMs);
        this.strictHostKeyChecking = strictHostKeyChecking;
        this.knownHostsPath = knownHostsPath;
    }

    @Override
    public RemoteSession connect(HostAccount target, Credential credential) throws TransportException {
        JSch jsch = new JSch();
        Session session = null;
        try {
            if (knownHostsPath != null && !knownHostsPath.isBlank()) {
                jsch.setKnownHosts(knownHostsPath);
            }
            if (credential.kind() == Credential.Kind.PRIVATE_KEY) {
                addIdentity(jsch, target, credential.privateKeyPath());
            }
            session = openSession(jsch, target, credential);
            session.connect(connectTimeoutMs);
            ChannelSftp channel = (ChannelSftp) session.openChannel("sftp");
            channel.connect(connectTimeoutMs);
            return new JschRemoteSession(target, session, channel);
        } catch (JSchException e) {
            if (session != null) {
                session.disconnect();
            }
            if (isAuthFailure(e)) {
                throw new AuthenticationFailedException("Authentication failed for " + target.key() + " using " + credential.kind(), e);
            }
            throw new TransportException("Unable to reach " + target.key() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Prepares an unconnected session. The timeout also becomes the socket read
     * timeout once connected, so a host that stalls mid-transfer fails its pair.
     */
    Session openSession(JSch jsch, HostAccount target, Credential credential) throws JSchException {
        Session session = jsch.getSession(target.account(), target.host(), port);
        Properties sessionConfig = new Properties();
        sessionConfig.setProperty("StrictHostKeyChecking", strictHostKeyChecking ? "yes" : "no");
        sessionConfig.setProperty("PreferredAuthentications",
                credential.kind() == Credential.Kind.PRIVATE_KEY ? "publickey" : "password,keyboard-interactive");
        session.setConfig(sessionConfig);
        session.setTimeout(connectTimeoutMs);
        if (connectTimeoutMs > 0) {
            session.setServerAliveInterval(connectTimeoutMs);
            session.setServerAliveCountMax(SERVER_ALIVE_COUNT_MAX);
        }
        if (credential.kind() == Credential.Kind.PASSWORD) {
            session.setPassword(credential.password());
        }
        return session;
    }

    private static void addIdentity(JSch jsch, HostAccount target, String privateKeyPath) throws AuthenticationFailedException {
        try {
            jsch.addIdentity(privateKeyPath);
        } catch (JSchException e) {
            // An unusable key file is handled like a rejected key so password fallback still applies.
            throw new AuthenticationFailedException("Private key " + privateKeyPath + " unusable for " + target.key(), e);
        }
    }

    static boolean isAuthFailure(JSchException e) {
        String message = e.getMessage();
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return lower.startsWith("auth fail") || lower.startsWith("auth cancel") || lower.contains("authentication failed");
    }

    private static final class JschRemoteSession implements RemoteSession {
        private final HostAccount target;
        private final Session session;
        private final ChannelSftp channel;

        private JschRemoteSession(HostAccount target, Session session, ChannelSftp channel) {
            this.target = target;
            this.session = session;
            this.channel = channel;
        }

        @Override
        public Optional<String> read(String remotePath) throws TransportException {
            try (InputStream in = channel.get(remotePath)) {
                return Optional.of(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            } catch (SftpException e) {
                if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    return Optional.empty();
                }
                throw new TransportException("Failed to read " + target.key() + ":" + remotePath + ": " + e.getMessage(), e);
            } catch (IOException e) {
                throw new TransportException("Failed to read " + target.key() + ":" + remotePath, e);
            }
        }

        @Override
        public void upload(Path localFile, String remotePath) throws TransportException {
            try {
                channel.put(localFile.toString(), remotePath, ChannelSftp.OVERWRITE);
            } catch (SftpException e) {
                if (e.id == ChannelSftp.SSH_FX_NO_SUCH_FILE) {
                    throw new TransportException("Remote directory for " + remotePath + " does not exist on " + target.key(), e);
                }
                throw new TransportException("Failed to upload to " + target.key() + ":" + remotePath + ": " + e.getMessage(), e);
            }
        }

        @Override
        public void close() {
            channel.disconnect();
            session.disconnect();
        }
    }
}
