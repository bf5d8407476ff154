package io.authkeys.transport;

import io.authkeys.model.HostAccount;

public interface SshTransport {
    /**
     * Opens an authenticated file session as {@code target.account()} on {@code target.host()}.
     *
     * @throws AuthenticationFailedException when the server rejects the credential
     * @throws TransportException for every other connection failure
     */
    RemoteSession connect(HostAccount target, Credential credential) throws TransportException;
}
