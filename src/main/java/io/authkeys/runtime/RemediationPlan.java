package io.authkeys.runtime;

import io.authkeys.codec.AuthorizedKeyEntry;
import io.authkeys.model.HostAccount;

import java.util.List;

/**
 * Desired full content of one account's authorized_keys file.
 *
 * @param added keys the remote file lacks today
 * @param revoked keys the upload removes
 */
public record RemediationPlan(
        HostAccount target,
        List<AuthorizedKeyEntry> entries,
        String content,
        int added,
        int revoked
) {
    public boolean changesRemote() {
        return added > 0 || revoked > 0;
    }
}
