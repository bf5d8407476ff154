package io.authkeys.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One public key owned by an identity.
 *
 * <p>{@code hostname} is the free-text label shown next to the key (usually the
 * machine the key lives on). When {@code admin} is set the access list is ignored
 * and the key is expected on every declared account of every host.
 */
public record KeyRecord(
        String type,
        String key,
        String hostname,
        boolean admin,
        List<AccessGrant> access
) {
    public KeyRecord {
        // Null entries are kept so Policy.problems() can point at them.
        access = access == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(access));
    }
}
