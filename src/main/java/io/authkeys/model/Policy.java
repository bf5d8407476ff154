package io.authkeys.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Declared access intent: the fleet and who may log into it.
 *
 * <p>Both lists are left as read so {@link #problems()} can tell a missing
 * section from an empty one.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Policy(
        @JsonAlias("servers") List<HostSpec> hosts,
        List<Identity> users
) {
    public List<String> problems() {
        List<String> out = new ArrayList<>();
        if (hosts == null) {
            out.add("missing 'hosts' section");
        } else {
            for (int i = 0; i < hosts.size(); i++) {
                HostSpec host = hosts.get(i);
                if (host == null || isBlank(host.host())) {
                    out.add("hosts[" + i + "]: missing 'host'");
                    continue;
                }
                for (int u = 0; u < host.users().size(); u++) {
                    if (isBlank(host.users().get(u))) {
                        out.add("hosts[" + i + "].users[" + u + "]: blank account name");
                    }
                }
            }
        }
        if (users == null) {
            out.add("missing 'users' section");
            return out;
        }
        for (int i = 0; i < users.size(); i++) {
            Identity identity = users.get(i);
            String where = "users[" + i + "]";
            if (identity == null || isBlank(identity.email())) {
                out.add(where + ": missing 'email'");
                continue;
            }
            for (int k = 0; k < identity.keys().size(); k++) {
                KeyRecord key = identity.keys().get(k);
                String keyWhere = where + ".keys[" + k + "]";
                if (key == null) {
                    out.add(keyWhere + ": empty key entry");
                    continue;
                }
                if (isBlank(key.type())) {
                    out.add(keyWhere + ": missing 'type'");
                }
                if (isBlank(key.key())) {
                    out.add(keyWhere + ": missing 'key'");
                }
                if (key.admin()) {
                    continue;
                }
                for (int a = 0; a < key.access().size(); a++) {
                    AccessGrant grant = key.access().get(a);
                    if (grant == null || isBlank(grant.host()) || isBlank(grant.username())) {
                        out.add(keyWhere + ".access[" + a + "]: 'host' and 'username' are required");
                    }
                }
            }
        }
        return out;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
