package io.authkeys.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record HostSpec(
        String host,
        List<String> users
) {
    public HostSpec {
        // Null entries are kept so Policy.problems() can point at them.
        users = users == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(users));
    }
}
