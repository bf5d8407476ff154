package io.authkeys.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public record Identity(
        String email,
        String name,
        List<KeyRecord> keys
) {
    public Identity {
        // Null entries are kept so Policy.problems() can point at them.
        keys = keys == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(keys));
    }
}
