package io.authkeys.observability;

import io.authkeys.model.HostAccount;

import java.util.Map;

public record RunEvent(
        String action,
        String resource,
        String result,
        Map<String, Object> details
) {
    public RunEvent {
        details = details == null ? Map.of() : details;
    }

    public static RunEvent of(String action, HostAccount target, String result) {
        return new RunEvent(action, target == null ? null : target.key(), result, Map.of());
    }

    public static RunEvent of(String action, HostAccount target, String result, Map<String, Object> details) {
        return new RunEvent(action, target == null ? null : target.key(), result, details);
    }

    public static RunEvent of(String action, String result, Map<String, Object> details) {
        return new RunEvent(action, null, result, details);
    }
}
