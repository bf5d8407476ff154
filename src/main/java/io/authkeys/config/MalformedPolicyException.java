package io.authkeys.config;

import java.util.List;

public class MalformedPolicyException extends IllegalArgumentException {
    private final List<String> problems;

    public MalformedPolicyException(String source, List<String> problems) {
        super("Malformed policy " + source + ": " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public MalformedPolicyException(String source, Throwable cause) {
        super("Malformed policy " + source + ": " + cause.getMessage(), cause);
        this.problems = List.of(String.valueOf(cause.getMessage()));
    }

    public List<String> problems() {
        return problems;
    }
}
