package io.authkeys.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.authkeys.model.Policy;
import io.authkeys.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/** Reads a YAML (or JSON) policy file and rejects it before any host is contacted. */
public final class PolicyLoader {
    private PolicyLoader() {
    }

    public static Policy load(Path file) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            throw new IllegalStateException("Policy file not found: " + file, e);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read policy file: " + file, e);
        }
        return parse(text, file.toString());
    }

    public static Policy parse(String text, String source) {
        if (text == null || text.isBlank()) {
            throw new MalformedPolicyException(source, List.of("policy is empty"));
        }
        Policy policy;
        try {
            policy = Jsons.yamlMapper().readValue(text, Policy.class);
        } catch (JsonProcessingException e) {
            throw new MalformedPolicyException(source, e);
        }
        if (policy == null) {
            throw new MalformedPolicyException(source, List.of("policy is empty"));
        }
        List<String> problems = policy.problems();
        if (!problems.isEmpty()) {
            throw new MalformedPolicyException(source, problems);
        }
        return policy;
    }
}
