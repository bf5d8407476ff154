package io.authkeys.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.authkeys.transport.Credential;
import io.authkeys.util.Jsons;

import java.util.Locale;
import java.util.Set;

/**
 * Keeps login secrets out of audit rows and shortens public key material.
 *
 * <p>Fields named like a password are replaced outright. Fields carrying key
 * material keep their first characters so an operator can still tell keys apart.
 */
public final class SensitiveDataMasker {
    static final String MASK = "***";
    private static final int MATERIAL_PREFIX = 10;
    private static final Set<String> SECRET_FIELDS = Set.of("password", "passphrase", "secret");
    private static final Set<String> MATERIAL_FIELDS = Set.of("key", "material", "key_material", "keymaterial");

    private enum FieldKind {
        SECRET,
        MATERIAL,
        PLAIN
    }

    private SensitiveDataMasker() {
    }

    public static JsonNode masked(JsonNode input) {
        if (input == null || input.isNull()) {
            return Jsons.mapper().nullNode();
        }
        if (input.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            input.forEach(value -> out.add(masked(value)));
            return out;
        }
        if (!input.isObject()) {
            return input;
        }
        ObjectNode out = Jsons.mapper().createObjectNode();
        input.fields().forEachRemaining(entry -> {
            switch (kindOf(entry.getKey())) {
                case SECRET -> out.put(entry.getKey(), MASK);
                case MATERIAL -> out.set(entry.getKey(), abbreviated(entry.getValue()));
                case PLAIN -> out.set(entry.getKey(), masked(entry.getValue()));
            }
        });
        return out;
    }

    /** Audit-safe description of a login credential: the key path, never the password. */
    public static String describe(Credential credential) {
        if (credential == null) {
            return "none";
        }
        return credential.kind() == Credential.Kind.PRIVATE_KEY
                ? "privateKey(" + credential.privateKeyPath() + ")"
                : "password(" + MASK + ")";
    }

    /** Shortens key material for display: first 10 characters and an ellipsis. */
    public static String abbreviate(String material) {
        if (material == null) {
            return "";
        }
        return material.length() <= MATERIAL_PREFIX ? material : material.substring(0, MATERIAL_PREFIX) + "...";
    }

    private static JsonNode abbreviated(JsonNode value) {
        if (value.isTextual()) {
            return Jsons.mapper().getNodeFactory().textNode(abbreviate(value.asText()));
        }
        if (value.isArray()) {
            ArrayNode out = Jsons.mapper().createArrayNode();
            value.forEach(item -> out.add(abbreviated(item)));
            return out;
        }
        return masked(value);
    }

    private static FieldKind kindOf(String field) {
        String name = field.toLowerCase(Locale.ROOT);
        for (String secret : SECRET_FIELDS) {
            if (name.contains(secret)) {
                return FieldKind.SECRET;
            }
        }
        return MATERIAL_FIELDS.contains(name) ? FieldKind.MATERIAL : FieldKind.PLAIN;
    }
}
