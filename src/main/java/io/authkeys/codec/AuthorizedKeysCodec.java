package io.authkeys.codec;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the {@code authorized_keys} line format
 * {@code <type> <material> <comment>}.
 *
 * <p>Options prefixes ({@code from="..."}, {@code command="..."}) are not
 * interpreted; such a line is read as if the options were the key type.
 */
public final class AuthorizedKeysCodec {
    public static final String DEFAULT_COMMENT = "unknown";

    private AuthorizedKeysCodec() {
    }

    public static List<AuthorizedKeyEntry> parse(String text) {
        List<AuthorizedKeyEntry> out = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return out;
        }
        for (String rawLine : text.split("\\R")) {
            String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] fields = line.split("\\s+", 3);
            if (fields.length < 2) {
                continue;
            }
            String comment = fields.length == 3 && !fields[2].isBlank() ? fields[2].strip() : DEFAULT_COMMENT;
            out.add(new AuthorizedKeyEntry(fields[0], fields[1], comment));
        }
        return out;
    }

    public static String serialize(List<AuthorizedKeyEntry> entries) {
        StringBuilder sb = new StringBuilder();
        if (entries == null) {
            return "";
        }
        for (AuthorizedKeyEntry entry : entries) {
            sb.append(entry.type()).append(' ').append(entry.material());
            if (entry.comment() != null && !entry.comment().isBlank()) {
                sb.append(' ').append(entry.comment());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
