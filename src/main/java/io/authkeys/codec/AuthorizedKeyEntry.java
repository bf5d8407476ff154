package io.authkeys.codec;

public record AuthorizedKeyEntry(
        String type,
        String material,
        String comment
) {
}
