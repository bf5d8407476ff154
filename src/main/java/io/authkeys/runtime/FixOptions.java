package io.authkeys.runtime;

/**
 * @param force upload every plan, including ones that would not change the remote file
 * @param revokeOrphaned empty the file of accounts that hold only unauthorized keys
 */
public record FixOptions(
        boolean force,
        boolean revokeOrphaned
) {
    public static FixOptions defaults() {
        return new FixOptions(false, false);
    }
}
