package io.authkeys.transport;

public final class RemotePaths {
    private RemotePaths() {
    }

    public static String authorizedKeys(String account) {
        if ("root".equals(account)) {
            return "/root/.ssh/authorized_keys";
        }
        return "/home/" + account + "/.ssh/authorized_keys";
    }
}
