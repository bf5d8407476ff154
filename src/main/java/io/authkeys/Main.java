package io.authkeys;

import io.authkeys.cli.AuthKeysCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        CommandLine commandLine = new CommandLine(new AuthKeysCommand())
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    cmd.getErr().println("error: " + ex.getMessage());
                    return CommandLine.ExitCode.SOFTWARE;
                });
        int code = commandLine.execute(args);
        System.exit(code);
    }
}
