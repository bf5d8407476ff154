package io.authkeys.credential;

import java.io.Console;

public final class ConsolePrompter implements TerminalPrompter {
    private final Console console;

    private ConsolePrompter(Console console) {
        this.console = console;
    }

    /** Uses the process console, or refuses every prompt when there is none (piped or scheduled runs). */
    public static TerminalPrompter system() {
        Console console = System.console();
        return console == null ? TerminalPrompter.unavailable() : new ConsolePrompter(console);
    }

    @Override
    public String readSecret(String prompt) throws PromptUnavailableException {
        char[] secret = console.readPassword("%s", prompt);
        if (secret == null) {
            throw new PromptUnavailableException("Console closed while reading password");
        }
        return new String(secret);
    }

    @Override
    public String readLine(String prompt) throws PromptUnavailableException {
        String line = console.readLine("%s", prompt);
        if (line == null) {
            throw new PromptUnavailableException("Console closed while reading answer");
        }
        return line;
    }

    @Override
    public void println(String message) {
        console.printf("%s%n", message);
        console.flush();
    }
}
