package io.authkeys.credential;

import java.io.IOException;

/** Raw terminal access. Only the {@link PromptBroker} thread calls into it. */
public interface TerminalPrompter {
    String readSecret(String prompt) throws IOException, PromptUnavailableException;

    String readLine(String prompt) throws IOException, PromptUnavailableException;

    void println(String message);

    static TerminalPrompter unavailable() {
        return new TerminalPrompter() {
            @Override
            public String readSecret(String prompt) throws PromptUnavailableException {
                throw new PromptUnavailableException("Interactive prompting is disabled");
            }

            @Override
            public String readLine(String prompt) throws PromptUnavailableException {
                throw new PromptUnavailableException("Interactive prompting is disabled");
            }

            @Override
            public void println(String message) {
                System.err.println(message);
            }
        };
    }
}
