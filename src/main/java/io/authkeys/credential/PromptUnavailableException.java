package io.authkeys.credential;

/** No interactive answer can be obtained: no console, prompting disabled, or the run is shutting down. */
public class PromptUnavailableException extends Exception {
    public PromptUnavailableException(String message) {
        super(message);
    }

    public PromptUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
