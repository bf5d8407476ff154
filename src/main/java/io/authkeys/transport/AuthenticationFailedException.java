package io.authkeys.transport;

/** The server was reached but rejected the offered credential. */
public class AuthenticationFailedException extends TransportException {
    public AuthenticationFailedException(String message) {
        super(message);
    }

    public AuthenticationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
