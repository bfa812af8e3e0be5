package org.crawljav.fetch;

public class CredentialsException extends Exception {
    public CredentialsException(String message) {
        super(message);
    }

    public CredentialsException(String message, Throwable cause) {
        super(message, cause);
    }
}
