package io.lakebench.api.error;

/**
 * The identity service was unreachable or refused to issue a database credential.
 */
public class AuthenticationException extends BenchmarkException {

    public AuthenticationException(String message) {
        super(message);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, cause);
    }
}
