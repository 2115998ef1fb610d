package io.lakebench.api.error;

/**
 * The database (or the service resolving it) could not be reached while setting up a run.
 */
public class ConnectivityException extends BenchmarkException {

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
