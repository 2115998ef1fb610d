package io.lakebench.api.error;

/**
 * Base type for every error the engine raises to its caller.
 * <p>
 * Setup failures ({@link AuthenticationException}, {@link ConnectivityException},
 * {@link TargetNotFoundException}) abort a run before any query executes.
 * {@link PoolExhaustedException} is fatal only during setup; inside a run it is recorded
 * as a failed execution. {@link BenchmarkExecutionException} is fatal to one external-process run.
 */
public class BenchmarkException extends RuntimeException {

    public BenchmarkException(String message) {
        super(message);
    }

    public BenchmarkException(String message, Throwable cause) {
        super(message, cause);
    }
}
