package io.lakebench.api.error;

import java.time.Duration;

/**
 * No pooled connection became available within the configured acquire timeout.
 */
public class PoolExhaustedException extends BenchmarkException {

    private final Duration waited;

    public PoolExhaustedException(Duration waited, Throwable cause) {
        super("No connection available after " + waited.toMillis() + "ms", cause);
        this.waited = waited;
    }

    public Duration waited() {
        return waited;
    }
}
