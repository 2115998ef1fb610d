package io.lakebench.api.workload;

import java.time.Instant;

/**
 * Outcome of one attempted repetition. Exactly one is produced per attempt, success or failure.
 *
 * @param queryIdentifier query the execution belongs to
 * @param scenarioName    scenario whose parameters were bound
 * @param startTime       when the unit started (before connection checkout)
 * @param endTime         when the unit finished
 * @param durationMs      elapsed milliseconds
 * @param success         whether the statement completed
 * @param rowsReturned    rows read or affected, null on failure
 * @param errorKind       exception type name, null on success
 * @param errorMessage    error text, null on success
 */
public record ExecutionResult(
        String queryIdentifier,
        String scenarioName,
        Instant startTime,
        Instant endTime,
        double durationMs,
        boolean success,
        Integer rowsReturned,
        String errorKind,
        String errorMessage
) {

    public static ExecutionResult success(String queryIdentifier, String scenarioName,
                                          Instant start, Instant end, double durationMs, int rows) {
        return new ExecutionResult(queryIdentifier, scenarioName, start, end, durationMs, true, rows, null, null);
    }

    public static ExecutionResult failure(String queryIdentifier, String scenarioName,
                                          Instant start, Instant end, double durationMs,
                                          String errorKind, String errorMessage) {
        return new ExecutionResult(queryIdentifier, scenarioName, start, end, durationMs, false, null,
                errorKind, errorMessage);
    }
}
