package io.lakebench.api.report;

import java.time.Instant;

/**
 * Incremental status of a running benchmark, suitable for a polling or streaming channel.
 *
 * @param testId           run identifier
 * @param state            lifecycle state
 * @param currentStep      human-readable description of what the run is doing
 * @param completed        executions finished so far
 * @param expected         executions planned, or -1 when the backend cannot know
 * @param succeeded        successful executions so far
 * @param failed           failed executions so far
 * @param currentTps       most recent throughput figure, null if none yet
 * @param currentLatencyMs most recent average latency, null if none yet
 * @param timestamp        when the status was taken
 */
public record RunStatus(
        String testId,
        State state,
        String currentStep,
        long completed,
        long expected,
        long succeeded,
        long failed,
        Double currentTps,
        Double currentLatencyMs,
        Instant timestamp
) {

    public enum State {
        PENDING,
        RUNNING,
        COMPLETED,
        CANCELLED,
        FAILED
    }

    public static RunStatus of(String testId, State state, String currentStep) {
        return new RunStatus(testId, state, currentStep, 0, -1, 0, 0, null, null, Instant.now());
    }
}
