package io.lakebench.api.report;

import io.lakebench.api.pool.PoolStatus;
import io.lakebench.api.workload.ExecutionResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Complete result of one benchmark invocation, produced by either backend.
 * <p>
 * For a completed in-process run {@code totalExecutions} equals the sum of all scenario
 * repetition counts and {@code successfulExecutions + failedExecutions == totalExecutions}.
 * Latency figures cover successful executions only. {@code poolStatus} and {@code pgbench}
 * are null when they do not apply.
 */
public record TestReport(
        String testId,
        BackendKind backend,
        RunOutcome outcome,
        String failureReason,
        Instant startTime,
        Instant endTime,
        double totalDurationSeconds,
        int concurrencyLevel,
        long totalExecutions,
        long successfulExecutions,
        long failedExecutions,
        double successRate,
        double averageLatencyMs,
        double minLatencyMs,
        double maxLatencyMs,
        double p50LatencyMs,
        double p95LatencyMs,
        double p99LatencyMs,
        PercentileSource percentileSource,
        double throughputQps,
        List<QuerySummary> perQuery,
        Map<String, Long> errorBreakdown,
        PoolStatus poolStatus,
        List<String> recommendations,
        List<ExecutionResult> rawResults,
        PgbenchDetails pgbench
) {

    /**
     * Copy with the run outcome replaced.
     */
    public TestReport withOutcome(RunOutcome newOutcome, String reason) {
        return new TestReport(testId, backend, newOutcome, reason, startTime, endTime, totalDurationSeconds,
                concurrencyLevel, totalExecutions, successfulExecutions, failedExecutions, successRate,
                averageLatencyMs, minLatencyMs, maxLatencyMs, p50LatencyMs, p95LatencyMs, p99LatencyMs,
                percentileSource, throughputQps, perQuery, errorBreakdown, poolStatus, recommendations,
                rawResults, pgbench);
    }

    /**
     * Copy with the pool snapshot attached.
     */
    public TestReport withPoolStatus(PoolStatus status) {
        return new TestReport(testId, backend, outcome, failureReason, startTime, endTime, totalDurationSeconds,
                concurrencyLevel, totalExecutions, successfulExecutions, failedExecutions, successRate,
                averageLatencyMs, minLatencyMs, maxLatencyMs, p50LatencyMs, p95LatencyMs, p99LatencyMs,
                percentileSource, throughputQps, perQuery, errorBreakdown, status, recommendations,
                rawResults, pgbench);
    }
}
