package io.lakebench.api.report;

/**
 * Per-query statistics. Latencies cover successful executions only.
 */
public record QuerySummary(
        String queryIdentifier,
        long totalExecutions,
        long successfulExecutions,
        long failedExecutions,
        double successRate,
        double averageLatencyMs,
        double minLatencyMs,
        double maxLatencyMs,
        double p95LatencyMs,
        double p99LatencyMs
) {}
