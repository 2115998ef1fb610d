package io.lakebench.api.report;

import java.util.List;
import java.util.Map;

/**
 * Details specific to an external pgbench run.
 * <p>
 * Exactly one of {@code latencyPercentilesMeasured} and {@code latencyPercentilesEstimated}
 * is populated (both empty when the tool reported no latency). Keys are {@code p50}, {@code p95},
 * {@code p99} and {@code p99.9}.
 */
public record PgbenchDetails(
        List<String> command,
        int exitCode,
        String stdout,
        String stderr,
        Double tps,
        Double averageLatencyMs,
        Double latencyStddevMs,
        Map<String, Double> latencyPercentilesMeasured,
        Map<String, Double> latencyPercentilesEstimated,
        List<StatementLatency> statementLatencies,
        List<ProgressSample> progressSamples,
        Long transactionsProcessed,
        Long failedTransactions,
        int queriesTested,
        int clients,
        int jobs
) {

    public boolean percentilesEstimated() {
        return latencyPercentilesMeasured.isEmpty() && !latencyPercentilesEstimated.isEmpty();
    }
}
