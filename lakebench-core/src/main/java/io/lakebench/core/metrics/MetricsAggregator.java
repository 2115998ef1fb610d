package io.lakebench.core.metrics;

import io.lakebench.api.report.BackendKind;
import io.lakebench.api.report.PercentileSource;
import io.lakebench.api.report.QuerySummary;
import io.lakebench.api.report.RunOutcome;
import io.lakebench.api.report.TestReport;
import io.lakebench.api.workload.ExecutionResult;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns raw execution results into a report.
 * <p>
 * Aggregation is a pure function of its inputs. Latency statistics cover successful
 * executions only; throughput counts every attempted execution over the span from the
 * first start to the last end.
 */
public class MetricsAggregator {

    static final String HEALTHY = "Performance looks good! Consider running longer tests for more comprehensive analysis.";
    static final String PGBENCH_HEALTHY = "Performance looks good! Consider running longer tests for more accurate metrics.";

    private final RecommendationThresholds thresholds;

    public MetricsAggregator() {
        this(RecommendationThresholds.defaults());
    }

    public MetricsAggregator(RecommendationThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Aggregate with a test id derived from the first start time.
     */
    public TestReport aggregate(List<ExecutionResult> results, int concurrencyLevel) {
        Instant first = results.stream().map(ExecutionResult::startTime).min(Comparator.naturalOrder()).orElse(Instant.EPOCH);
        return aggregate(results, concurrencyLevel, testId(first));
    }

    public TestReport aggregate(List<ExecutionResult> results, int concurrencyLevel, String testId) {
        long total = results.size();
        List<Double> latencies = new ArrayList<>();
        long succeeded = 0;
        Instant start = null;
        Instant end = null;
        for (ExecutionResult result : results) {
            if (result.success()) {
                succeeded++;
                latencies.add(result.durationMs());
            }
            if (start == null || result.startTime().isBefore(start)) {
                start = result.startTime();
            }
            if (end == null || result.endTime().isAfter(end)) {
                end = result.endTime();
            }
        }
        long failed = total - succeeded;
        double successRate = total > 0 ? (double) succeeded / total : 0.0;

        double[] sorted = Percentiles.sorted(latencies);
        double average = sorted.length > 0 ? mean(sorted) : 0.0;
        double min = sorted.length > 0 ? sorted[0] : 0.0;
        double max = sorted.length > 0 ? sorted[sorted.length - 1] : 0.0;

        double spanSeconds = start != null ? Duration.between(start, end).toNanos() / 1_000_000_000.0 : 0.0;
        double throughput = spanSeconds > 0 ? total / spanSeconds : 0.0;

        Map<String, Long> errorBreakdown = errorBreakdown(results);
        List<String> recommendations = recommendations(successRate, average, throughput, concurrencyLevel, errorBreakdown);

        return new TestReport(
                testId,
                BackendKind.IN_PROCESS,
                RunOutcome.COMPLETED,
                null,
                start,
                end,
                spanSeconds,
                concurrencyLevel,
                total,
                succeeded,
                failed,
                successRate,
                average,
                min,
                max,
                Percentiles.nearestRank(sorted, 0.50),
                Percentiles.nearestRank(sorted, 0.95),
                Percentiles.nearestRank(sorted, 0.99),
                sorted.length > 0 ? PercentileSource.MEASURED : PercentileSource.NONE,
                throughput,
                perQuery(results),
                errorBreakdown,
                null,
                recommendations,
                List.copyOf(results),
                null
        );
    }

    /**
     * Per-query statistics, ordered by query identifier.
     */
    public List<QuerySummary> perQuery(List<ExecutionResult> results) {
        Map<String, List<ExecutionResult>> byQuery = results.stream()
                .collect(Collectors.groupingBy(ExecutionResult::queryIdentifier, TreeMap::new, Collectors.toList()));
        List<QuerySummary> summaries = new ArrayList<>(byQuery.size());
        byQuery.forEach((identifier, group) -> {
            double[] sorted = Percentiles.sorted(group.stream()
                    .filter(ExecutionResult::success)
                    .map(ExecutionResult::durationMs)
                    .collect(Collectors.toList()));
            long ok = sorted.length;
            summaries.add(new QuerySummary(
                    identifier,
                    group.size(),
                    ok,
                    group.size() - ok,
                    (double) ok / group.size(),
                    ok > 0 ? mean(sorted) : 0.0,
                    ok > 0 ? sorted[0] : 0.0,
                    ok > 0 ? sorted[sorted.length - 1] : 0.0,
                    Percentiles.nearestRank(sorted, 0.95),
                    Percentiles.nearestRank(sorted, 0.99)
            ));
        });
        return summaries;
    }

    /**
     * Recommendations for an in-process run.
     */
    public List<String> recommendations(double successRate, double averageLatencyMs, double throughputQps,
                                        int concurrencyLevel, Map<String, Long> errorBreakdown) {
        List<String> recommendations = new ArrayList<>();
        if (successRate < thresholds.minSuccessRate()) {
            recommendations.add(String.format("Success rate is below %.0f%%. Check for connection issues, query errors, or resource constraints.",
                    thresholds.minSuccessRate() * 100));
        }
        if (successRate < thresholds.errorInvestigationSuccessRate() && !errorBreakdown.isEmpty()) {
            String mostCommon = errorBreakdown.entrySet().stream()
                    .max((a, b) -> a.getValue().equals(b.getValue())
                            ? b.getKey().compareTo(a.getKey())
                            : Long.compare(a.getValue(), b.getValue()))
                    .map(Map.Entry::getKey)
                    .orElseThrow();
            recommendations.add("Most common error is '" + mostCommon + "'. Investigate and fix this issue.");
        }
        if (averageLatencyMs > thresholds.maxAverageLatencyMs()) {
            recommendations.add(String.format("Average execution time is high (>%.0fms). Consider optimizing queries, adding indexes, or increasing connection pool size.",
                    thresholds.maxAverageLatencyMs()));
        }
        if (averageLatencyMs > thresholds.criticalAverageLatencyMs()) {
            recommendations.add("Average execution time is very high. This may indicate serious performance issues that need immediate attention.");
        }
        if (throughputQps < thresholds.minThroughputQps()) {
            recommendations.add(String.format("Throughput is low (<%.0f qps). Consider increasing concurrency level, optimizing queries, or scaling resources.",
                    thresholds.minThroughputQps()));
        }
        if (concurrencyLevel > thresholds.highConcurrencyLevel() && successRate < thresholds.highConcurrencyMinSuccessRate()) {
            recommendations.add("Failures at high concurrency. Check that the pool size and the instance connection limit match the concurrency level.");
        }
        if (recommendations.isEmpty()) {
            recommendations.add(HEALTHY);
        }
        return recommendations;
    }

    /**
     * Recommendations for an external pgbench run. Null figures were not reported by the tool.
     */
    public List<String> pgbenchRecommendations(Double tps, Double averageLatencyMs, int clients,
                                               Double p50LatencyMs, Double p95LatencyMs) {
        List<String> recommendations = new ArrayList<>();
        if (tps != null && tps < thresholds.pgbenchMinTps()) {
            recommendations.add("Low TPS detected. Consider optimizing queries or increasing client connections.");
        }
        if (averageLatencyMs != null && averageLatencyMs > thresholds.pgbenchMaxAverageLatencyMs()) {
            recommendations.add("High average latency. Check for inefficient queries or resource constraints.");
        }
        if (clients > thresholds.pgbenchHighClientCount() && tps != null && tps / clients < thresholds.pgbenchMinTpsPerClient()) {
            recommendations.add("High client count with low per-client TPS. Consider reducing client connections.");
        }
        if (p50LatencyMs != null && p95LatencyMs != null && p50LatencyMs > 0
                && p95LatencyMs > p50LatencyMs * thresholds.pgbenchMaxTailRatio()) {
            recommendations.add("High latency variance detected. Check for inconsistent query performance.");
        }
        if (recommendations.isEmpty()) {
            recommendations.add(PGBENCH_HEALTHY);
        }
        return recommendations;
    }

    /**
     * Deterministic id of an aggregated result set, derived from its first start time.
     */
    public static String testId(Instant start) {
        return "test_" + start.getEpochSecond();
    }

    /**
     * Id of a new run: {@code <prefix>_<epochMillis>_<8 hex chars>}, unique even for runs
     * started in the same millisecond.
     */
    public static String newTestId(String prefix, Instant start) {
        return prefix + "_" + start.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static Map<String, Long> errorBreakdown(List<ExecutionResult> results) {
        Map<String, Long> counts = results.stream()
                .filter(r -> !r.success())
                .collect(Collectors.groupingBy(r -> r.errorKind() != null ? r.errorKind() : "Unknown",
                        TreeMap::new, Collectors.counting()));
        return new LinkedHashMap<>(counts);
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
