package io.lakebench.core.pgbench;

import io.lakebench.api.pgbench.PgbenchRunConfig;
import io.lakebench.api.report.BackendKind;
import io.lakebench.api.report.PercentileSource;
import io.lakebench.api.report.PgbenchDetails;
import io.lakebench.api.report.QuerySummary;
import io.lakebench.api.report.RunOutcome;
import io.lakebench.api.report.TestReport;
import io.lakebench.core.metrics.MetricsAggregator;
import io.lakebench.core.metrics.Percentiles;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Assembles a report from what pgbench printed and logged.
 * <p>
 * Percentiles come from the transaction logs when there are any. Otherwise p95 and p99 are
 * estimated from mean and standard deviation and the report says so.
 */
class PgbenchReportBuilder {

    static final double Z_P95 = 1.645;
    static final double Z_P99 = 2.326;
    static final String FAILED_TRANSACTION = "FailedTransaction";

    private final MetricsAggregator aggregator;

    PgbenchReportBuilder(MetricsAggregator aggregator) {
        this.aggregator = aggregator;
    }

    TestReport build(String testId, Instant start, Instant end, PgbenchRunConfig config, List<String> command,
                     ProcessOutput output, PgbenchSummary summary, List<TransactionSample> samples,
                     List<String> scriptSlots, int queriesTested) {
        List<Double> okLatencies = new ArrayList<>();
        long loggedFailures = 0;
        for (TransactionSample sample : samples) {
            if (sample.failed()) {
                loggedFailures++;
            } else {
                okLatencies.add(sample.latencyMs());
            }
        }
        double[] sorted = Percentiles.sorted(okLatencies);

        Map<String, Double> measured = new LinkedHashMap<>();
        Map<String, Double> estimated = new LinkedHashMap<>();
        if (sorted.length > 0) {
            measured.put("p50", Percentiles.nearestRank(sorted, 0.50));
            measured.put("p95", Percentiles.nearestRank(sorted, 0.95));
            measured.put("p99", Percentiles.nearestRank(sorted, 0.99));
            measured.put("p99.9", Percentiles.nearestRank(sorted, 0.999));
        } else if (summary.averageLatencyMs() != null && summary.latencyStddevMs() != null) {
            estimated.put("p95", Percentiles.estimate(summary.averageLatencyMs(), summary.latencyStddevMs(), Z_P95));
            estimated.put("p99", Percentiles.estimate(summary.averageLatencyMs(), summary.latencyStddevMs(), Z_P99));
        }
        PercentileSource source = !measured.isEmpty() ? PercentileSource.MEASURED
                : !estimated.isEmpty() ? PercentileSource.ESTIMATED
                : PercentileSource.NONE;
        Map<String, Double> percentiles = source == PercentileSource.MEASURED ? measured : estimated;

        long processed = summary.transactionsProcessed() != null ? summary.transactionsProcessed() : okLatencies.size();
        long failed = summary.failedTransactions() != null ? summary.failedTransactions() : loggedFailures;
        long total = processed + failed;

        Double average = summary.averageLatencyMs();
        if (average == null && sorted.length > 0) {
            average = mean(sorted);
        }
        double elapsedSeconds = Duration.between(start, end).toNanos() / 1_000_000_000.0;
        double throughput = summary.tps() != null ? summary.tps()
                : elapsedSeconds > 0 ? total / elapsedSeconds : 0.0;

        Map<String, Long> errors = new LinkedHashMap<>();
        if (failed > 0) {
            errors.put(FAILED_TRANSACTION, failed);
        }

        List<String> recommendations = aggregator.pgbenchRecommendations(summary.tps(), average, config.clients(),
                measured.get("p50"), measured.get("p95"));

        PgbenchDetails details = new PgbenchDetails(
                command,
                output.exitCode(),
                output.stdout(),
                output.stderr(),
                summary.tps(),
                summary.averageLatencyMs(),
                summary.latencyStddevMs(),
                measured,
                estimated,
                summary.statements(),
                summary.progress(),
                summary.transactionsProcessed(),
                summary.failedTransactions(),
                queriesTested,
                config.clients(),
                config.jobs()
        );

        return new TestReport(
                testId,
                BackendKind.PGBENCH,
                RunOutcome.COMPLETED,
                null,
                start,
                end,
                elapsedSeconds,
                config.clients(),
                total,
                processed,
                failed,
                total > 0 ? (double) processed / total : 0.0,
                average != null ? average : 0.0,
                sorted.length > 0 ? sorted[0] : 0.0,
                sorted.length > 0 ? sorted[sorted.length - 1] : 0.0,
                percentiles.getOrDefault("p50", 0.0),
                percentiles.getOrDefault("p95", 0.0),
                percentiles.getOrDefault("p99", 0.0),
                source,
                throughput,
                perQuery(summary, samples, scriptSlots),
                errors,
                null,
                recommendations,
                List.of(),
                details
        );
    }

    /**
     * Per-query figures from the transaction logs, else from the per-script blocks, else from
     * the overall summary when only one query ran.
     */
    List<QuerySummary> perQuery(PgbenchSummary summary, List<TransactionSample> samples, List<String> scriptSlots) {
        if (!samples.isEmpty()) {
            return fromSamples(samples, scriptSlots);
        }
        if (!summary.scripts().isEmpty()) {
            return fromScriptBlocks(summary.scripts(), scriptSlots);
        }
        List<String> distinct = scriptSlots.stream().distinct().toList();
        if (distinct.size() == 1 && summary.transactionsProcessed() != null) {
            long ok = summary.transactionsProcessed();
            long ko = summary.failedTransactions() != null ? summary.failedTransactions() : 0;
            double avg = summary.averageLatencyMs() != null ? summary.averageLatencyMs() : 0.0;
            return List.of(new QuerySummary(distinct.get(0), ok + ko, ok, ko,
                    ok + ko > 0 ? (double) ok / (ok + ko) : 0.0, avg, 0.0, 0.0, 0.0, 0.0));
        }
        return List.of();
    }

    private List<QuerySummary> fromSamples(List<TransactionSample> samples, List<String> scriptSlots) {
        Map<String, List<Double>> latencies = new TreeMap<>();
        Map<String, Long> failures = new TreeMap<>();
        for (TransactionSample sample : samples) {
            String query = slotQuery(scriptSlots, sample.scriptSlot());
            latencies.computeIfAbsent(query, q -> new ArrayList<>());
            if (sample.failed()) {
                failures.merge(query, 1L, Long::sum);
            } else {
                latencies.get(query).add(sample.latencyMs());
            }
        }
        List<QuerySummary> summaries = new ArrayList<>();
        latencies.forEach((query, values) -> {
            double[] sorted = Percentiles.sorted(values);
            long ok = sorted.length;
            long ko = failures.getOrDefault(query, 0L);
            summaries.add(new QuerySummary(query, ok + ko, ok, ko, (double) ok / (ok + ko),
                    ok > 0 ? mean(sorted) : 0.0,
                    ok > 0 ? sorted[0] : 0.0,
                    ok > 0 ? sorted[sorted.length - 1] : 0.0,
                    Percentiles.nearestRank(sorted, 0.95),
                    Percentiles.nearestRank(sorted, 0.99)));
        });
        return summaries;
    }

    private List<QuerySummary> fromScriptBlocks(List<PgbenchSummary.ScriptSummary> blocks, List<String> scriptSlots) {
        Map<String, long[]> counts = new TreeMap<>();
        Map<String, Double> weightedLatency = new TreeMap<>();
        for (PgbenchSummary.ScriptSummary block : blocks) {
            String query = slotQuery(scriptSlots, block.number() - 1);
            long ok = block.transactions() != null ? block.transactions() : 0;
            long ko = block.failed() != null ? block.failed() : 0;
            long[] c = counts.computeIfAbsent(query, q -> new long[2]);
            c[0] += ok;
            c[1] += ko;
            if (block.averageLatencyMs() != null) {
                weightedLatency.merge(query, block.averageLatencyMs() * ok, Double::sum);
            }
        }
        List<QuerySummary> summaries = new ArrayList<>();
        counts.forEach((query, c) -> {
            long ok = c[0];
            long ko = c[1];
            double avg = ok > 0 ? weightedLatency.getOrDefault(query, 0.0) / ok : 0.0;
            summaries.add(new QuerySummary(query, ok + ko, ok, ko, ok + ko > 0 ? (double) ok / (ok + ko) : 0.0,
                    avg, 0.0, 0.0, 0.0, 0.0));
        });
        return summaries;
    }

    private static String slotQuery(List<String> scriptSlots, int slot) {
        return slot >= 0 && slot < scriptSlots.size() ? scriptSlots.get(slot) : "script_" + slot;
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }
}
