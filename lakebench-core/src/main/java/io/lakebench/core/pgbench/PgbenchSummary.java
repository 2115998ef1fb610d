package io.lakebench.core.pgbench;

import io.lakebench.api.report.ProgressSample;
import io.lakebench.api.report.StatementLatency;

import java.util.List;

/**
 * Figures pgbench printed on its standard streams. Null where the tool did not report a value.
 *
 * @param scripts per-script blocks, empty when a single script ran
 */
public record PgbenchSummary(
        String transactionType,
        Double tps,
        Double averageLatencyMs,
        Double latencyStddevMs,
        Long transactionsProcessed,
        Long failedTransactions,
        List<ScriptSummary> scripts,
        List<StatementLatency> statements,
        List<ProgressSample> progress
) {

    /**
     * One "SQL script N" block of a multi-script run.
     *
     * @param number       1-based script slot number
     * @param script       script file name
     * @param transactions transactions the slot processed
     * @param failed       failed transactions of the slot
     */
    public record ScriptSummary(int number, String script, Long transactions, Long failed, Double averageLatencyMs) {}
}
