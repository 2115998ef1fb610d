package io.lakebench.core.pgbench;

import io.lakebench.api.report.ProgressSample;
import io.lakebench.api.report.StatementLatency;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PgbenchOutputParserTest {

    private final PgbenchOutputParser parser = new PgbenchOutputParser();

    @TempDir
    Path tempDir;

    @Test
    void shouldParseOverallFigures() {
        PgbenchSummary summary = parser.parse(PgbenchFixtures.MULTI_SCRIPT_OUTPUT, "");

        assertThat(summary.transactionType()).isEqualTo("multiple scripts");
        assertThat(summary.tps()).isEqualTo(240.0);
        assertThat(summary.averageLatencyMs()).isEqualTo(8.1);
        assertThat(summary.latencyStddevMs()).isEqualTo(1.5);
        assertThat(summary.transactionsProcessed()).isEqualTo(240L);
        assertThat(summary.failedTransactions()).isEqualTo(1L);
    }

    @Test
    void shouldParsePerScriptBlocks() {
        PgbenchSummary summary = parser.parse(PgbenchFixtures.MULTI_SCRIPT_OUTPUT, "");

        assertThat(summary.scripts()).hasSize(3);
        PgbenchSummary.ScriptSummary second = summary.scripts().get(1);
        assertThat(second.number()).isEqualTo(2);
        assertThat(second.script()).isEqualTo("query_1.sql");
        assertThat(second.transactions()).isEqualTo(80L);
        assertThat(second.failed()).isEqualTo(1L);
        assertThat(second.averageLatencyMs()).isEqualTo(8.4);
    }

    @Test
    void shouldParseStatementLatenciesWithFailures() {
        List<StatementLatency> statements = parser.parse(PgbenchFixtures.MULTI_SCRIPT_OUTPUT, "").statements();

        assertThat(statements).hasSize(3);
        assertThat(statements.get(0)).isEqualTo(
                new StatementLatency("query_0.sql", "SELECT COUNT(*) FROM orders;", 7.4, 0));
        assertThat(statements.get(1).failures()).isEqualTo(1);
        assertThat(statements.get(1).script()).isEqualTo("query_1.sql");
    }

    @Test
    void shouldParseSingleScriptOutput() {
        PgbenchSummary summary = parser.parse(PgbenchFixtures.SINGLE_SCRIPT_OUTPUT, "");

        assertThat(summary.transactionType()).isEqualTo("query_0.sql");
        assertThat(summary.scripts()).isEmpty();
        assertThat(summary.failedTransactions()).isNull();
        assertThat(summary.transactionsProcessed()).isEqualTo(100L);
        assertThat(summary.statements()).containsExactly(
                new StatementLatency("query_0.sql", "SELECT pg_sleep(0.1);", 99.8, 0));
    }

    @Test
    void shouldCollectProgressFromBothStreams() {
        String stdout = PgbenchFixtures.SINGLE_SCRIPT_OUTPUT + "progress: 3.0 s, 41.0 tps, lat 99.000 ms stddev 19.000\n";

        List<ProgressSample> progress = parser.parse(stdout, PgbenchFixtures.PROGRESS_STDERR).progress();

        assertThat(progress).extracting(ProgressSample::elapsedSeconds).containsExactly(3.0, 1.0, 2.0);
    }

    @Test
    void shouldParseProgressLine() {
        assertThat(parser.parseProgress("progress: 5.0 s, 1234.5 tps, lat 6.481 ms stddev 1.234, 0 failed"))
                .contains(new ProgressSample(5.0, 1234.5, 6.481, 1.234));
        assertThat(parser.parseProgress("progress: 5.0 s, 10.0 tps"))
                .contains(new ProgressSample(5.0, 10.0, null, null));
        assertThat(parser.parseProgress("starting vacuum...end.")).isEmpty();
    }

    @Test
    void shouldReportNothingForEmptyOutput() {
        PgbenchSummary summary = parser.parse("", "");

        assertThat(summary.tps()).isNull();
        assertThat(summary.averageLatencyMs()).isNull();
        assertThat(summary.scripts()).isEmpty();
        assertThat(summary.statements()).isEmpty();
    }

    @Test
    void shouldReadTransactionLogs() throws Exception {
        Path log = tempDir.resolve("pgbench_log.4242");
        Files.writeString(log, PgbenchFixtures.TRANSACTION_LOG + "garbage\n0 4 skipped 0 1767225600 600\n");

        List<TransactionSample> samples = parser.readTransactionLog(List.of(log));

        assertThat(samples).containsExactly(
                new TransactionSample(0, 8.0),
                new TransactionSample(0, 12.0),
                new TransactionSample(1, 9.0),
                new TransactionSample(2, 10.0),
                new TransactionSample(1, null));
    }
}
