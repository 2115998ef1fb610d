package io.lakebench.core.report;

import io.lakebench.api.report.TestReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvReportGeneratorTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldGenerateCsvSummary() throws IOException {
        Path result = new CsvReportGenerator().generate(ReportFixtures.report(), tempDir.resolve("report.csv"));

        assertThat(result).isEqualTo(tempDir.resolve("report-summary.csv"));
        List<String> lines = Files.readAllLines(result);

        // Header + 2 query rows, sorted by identifier
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("query,total,success,failure,success_rate,avg_ms,min_ms,max_ms,p95_ms,p99_ms");
        assertThat(lines.get(1)).startsWith("\"count, all\",2,1,1,0.5000,");
        assertThat(lines.get(2)).startsWith("lookup,4,4,0,1.0000,");
    }

    @Test
    void csvSummaryShouldBeParseable() throws IOException {
        new CsvReportGenerator().generate(ReportFixtures.report(), tempDir.resolve("data.csv"));

        String[] fields = Files.readAllLines(tempDir.resolve("data-summary.csv")).get(2).split(",");
        assertThat(fields[0]).isEqualTo("lookup");
        assertThat(Long.parseLong(fields[1])).isEqualTo(4);
        assertThat(Double.parseDouble(fields[5])).isEqualTo(11.5);   // avg ms
        assertThat(Double.parseDouble(fields[6])).isEqualTo(10.0);   // min ms
        assertThat(Double.parseDouble(fields[7])).isEqualTo(13.0);   // max ms
    }

    @Test
    void shouldWriteEveryRawResult() throws IOException {
        new CsvReportGenerator().generate(ReportFixtures.report(), tempDir.resolve("report.csv"));

        List<String> lines = Files.readAllLines(tempDir.resolve("report-results.csv"));

        assertThat(lines).hasSize(7);
        assertThat(lines.get(0)).startsWith("query,scenario,start_time");
        assertThat(lines.get(1)).startsWith("lookup,by_id,2026-02-14T10:00:00Z,").endsWith(",true,1,,");
        assertThat(lines.get(6)).endsWith(",false,,SQLSyntaxErrorException,\"syntax error at \"\"FROM\"\"\"");
    }

    @Test
    void shouldCreateDirectories() {
        Path output = tempDir.resolve("sub/dir/report.csv");

        new CsvReportGenerator().generate(ReportFixtures.report(), output);

        assertThat(tempDir.resolve("sub/dir/report-summary.csv")).exists();
        assertThat(tempDir.resolve("sub/dir/report-results.csv")).exists();
    }

    @Test
    void shouldHandleEmptyRun() throws IOException {
        TestReport empty = new io.lakebench.core.metrics.MetricsAggregator().aggregate(List.of(), 1);

        new CsvReportGenerator().generate(empty, tempDir.resolve("empty.csv"));

        assertThat(Files.readAllLines(tempDir.resolve("empty-summary.csv"))).hasSize(1);
        assertThat(Files.readAllLines(tempDir.resolve("empty-results.csv"))).hasSize(1);
    }

    @Test
    void csvFormatShouldBeCSV() {
        assertThat(new CsvReportGenerator().format()).isEqualTo("CSV");
    }
}
