package io.lakebench.core.report;

import io.lakebench.api.report.QuerySummary;
import io.lakebench.api.report.ReportGenerator;
import io.lakebench.api.report.TestReport;
import io.lakebench.api.workload.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Generates CSV reports from a completed benchmark.
 * <p>
 * Produces two files:
 * <ul>
 *   <li>{name}-summary.csv: per-query summary statistics</li>
 *   <li>{name}-results.csv: every raw execution result</li>
 * </ul>
 */
public class CsvReportGenerator implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(CsvReportGenerator.class);

    @Override
    public Path generate(TestReport report, Path outputPath) {
        try {
            Path dir = outputPath.toAbsolutePath().getParent();
            Files.createDirectories(dir);

            String baseName = outputPath.getFileName().toString().replaceFirst("\\.[^.]+$", "");
            Path summaryPath = dir.resolve(baseName + "-summary.csv");
            Path resultsPath = dir.resolve(baseName + "-results.csv");

            writeSummary(report, summaryPath);
            writeResults(report, resultsPath);

            log.info("CSV reports generated: {} and {}", summaryPath, resultsPath);
            return summaryPath;

        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV report", e);
        }
    }

    @Override
    public String format() {
        return "CSV";
    }

    private void writeSummary(TestReport report, Path path) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("query,total,success,failure,success_rate,avg_ms,min_ms,max_ms,p95_ms,p99_ms");

        for (QuerySummary s : report.perQuery()) {
            lines.add(String.format(Locale.ROOT, "%s,%d,%d,%d,%.4f,%.2f,%.2f,%.2f,%.2f,%.2f",
                    escapeCsv(s.queryIdentifier()),
                    s.totalExecutions(),
                    s.successfulExecutions(),
                    s.failedExecutions(),
                    s.successRate(),
                    s.averageLatencyMs(),
                    s.minLatencyMs(),
                    s.maxLatencyMs(),
                    s.p95LatencyMs(),
                    s.p99LatencyMs()
            ));
        }

        Files.write(path, lines);
    }

    private void writeResults(TestReport report, Path path) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("query,scenario,start_time,end_time,duration_ms,success,rows,error_kind,error_message");

        for (ExecutionResult r : report.rawResults()) {
            lines.add(String.format(Locale.ROOT, "%s,%s,%s,%s,%.3f,%s,%s,%s,%s",
                    escapeCsv(r.queryIdentifier()),
                    escapeCsv(r.scenarioName()),
                    r.startTime(),
                    r.endTime(),
                    r.durationMs(),
                    r.success(),
                    r.rowsReturned() != null ? r.rowsReturned() : "",
                    r.errorKind() != null ? escapeCsv(r.errorKind()) : "",
                    r.errorMessage() != null ? escapeCsv(r.errorMessage()) : ""
            ));
        }

        Files.write(path, lines);
    }

    private static String escapeCsv(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
