package io.lakebench.api.report;

import java.nio.file.Path;

/**
 * Generates a report file from a completed benchmark.
 * Implementations can produce CSV, JSON, or any other format.
 */
public interface ReportGenerator {

    /**
     * Generate a report file from the test report.
     *
     * @param report     the completed test report
     * @param outputPath path where the report file should be written
     * @return the path to the generated report
     */
    Path generate(TestReport report, Path outputPath);

    /**
     * @return the format name (e.g., "CSV", "JSON")
     */
    String format();
}
