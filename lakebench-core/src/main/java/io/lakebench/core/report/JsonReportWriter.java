package io.lakebench.core.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.lakebench.api.report.ReportGenerator;
import io.lakebench.api.report.TestReport;
import io.lakebench.api.workload.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

/**
 * Writes a test report as a single JSON document, and raw execution results as one JSON
 * object per line.
 */
public class JsonReportWriter implements ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonReportWriter.class);

    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public Path generate(TestReport report, Path outputPath) {
        try {
            createParent(outputPath);
            objectMapper.writeValue(outputPath.toFile(), report);
            log.info("Test report written to: {}", outputPath.toAbsolutePath());
            return outputPath;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON report to " + outputPath, e);
        }
    }

    /**
     * Append results to a JSON-lines file, creating it if needed.
     */
    public Path appendResults(List<ExecutionResult> results, Path streamPath) {
        try {
            createParent(streamPath);
            try (BufferedWriter writer = Files.newBufferedWriter(streamPath,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                for (ExecutionResult result : results) {
                    writer.write(objectMapper.writer()
                            .without(SerializationFeature.INDENT_OUTPUT)
                            .writeValueAsString(result));
                    writer.newLine();
                }
            }
            return streamPath;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append execution results to " + streamPath, e);
        }
    }

    public TestReport read(Path reportPath) {
        try {
            return objectMapper.readValue(reportPath.toFile(), TestReport.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read JSON report from " + reportPath, e);
        }
    }

    @Override
    public String format() {
        return "JSON";
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
