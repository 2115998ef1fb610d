package io.lakebench.core.backend;

import io.lakebench.api.backend.BenchmarkRequest;
import io.lakebench.api.backend.InProcessBenchmarkRequest;
import io.lakebench.api.backend.PgbenchBenchmarkRequest;
import io.lakebench.api.backend.StatusListener;
import io.lakebench.api.credential.CredentialProvider;
import io.lakebench.api.credential.TargetResolver;
import io.lakebench.api.error.BenchmarkExecutionException;
import io.lakebench.api.report.ReportGenerator;
import io.lakebench.api.report.TestReport;
import io.lakebench.core.pgbench.PgbenchBackend;
import io.lakebench.core.pool.ConnectionPoolManager;
import io.lakebench.core.report.JsonReportWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for running benchmarks.
 * <p>
 * Usage:
 * <pre>{@code
 * var identity = new WorkspaceIdentityService(WorkspaceConfig.fromEnvironment());
 * var engine = BenchmarkEngine.create(identity, identity)
 *     .reportsTo(Path.of("reports"), new JsonReportWriter(), new CsvReportGenerator());
 *
 * engine.onStatus(status -> log.info("{}: {}", status.state(), status.currentStep()));
 *
 * TestReport report = engine.run(InProcessBenchmarkRequest.of(
 *     new InstanceIdentity(workspaceUrl, "my-instance", null), Map.of(), 10, queries));
 * }</pre>
 */
public class BenchmarkEngine {

    private static final Logger log = LoggerFactory.getLogger(BenchmarkEngine.class);

    private final ConnectionPoolManager poolManager;
    private final InProcessBackend inProcessBackend;
    private final PgbenchBackend pgbenchBackend;
    private final List<ReportGenerator> reportGenerators = new ArrayList<>();
    private Path reportDirectory;

    public BenchmarkEngine(ConnectionPoolManager poolManager, InProcessBackend inProcessBackend,
                           PgbenchBackend pgbenchBackend) {
        this.poolManager = poolManager;
        this.inProcessBackend = inProcessBackend;
        this.pgbenchBackend = pgbenchBackend;
    }

    public static BenchmarkEngine create(CredentialProvider credentialProvider, TargetResolver targetResolver) {
        ConnectionPoolManager poolManager = new ConnectionPoolManager();
        return new BenchmarkEngine(poolManager,
                new InProcessBackend(poolManager, credentialProvider, targetResolver),
                new PgbenchBackend(credentialProvider, targetResolver));
    }

    /**
     * Write every finished report, including the partial report of a failed pgbench run,
     * into {@code directory} with each of the given generators.
     */
    public BenchmarkEngine reportsTo(Path directory, ReportGenerator... generators) {
        this.reportDirectory = directory;
        this.reportGenerators.addAll(List.of(generators));
        return this;
    }

    public void onStatus(StatusListener listener) {
        inProcessBackend.onStatus(listener);
        pgbenchBackend.onStatus(listener);
    }

    public TestReport run(BenchmarkRequest request) {
        log.info("Starting {} benchmark against {}", request.backend(), request.target().instanceName());
        TestReport report;
        if (request instanceof InProcessBenchmarkRequest inProcess) {
            report = inProcessBackend.run(inProcess);
        } else if (request instanceof PgbenchBenchmarkRequest pgbench) {
            try {
                report = pgbenchBackend.run(pgbench);
            } catch (BenchmarkExecutionException e) {
                if (e.partialReport() != null) {
                    writeReports(e.partialReport());
                }
                throw e;
            }
        } else {
            throw new IllegalArgumentException("Unsupported benchmark request: " + request.getClass().getName());
        }
        writeReports(report);
        return report;
    }

    /**
     * Stop in-process runs that are still executing. Each returns a CANCELLED report.
     */
    public void stop() {
        inProcessBackend.stopAll();
    }

    public void shutdown() {
        stop();
        poolManager.shutdown();
        log.info("Benchmark engine shut down");
    }

    public ConnectionPoolManager poolManager() {
        return poolManager;
    }

    private void writeReports(TestReport report) {
        if (reportDirectory == null) {
            return;
        }
        for (ReportGenerator generator : reportGenerators) {
            String extension = generator.format().toLowerCase();
            Path output = reportDirectory.resolve(report.testId() + "." + extension);
            try {
                generator.generate(report, output);
                if (generator instanceof JsonReportWriter json && !report.rawResults().isEmpty()) {
                    json.appendResults(report.rawResults(), reportDirectory.resolve(report.testId() + "-results.jsonl"));
                }
            } catch (RuntimeException e) {
                log.error("Failed to generate {} report for {}", generator.format(), report.testId(), e);
            }
        }
    }
}
