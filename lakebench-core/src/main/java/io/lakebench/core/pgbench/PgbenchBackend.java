package io.lakebench.core.pgbench;

import io.lakebench.api.backend.BenchmarkBackend;
import io.lakebench.api.backend.PgbenchBenchmarkRequest;
import io.lakebench.api.backend.StatusListener;
import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.CredentialProvider;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.credential.TargetResolver;
import io.lakebench.api.error.BenchmarkExecutionException;
import io.lakebench.api.pgbench.PgbenchRunConfig;
import io.lakebench.api.report.BackendKind;
import io.lakebench.api.report.ProgressSample;
import io.lakebench.api.report.RunOutcome;
import io.lakebench.api.report.RunStatus;
import io.lakebench.api.report.TestReport;
import io.lakebench.core.metrics.MetricsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs a benchmark through the external pgbench tool.
 * <p>
 * Each query becomes a script file registered {@code weight} times. Connection details and
 * the current credential reach the tool through its environment only. The run is killed
 * when it overruns {@link PgbenchRunConfig#deadline()}.
 */
public class PgbenchBackend implements BenchmarkBackend<PgbenchBenchmarkRequest> {

    private static final Logger log = LoggerFactory.getLogger(PgbenchBackend.class);

    private final CredentialProvider credentialProvider;
    private final TargetResolver targetResolver;
    private final ProcessRunner processRunner;
    private final PgbenchOutputParser parser = new PgbenchOutputParser();
    private final PgbenchReportBuilder reportBuilder;
    private final List<StatusListener> listeners = new CopyOnWriteArrayList<>();

    public PgbenchBackend(CredentialProvider credentialProvider, TargetResolver targetResolver) {
        this(credentialProvider, targetResolver, new MetricsAggregator(), new ProcessRunner());
    }

    public PgbenchBackend(CredentialProvider credentialProvider, TargetResolver targetResolver,
                          MetricsAggregator aggregator, ProcessRunner processRunner) {
        this.credentialProvider = credentialProvider;
        this.targetResolver = targetResolver;
        this.processRunner = processRunner;
        this.reportBuilder = new PgbenchReportBuilder(aggregator);
    }

    @Override
    public TestReport run(PgbenchBenchmarkRequest request) {
        InstanceIdentity identity = request.target();
        PgbenchRunConfig config = request.config();
        DatabaseTarget target = targetResolver.resolve(identity);
        Credential credential = credentialProvider.acquire(identity);

        Instant start = Instant.now();
        String testId = MetricsAggregator.newTestId("pgbench_test", start);
        publish(RunStatus.of(testId, RunStatus.State.PENDING, "writing scripts"));

        try (ScriptWorkspace workspace = ScriptWorkspace.create(request.queries())) {
            List<String> command = PgbenchCommandBuilder.command(config, workspace.scripts());
            log.info("Executing pgbench against {}:{}/{}: {}",
                    target.host(), target.port(), target.database(), String.join(" ", command));
            publish(RunStatus.of(testId, RunStatus.State.RUNNING, "running pgbench"));

            ProcessOutput output = processRunner.run(command,
                    PgbenchCommandBuilder.environment(target, credential),
                    workspace.directory(),
                    config.deadline(),
                    line -> parser.parseProgress(line).ifPresent(sample -> publish(progress(testId, sample))));
            Instant end = Instant.now();

            PgbenchSummary summary = parser.parse(output.stdout(), output.stderr());
            List<TransactionSample> samples = config.detailedLogging()
                    ? parser.readTransactionLog(workspace.transactionLogs())
                    : List.of();
            TestReport report = reportBuilder.build(testId, start, end, config, command, output, summary, samples,
                    workspace.scriptSlots(), request.queries().size());

            if (output.deadlineExceeded()) {
                String reason = "pgbench exceeded its deadline of " + config.deadline().toSeconds() + "s";
                throw failure(testId, reason, output, report);
            }
            if (output.exitCode() != 0) {
                String reason = "pgbench exited with code " + output.exitCode();
                throw failure(testId, reason, output, report);
            }

            log.info("pgbench finished in {}s: tps={}, latency avg={}ms, percentiles {}",
                    output.elapsed().toSeconds(), summary.tps(), summary.averageLatencyMs(),
                    report.percentileSource());
            publish(new RunStatus(testId, RunStatus.State.COMPLETED, "completed", report.totalExecutions(), -1,
                    report.successfulExecutions(), report.failedExecutions(), summary.tps(),
                    summary.averageLatencyMs(), Instant.now()));
            return report;
        }
    }

    @Override
    public BackendKind kind() {
        return BackendKind.PGBENCH;
    }

    @Override
    public void onStatus(StatusListener listener) {
        listeners.add(listener);
    }

    private BenchmarkExecutionException failure(String testId, String reason, ProcessOutput output, TestReport report) {
        log.error("{}: {}", reason, output.stderr().strip());
        publish(RunStatus.of(testId, RunStatus.State.FAILED, reason));
        return new BenchmarkExecutionException(reason, output.exitCode(), output.deadlineExceeded(),
                output.stderr(), output.stdout(), report.withOutcome(RunOutcome.FAILED, reason));
    }

    private static RunStatus progress(String testId, ProgressSample sample) {
        return new RunStatus(testId, RunStatus.State.RUNNING,
                "progress at " + sample.elapsedSeconds() + "s", 0, -1, 0, 0,
                sample.tps(), sample.latencyMs(), Instant.now());
    }

    private void publish(RunStatus status) {
        for (StatusListener listener : listeners) {
            try {
                listener.onStatus(status);
            } catch (Exception e) {
                log.warn("Status listener failed: {}", e.getMessage());
            }
        }
    }
}
