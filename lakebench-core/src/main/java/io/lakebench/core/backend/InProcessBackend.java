package io.lakebench.core.backend;

import io.lakebench.api.backend.BenchmarkBackend;
import io.lakebench.api.backend.InProcessBenchmarkRequest;
import io.lakebench.api.backend.StatusListener;
import io.lakebench.api.credential.CredentialProvider;
import io.lakebench.api.credential.TargetResolver;
import io.lakebench.api.pool.PoolStatus;
import io.lakebench.api.report.BackendKind;
import io.lakebench.api.report.RunOutcome;
import io.lakebench.api.report.RunStatus;
import io.lakebench.api.report.TestReport;
import io.lakebench.api.workload.ExecutionResult;
import io.lakebench.core.metrics.MetricsAggregator;
import io.lakebench.core.metrics.RunMetricsCollector;
import io.lakebench.core.pool.ConnectionPoolManager;
import io.lakebench.core.pool.ManagedPool;
import io.lakebench.core.workload.WorkloadExecutor;
import io.lakebench.core.workload.WorkloadRun;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs queries over the engine's own connection pool.
 * <p>
 * Each run opens a pool for its target, executes the workload, aggregates the results and
 * closes the pool again, whether the run completed, was stopped or failed.
 */
public class InProcessBackend implements BenchmarkBackend<InProcessBenchmarkRequest> {

    private static final Logger log = LoggerFactory.getLogger(InProcessBackend.class);

    private final ConnectionPoolManager poolManager;
    private final CredentialProvider credentialProvider;
    private final TargetResolver targetResolver;
    private final MetricsAggregator aggregator;
    private final MeterRegistry registry;
    private final Duration statusInterval;
    private final List<StatusListener> listeners = new CopyOnWriteArrayList<>();
    private final Set<WorkloadRun> activeRuns = ConcurrentHashMap.newKeySet();

    public InProcessBackend(ConnectionPoolManager poolManager, CredentialProvider credentialProvider,
                            TargetResolver targetResolver) {
        this(poolManager, credentialProvider, targetResolver, new MetricsAggregator(),
                new SimpleMeterRegistry(), Duration.ofSeconds(1));
    }

    public InProcessBackend(ConnectionPoolManager poolManager, CredentialProvider credentialProvider,
                            TargetResolver targetResolver, MetricsAggregator aggregator,
                            MeterRegistry registry, Duration statusInterval) {
        this.poolManager = poolManager;
        this.credentialProvider = credentialProvider;
        this.targetResolver = targetResolver;
        this.aggregator = aggregator;
        this.registry = registry;
        this.statusInterval = statusInterval;
    }

    /**
     * @throws io.lakebench.api.error.AuthenticationException if no credential could be issued
     * @throws io.lakebench.api.error.TargetNotFoundException if the instance does not exist
     * @throws io.lakebench.api.error.ConnectivityException   if the pool cannot connect
     */
    @Override
    public TestReport run(InProcessBenchmarkRequest request) {
        ManagedPool pool = poolManager.initialize(request.target(), request.poolConfig(),
                credentialProvider, targetResolver);
        Instant start = Instant.now();
        String testId = MetricsAggregator.newTestId("test", start);
        RunMetricsCollector metrics = new RunMetricsCollector(registry, testId);
        listeners.forEach(metrics::onStatus);

        WorkloadRun run = null;
        try {
            metrics.publish(metrics.snapshot(RunStatus.State.PENDING, "pool ready"));
            metrics.start(statusInterval);

            WorkloadExecutor executor = new WorkloadExecutor(pool, request.poolConfig().statementTimeoutSeconds(), metrics);
            run = executor.start(request.queries(), request.concurrencyLevel());
            activeRuns.add(run);
            List<ExecutionResult> results = run.results().join();
            PoolStatus poolStatus = pool.status();

            TestReport report = aggregator.aggregate(results, request.concurrencyLevel(), testId)
                    .withPoolStatus(poolStatus);
            if (run.wasCancelled()) {
                report = report.withOutcome(RunOutcome.CANCELLED,
                        "stopped after " + results.size() + " of " + run.expectedExecutions() + " executions");
            }
            metrics.stop();
            metrics.publish(metrics.snapshot(
                    run.wasCancelled() ? RunStatus.State.CANCELLED : RunStatus.State.COMPLETED,
                    report.outcome().name().toLowerCase()));

            log.info("Run {} {}: {} executions, success rate {}, throughput {} qps, peak in flight {}",
                    testId, report.outcome(), report.totalExecutions(),
                    String.format("%.3f", report.successRate()), String.format("%.2f", report.throughputQps()),
                    run.peakInFlight());
            return report;
        } catch (RuntimeException e) {
            log.error("Run {} failed", testId, e);
            metrics.stop();
            metrics.publish(metrics.snapshot(RunStatus.State.FAILED, String.valueOf(e.getMessage())));
            throw e;
        } finally {
            if (run != null) {
                activeRuns.remove(run);
            }
            metrics.close();
            pool.close();
        }
    }

    /**
     * Stop every run in progress. Stopped runs still return a report of what was attempted.
     */
    public void stopAll() {
        activeRuns.forEach(WorkloadRun::stop);
    }

    /**
     * @return number of runs currently executing
     */
    public int activeRuns() {
        return activeRuns.size();
    }

    @Override
    public BackendKind kind() {
        return BackendKind.IN_PROCESS;
    }

    @Override
    public void onStatus(StatusListener listener) {
        listeners.add(listener);
    }
}
