package io.lakebench.core.workload;

import io.lakebench.api.workload.BenchmarkQuery;
import io.lakebench.api.workload.ExecutionResult;
import io.lakebench.api.workload.SqlPlaceholders;
import io.lakebench.api.workload.TestScenario;
import io.lakebench.core.metrics.RunMetricsCollector;
import io.lakebench.core.pool.ConnectionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Runs every (query, scenario, repetition) unit of a workload with at most
 * {@code concurrencyLevel} units in flight.
 * <p>
 * Each unit checks out its own connection and produces exactly one result. A failing unit
 * never affects the others; any error it raises becomes a failed result.
 */
public class WorkloadExecutor {

    private static final Logger log = LoggerFactory.getLogger(WorkloadExecutor.class);
    private static final long ADMISSION_POLL_MS = 50;

    private final ConnectionSource connections;
    private final int statementTimeoutSeconds;
    private final RunMetricsCollector metrics;

    public WorkloadExecutor(ConnectionSource connections, int statementTimeoutSeconds, RunMetricsCollector metrics) {
        this.connections = connections;
        this.statementTimeoutSeconds = statementTimeoutSeconds;
        this.metrics = metrics;
    }

    /**
     * Run the workload to completion.
     *
     * @return one result per unit, in workload order
     */
    public List<ExecutionResult> run(List<BenchmarkQuery> queries, int concurrencyLevel) throws InterruptedException {
        WorkloadRun run = start(queries, concurrencyLevel);
        try {
            return run.results().get();
        } catch (InterruptedException e) {
            run.stop();
            throw e;
        } catch (ExecutionException e) {
            throw new CompletionException(e.getCause());
        }
    }

    /**
     * Start the workload in the background.
     */
    public WorkloadRun start(List<BenchmarkQuery> queries, int concurrencyLevel) {
        if (concurrencyLevel < 1) {
            throw new IllegalArgumentException("Concurrency level must be at least 1");
        }
        List<Unit> units = expand(queries);
        AdmissionGate gate = new AdmissionGate(concurrencyLevel);
        WorkloadRun run = new WorkloadRun(gate, units.size());
        metrics.expectedExecutions(units.size());

        log.info("Starting workload: {} queries, {} executions, concurrency {}",
                queries.size(), units.size(), concurrencyLevel);

        Thread dispatcher = new Thread(() -> dispatch(units, gate, run), "lakebench-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        return run;
    }

    private void dispatch(List<Unit> units, AdmissionGate gate, WorkloadRun run) {
        AtomicReferenceArray<ExecutionResult> results = new AtomicReferenceArray<>(units.size());
        AtomicInteger threadIndex = new AtomicInteger(0);
        ExecutorService workers = Executors.newFixedThreadPool(gate.capacity(), r -> {
            Thread t = new Thread(r, "lakebench-worker-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        try {
            for (int i = 0; i < units.size(); i++) {
                if (!admit(gate, run)) {
                    break;
                }
                metrics.recordInFlight(gate.inFlight());
                Unit unit = units.get(i);
                int index = i;
                workers.execute(() -> {
                    Instant started = Instant.now();
                    long startNanos = System.nanoTime();
                    try {
                        results.set(index, execute(unit));
                    } catch (Error e) {
                        // the attempt still counts; the error itself is not ours to swallow
                        results.set(index, failed(unit, started, startNanos, e));
                        log.error("Execution of '{}' aborted by {}", unit.queryIdentifier(), e.toString());
                        throw e;
                    } finally {
                        gate.release();
                        metrics.recordInFlight(gate.inFlight());
                    }
                });
            }
        } catch (RuntimeException e) {
            log.error("Workload dispatch failed", e);
            shutdown(workers);
            run.fail(e);
            return;
        }

        shutdown(workers);
        List<ExecutionResult> collected = new ArrayList<>(units.size());
        for (int i = 0; i < results.length(); i++) {
            ExecutionResult result = results.get(i);
            if (result != null) {
                collected.add(result);
            }
        }
        if (run.stopRequested()) {
            log.info("Workload stopped: {} of {} executions attempted", collected.size(), units.size());
        } else {
            log.info("Workload finished: {} executions, peak in flight {}", collected.size(), gate.peakInFlight());
        }
        run.finish(collected);
    }

    /**
     * Wait for a slot while the run is still admitting.
     *
     * @return false once the run was stopped
     */
    private static boolean admit(AdmissionGate gate, WorkloadRun run) {
        try {
            while (run.isRunning()) {
                if (gate.tryAdmit(ADMISSION_POLL_MS, TimeUnit.MILLISECONDS)) {
                    if (run.isRunning()) {
                        return true;
                    }
                    gate.release();
                    return false;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.stop();
        }
        return false;
    }

    ExecutionResult execute(Unit unit) {
        Instant start = Instant.now();
        long startNanos = System.nanoTime();
        try (Connection connection = connections.connection();
             PreparedStatement statement = connection.prepareStatement(unit.jdbcSql())) {
            if (statementTimeoutSeconds > 0) {
                statement.setQueryTimeout(statementTimeoutSeconds);
            }
            List<Object> parameters = unit.scenario().parameters();
            for (int p = 0; p < parameters.size(); p++) {
                statement.setObject(p + 1, parameters.get(p));
            }
            int rows = executeAndCount(statement);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            metrics.recordSuccess(unit.queryIdentifier(), elapsed);
            return ExecutionResult.success(unit.queryIdentifier(), unit.scenario().name(),
                    start, Instant.now(), elapsed.toNanos() / 1_000_000.0, rows);
        } catch (Exception e) {
            return failed(unit, start, startNanos, e);
        }
    }

    private ExecutionResult failed(Unit unit, Instant start, long startNanos, Throwable error) {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        String kind = error.getClass().getSimpleName();
        metrics.recordFailure(unit.queryIdentifier(), elapsed, kind);
        return ExecutionResult.failure(unit.queryIdentifier(), unit.scenario().name(),
                start, Instant.now(), elapsed.toNanos() / 1_000_000.0, kind, String.valueOf(error.getMessage()));
    }

    private static int executeAndCount(PreparedStatement statement) throws java.sql.SQLException {
        if (statement.execute()) {
            int rows = 0;
            try (ResultSet resultSet = statement.getResultSet()) {
                while (resultSet.next()) {
                    rows++;
                }
            }
            return rows;
        }
        return Math.max(0, statement.getUpdateCount());
    }

    static List<Unit> expand(List<BenchmarkQuery> queries) {
        List<Unit> units = new ArrayList<>();
        for (BenchmarkQuery query : queries) {
            String jdbcSql = SqlPlaceholders.toJdbc(query.sqlText());
            for (TestScenario scenario : query.scenarios()) {
                for (int r = 0; r < scenario.repetitionCount(); r++) {
                    units.add(new Unit(query.identifier(), jdbcSql, scenario));
                }
            }
        }
        return units;
    }

    private static void shutdown(ExecutorService workers) {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(1, TimeUnit.HOURS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * One repetition of one scenario of one query.
     */
    record Unit(String queryIdentifier, String jdbcSql, TestScenario scenario) {}
}
