package io.lakebench.core.metrics;

import io.lakebench.api.backend.StatusListener;
import io.lakebench.api.report.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Live metrics of one in-process run, kept in Micrometer meters.
 * Latency timers and success/failure counters per query, an in-flight gauge, and
 * a periodic {@link RunStatus} published to listeners.
 * <p>
 * Every meter is tagged with the run's test id and removed from the registry on {@link #close()}.
 */
public class RunMetricsCollector implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunMetricsCollector.class);

    public static final String LATENCY = "lakebench.query.latency";
    public static final String SUCCESS = "lakebench.executions.success";
    public static final String FAILURE = "lakebench.executions.failure";
    public static final String IN_FLIGHT = "lakebench.executions.in_flight";

    private final MeterRegistry registry;
    private final String testId;
    private final Map<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final Map<String, Counter> successCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> failureCounters = new ConcurrentHashMap<>();
    private final AtomicLong inFlight = new AtomicLong(0);
    private final AtomicLong succeeded = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private final List<StatusListener> listeners = new CopyOnWriteArrayList<>();
    private final List<Meter> registered = new CopyOnWriteArrayList<>();
    private volatile long expected = -1;
    private volatile Instant startedAt;
    private ScheduledExecutorService scheduler;

    public RunMetricsCollector(String testId) {
        this(new SimpleMeterRegistry(), testId);
    }

    public RunMetricsCollector(MeterRegistry registry, String testId) {
        this.registry = registry;
        this.testId = testId;
        registered.add(Gauge.builder(IN_FLIGHT, inFlight, AtomicLong::get)
                .tag("test", testId)
                .register(registry));
    }

    public void expectedExecutions(long expected) {
        this.expected = expected;
    }

    public void recordSuccess(String queryIdentifier, Duration duration) {
        timer(queryIdentifier).record(duration);
        counter(successCounters, SUCCESS, queryIdentifier).increment();
        succeeded.incrementAndGet();
    }

    public void recordFailure(String queryIdentifier, Duration duration, String errorKind) {
        timer(queryIdentifier).record(duration);
        counter(failureCounters, FAILURE, queryIdentifier).increment();
        failed.incrementAndGet();
        log.debug("Execution of '{}' failed after {}ms: {}", queryIdentifier, duration.toMillis(), errorKind);
    }

    public void recordInFlight(int count) {
        inFlight.set(count);
    }

    /**
     * Current state of the run as a status message.
     */
    public RunStatus snapshot(RunStatus.State state, String step) {
        long ok = succeeded.get();
        long ko = failed.get();
        long completed = ok + ko;
        Double tps = null;
        Instant started = startedAt;
        if (started != null && completed > 0) {
            double elapsed = Duration.between(started, Instant.now()).toNanos() / 1_000_000_000.0;
            tps = elapsed > 0 ? completed / elapsed : null;
        }
        Double latency = null;
        long count = latencyTimers.values().stream().mapToLong(Timer::count).sum();
        if (count > 0) {
            double totalMs = latencyTimers.values().stream()
                    .mapToDouble(t -> t.totalTime(TimeUnit.MILLISECONDS))
                    .sum();
            latency = totalMs / count;
        }
        return new RunStatus(testId, state, step, completed, expected, ok, ko, tps, latency, Instant.now());
    }

    public void onStatus(StatusListener listener) {
        listeners.add(listener);
    }

    /**
     * Deliver a status to every listener. A failing listener does not stop the others.
     */
    public void publish(RunStatus status) {
        for (StatusListener listener : listeners) {
            try {
                listener.onStatus(status);
            } catch (Exception e) {
                log.warn("Status listener failed: {}", e.getMessage());
            }
        }
    }

    public synchronized void start(Duration interval) {
        startedAt = Instant.now();
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lakebench-metrics-collector");
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(() -> {
            try {
                publish(snapshot(RunStatus.State.RUNNING, "executing queries"));
            } catch (Exception e) {
                log.error("Error collecting run status", e);
            }
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.debug("Run status published every {}ms", interval.toMillis());
    }

    /**
     * Stop periodic publishing. Returns once no periodic status can be delivered any more.
     */
    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(1, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
    }

    /**
     * Stop publishing and remove this run's meters from the registry.
     * Counts kept by the collector itself stay readable.
     */
    @Override
    public void close() {
        stop();
        registered.forEach(registry::remove);
        registered.clear();
    }

    public MeterRegistry registry() {
        return registry;
    }

    public String testId() {
        return testId;
    }

    public long succeeded() {
        return succeeded.get();
    }

    public long failed() {
        return failed.get();
    }

    private Timer timer(String queryIdentifier) {
        return latencyTimers.computeIfAbsent(queryIdentifier, name -> track(
                Timer.builder(LATENCY)
                        .tag("query", name)
                        .tag("test", testId)
                        .publishPercentiles(0.5, 0.95, 0.99)
                        .register(registry)));
    }

    private Counter counter(Map<String, Counter> counters, String meter, String queryIdentifier) {
        return counters.computeIfAbsent(queryIdentifier, name -> track(
                Counter.builder(meter)
                        .tag("query", name)
                        .tag("test", testId)
                        .register(registry)));
    }

    private <M extends Meter> M track(M meter) {
        registered.add(meter);
        return meter;
    }
}
