package io.lakebench.core.metrics;

import io.lakebench.api.report.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.awaitility.Awaitility.await;

class RunMetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private RunMetricsCollector collector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        collector = new RunMetricsCollector(registry, "test_42");
    }

    @AfterEach
    void tearDown() {
        collector.stop();
        registry.close();
    }

    // --- Construction ---

    @Test
    void shouldCreateWithDefaultRegistry() {
        var defaultCollector = new RunMetricsCollector("test_1");
        assertThat(defaultCollector.registry()).isNotNull();
        assertThat(defaultCollector.testId()).isEqualTo("test_1");
    }

    // --- recordSuccess / recordFailure ---

    @Test
    void shouldRecordSuccessfulExecution() {
        collector.recordSuccess("lookup", Duration.ofMillis(150));

        Counter counter = registry.find(RunMetricsCollector.SUCCESS)
                .tag("query", "lookup")
                .counter();
        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);

        Timer timer = registry.find(RunMetricsCollector.LATENCY)
                .tags("query", "lookup", "test", "test_42")
                .timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isCloseTo(150.0, within(5.0));
    }

    @Test
    void shouldTrackSuccessAndFailureSeparately() {
        collector.recordSuccess("report", Duration.ofMillis(100));
        collector.recordSuccess("report", Duration.ofMillis(120));
        collector.recordFailure("report", Duration.ofMillis(3000), "SQLTimeoutException");

        assertThat(registry.find(RunMetricsCollector.SUCCESS).tag("query", "report").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.find(RunMetricsCollector.FAILURE).tag("query", "report").counter().count())
                .isEqualTo(1.0);

        // failures are timed too
        assertThat(registry.find(RunMetricsCollector.LATENCY).tag("query", "report").timer().count())
                .isEqualTo(3);
        assertThat(collector.succeeded()).isEqualTo(2);
        assertThat(collector.failed()).isEqualTo(1);
    }

    @Test
    void shouldRecordInFlightExecutions() {
        collector.recordInFlight(7);
        collector.recordInFlight(3);

        Gauge gauge = registry.find(RunMetricsCollector.IN_FLIGHT)
                .tag("test", "test_42")
                .gauge();
        assertThat(gauge).isNotNull();
        assertThat(gauge.value()).isEqualTo(3.0);
    }

    @Test
    void shouldKeepRunsApartInSharedRegistry() {
        var other = new RunMetricsCollector(registry, "test_43");
        collector.recordSuccess("lookup", Duration.ofMillis(10));
        other.recordSuccess("lookup", Duration.ofMillis(10));
        other.recordSuccess("lookup", Duration.ofMillis(10));

        assertThat(collector.snapshot(RunStatus.State.RUNNING, "x").completed()).isEqualTo(1);
        assertThat(other.snapshot(RunStatus.State.RUNNING, "x").completed()).isEqualTo(2);
        assertThat(registry.find(RunMetricsCollector.LATENCY).tag("test", "test_43").timer().count())
                .isEqualTo(2);
    }

    @Test
    void shouldRemoveRunMetersOnClose() {
        var other = new RunMetricsCollector(registry, "test_43");
        collector.recordSuccess("lookup", Duration.ofMillis(10));
        collector.recordFailure("lookup", Duration.ofMillis(10), "SQLException");
        other.recordSuccess("lookup", Duration.ofMillis(10));

        collector.close();

        assertThat(registry.find(RunMetricsCollector.LATENCY).tag("test", "test_42").meters()).isEmpty();
        assertThat(registry.find(RunMetricsCollector.SUCCESS).tag("test", "test_42").meters()).isEmpty();
        assertThat(registry.find(RunMetricsCollector.FAILURE).tag("test", "test_42").meters()).isEmpty();
        assertThat(registry.find(RunMetricsCollector.IN_FLIGHT).tag("test", "test_42").meters()).isEmpty();
        assertThat(registry.find(RunMetricsCollector.LATENCY).tag("test", "test_43").timer().count()).isEqualTo(1);
        // the collector's own counts survive for the final status
        assertThat(collector.snapshot(RunStatus.State.COMPLETED, "done").completed()).isEqualTo(2);
    }

    // --- snapshot ---

    @Test
    void shouldSnapshotProgress() {
        collector.expectedExecutions(10);
        collector.start(Duration.ofHours(1));
        collector.recordSuccess("lookup", Duration.ofMillis(100));
        collector.recordFailure("lookup", Duration.ofMillis(300), "SQLException");

        RunStatus status = collector.snapshot(RunStatus.State.RUNNING, "executing queries");

        assertThat(status.testId()).isEqualTo("test_42");
        assertThat(status.completed()).isEqualTo(2);
        assertThat(status.expected()).isEqualTo(10);
        assertThat(status.succeeded()).isEqualTo(1);
        assertThat(status.failed()).isEqualTo(1);
        assertThat(status.currentLatencyMs()).isCloseTo(200.0, within(5.0));
        assertThat(status.currentTps()).isPositive();
    }

    @Test
    void shouldReportNoRatesBeforeAnyExecution() {
        RunStatus status = collector.snapshot(RunStatus.State.PENDING, "pool ready");

        assertThat(status.completed()).isZero();
        assertThat(status.currentTps()).isNull();
        assertThat(status.currentLatencyMs()).isNull();
    }

    // --- status publication ---

    @Test
    void shouldPublishStatusPeriodically() {
        List<RunStatus> received = new CopyOnWriteArrayList<>();
        collector.onStatus(received::add);

        collector.start(Duration.ofMillis(50));

        await().atMost(Duration.ofSeconds(5)).until(() -> received.size() >= 2);
        assertThat(received).allMatch(s -> s.state() == RunStatus.State.RUNNING);
    }

    @Test
    void shouldIsolateFailingListeners() {
        List<RunStatus> received = new CopyOnWriteArrayList<>();
        collector.onStatus(status -> {
            throw new IllegalStateException("listener broken");
        });
        collector.onStatus(received::add);

        collector.publish(RunStatus.of("test_42", RunStatus.State.COMPLETED, "done"));

        assertThat(received).hasSize(1);
    }

    @Test
    void shouldStopPublishingAfterStop() throws Exception {
        List<RunStatus> received = new CopyOnWriteArrayList<>();
        collector.onStatus(received::add);
        collector.start(Duration.ofMillis(20));
        await().atMost(Duration.ofSeconds(5)).until(() -> !received.isEmpty());

        collector.stop();
        Thread.sleep(50);
        int afterStop = received.size();
        Thread.sleep(100);

        assertThat(received).hasSize(afterStop);
    }
}
