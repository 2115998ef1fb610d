package io.lakebench.api.backend;

import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.pgbench.PgbenchRunConfig;
import io.lakebench.api.pool.PoolConfiguration;
import io.lakebench.api.report.BackendKind;
import io.lakebench.api.workload.BenchmarkQuery;
import io.lakebench.api.workload.TestScenario;
import io.lakebench.api.workload.WeightedQuery;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BenchmarkRequestTest {

    private static final InstanceIdentity TARGET = new InstanceIdentity("https://workspace.test", "orders", null);

    @Test
    void identityShouldDefaultDatabase() {
        assertThat(TARGET.database()).isEqualTo(InstanceIdentity.DEFAULT_DATABASE);
        assertThat(TARGET.poolKey()).isEqualTo("orders/databricks_postgres");
        assertThatThrownBy(() -> new InstanceIdentity("https://workspace.test", " ", "db"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldCountExpectedExecutions() {
        var request = InProcessBenchmarkRequest.of(TARGET, Map.of(), 4, List.of(
                BenchmarkQuery.simple("a", "SELECT 1", 10),
                new BenchmarkQuery("b", "SELECT %s", List.of(
                        new TestScenario("x", List.of(1), 3),
                        new TestScenario("y", List.of(2), 2)))));

        assertThat(request.backend()).isEqualTo(BackendKind.IN_PROCESS);
        assertThat(request.expectedExecutions()).isEqualTo(15);
        assertThat(request.poolConfig().baseSize()).isEqualTo(4);
    }

    @Test
    void shouldRejectDuplicateIdentifiers() {
        assertThatThrownBy(() -> new InProcessBenchmarkRequest(TARGET, PoolConfiguration.create(), 1, List.of(
                BenchmarkQuery.simple("a", "SELECT 1", 1),
                BenchmarkQuery.simple("a", "SELECT 2", 1))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate");
    }

    @Test
    void shouldBoundConcurrencyAndQueryCount() {
        List<BenchmarkQuery> one = List.of(BenchmarkQuery.simple("a", "SELECT 1", 1));
        List<BenchmarkQuery> tooMany = IntStream.rangeClosed(0, InProcessBenchmarkRequest.MAX_QUERIES)
                .mapToObj(i -> BenchmarkQuery.simple("q" + i, "SELECT 1", 1))
                .collect(Collectors.toList());

        assertThatThrownBy(() -> new InProcessBenchmarkRequest(TARGET, PoolConfiguration.create(), 0, one))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InProcessBenchmarkRequest(TARGET, PoolConfiguration.create(), 1001, one))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InProcessBenchmarkRequest(TARGET, PoolConfiguration.create(), 1, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new InProcessBenchmarkRequest(TARGET, PoolConfiguration.create(), 1, tooMany))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pgbenchRequestShouldValidateConfig() {
        var queries = List.of(WeightedQuery.of("a", "SELECT 1;", 1));

        assertThat(new PgbenchBenchmarkRequest(TARGET, queries, PgbenchRunConfig.create()).backend())
                .isEqualTo(BackendKind.PGBENCH);
        assertThatThrownBy(() -> new PgbenchBenchmarkRequest(TARGET, queries,
                PgbenchRunConfig.create().clients(1).jobs(2)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new PgbenchBenchmarkRequest(TARGET, List.of(), PgbenchRunConfig.create()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void pgbenchRequestShouldRejectDuplicateIdentifiers() {
        assertThatThrownBy(() -> new PgbenchBenchmarkRequest(TARGET, List.of(
                WeightedQuery.of("a", "SELECT 1;", 1),
                WeightedQuery.of("a", "SELECT 2;", 3)), PgbenchRunConfig.create()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate query identifier: a");
    }

    @Test
    void credentialShouldHideToken() {
        var credential = new Credential("secret-token", Instant.now(), "orders");

        assertThat(credential.toString()).doesNotContain("secret-token").contains("orders");
    }
}
