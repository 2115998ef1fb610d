package io.lakebench.api.backend;

import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.pool.PoolConfiguration;
import io.lakebench.api.report.BackendKind;
import io.lakebench.api.workload.BenchmarkQuery;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Run queries through the engine's own connection pool at a fixed concurrency level.
 *
 * @param target           instance to benchmark
 * @param poolConfig       pool settings for the run
 * @param concurrencyLevel maximum executions in flight, 1 to {@value #MAX_CONCURRENCY}
 * @param queries          queries to run, 1 to {@value #MAX_QUERIES}, identifiers unique
 */
public record InProcessBenchmarkRequest(
        InstanceIdentity target,
        PoolConfiguration poolConfig,
        int concurrencyLevel,
        List<BenchmarkQuery> queries
) implements BenchmarkRequest {

    public static final int MAX_CONCURRENCY = 1000;
    public static final int MAX_QUERIES = 50;

    public InProcessBenchmarkRequest {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(poolConfig, "poolConfig");
        if (concurrencyLevel < 1 || concurrencyLevel > MAX_CONCURRENCY) {
            throw new IllegalArgumentException("Concurrency level must be between 1 and " + MAX_CONCURRENCY);
        }
        if (queries == null || queries.isEmpty() || queries.size() > MAX_QUERIES) {
            throw new IllegalArgumentException("Between 1 and " + MAX_QUERIES + " queries are required");
        }
        Set<String> seen = new HashSet<>();
        for (BenchmarkQuery query : queries) {
            if (!seen.add(query.identifier())) {
                throw new IllegalArgumentException("Duplicate query identifier: " + query.identifier());
            }
        }
        queries = List.copyOf(queries);
    }

    /**
     * Build a request from the loosely typed pool overrides the API layer accepts.
     *
     * @see PoolConfiguration#fromOverrides(Map, int)
     */
    public static InProcessBenchmarkRequest of(InstanceIdentity target, Map<String, ?> poolOverrides,
                                               int concurrencyLevel, List<BenchmarkQuery> queries) {
        return new InProcessBenchmarkRequest(target,
                PoolConfiguration.fromOverrides(poolOverrides == null ? Map.of() : poolOverrides, concurrencyLevel),
                concurrencyLevel, queries);
    }

    @Override
    public BackendKind backend() {
        return BackendKind.IN_PROCESS;
    }

    /**
     * @return executions a completed run produces
     */
    public int expectedExecutions() {
        return queries.stream().mapToInt(BenchmarkQuery::totalRepetitions).sum();
    }
}
