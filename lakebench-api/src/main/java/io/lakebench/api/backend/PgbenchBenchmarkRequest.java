package io.lakebench.api.backend;

import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.pgbench.PgbenchRunConfig;
import io.lakebench.api.report.BackendKind;
import io.lakebench.api.workload.WeightedQuery;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Run weighted queries through an external pgbench process.
 *
 * @param target  instance to benchmark
 * @param queries scripts to register, at least one, identifiers unique
 * @param config  tool options
 */
public record PgbenchBenchmarkRequest(
        InstanceIdentity target,
        List<WeightedQuery> queries,
        PgbenchRunConfig config
) implements BenchmarkRequest {

    public PgbenchBenchmarkRequest {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(config, "config");
        if (queries == null || queries.isEmpty()) {
            throw new IllegalArgumentException("At least one query is required");
        }
        Set<String> seen = new HashSet<>();
        for (WeightedQuery query : queries) {
            if (!seen.add(query.query().identifier())) {
                throw new IllegalArgumentException("Duplicate query identifier: " + query.query().identifier());
            }
        }
        queries = List.copyOf(queries);
        config.validate();
    }

    @Override
    public BackendKind backend() {
        return BackendKind.PGBENCH;
    }
}
