package io.lakebench.api.workload;

import java.util.Objects;

/**
 * A query registered with the external benchmark tool with a relative weight.
 * The script is registered {@code weight} times to approximate relative frequency.
 */
public record WeightedQuery(BenchmarkQuery query, int weight) {

    public static final int MAX_WEIGHT = 100;

    public WeightedQuery {
        Objects.requireNonNull(query, "query");
        if (weight < 1 || weight > MAX_WEIGHT) {
            throw new IllegalArgumentException("Weight must be between 1 and " + MAX_WEIGHT + ": " + weight);
        }
    }

    /**
     * A parameterless query for the external tool.
     */
    public static WeightedQuery of(String identifier, String sqlText, int weight) {
        return new WeightedQuery(BenchmarkQuery.simple(identifier, sqlText, 1), weight);
    }
}
