package io.lakebench.api.workload;

import java.util.List;
import java.util.Objects;

/**
 * A named SQL statement and the scenarios it is exercised with.
 * <p>
 * The SQL uses {@code %s} positional placeholders. Every scenario must supply exactly one
 * value per placeholder.
 *
 * @param identifier unique within a run
 * @param sqlText    SQL with {@code %s} placeholders
 * @param scenarios  ordered scenarios, at least one
 */
public record BenchmarkQuery(String identifier, String sqlText, List<TestScenario> scenarios) {

    public BenchmarkQuery {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(sqlText, "sqlText");
        if (identifier.isBlank()) {
            throw new IllegalArgumentException("Query identifier must not be blank");
        }
        if (sqlText.isBlank()) {
            throw new IllegalArgumentException("Query '" + identifier + "' is empty");
        }
        if (scenarios == null || scenarios.isEmpty()) {
            throw new IllegalArgumentException("Query '" + identifier + "' needs at least one scenario");
        }
        int placeholders = SqlPlaceholders.count(sqlText);
        for (TestScenario scenario : scenarios) {
            if (scenario.parameters().size() != placeholders) {
                throw new IllegalArgumentException("Scenario '" + scenario.name() + "' of query '" + identifier
                        + "' has " + scenario.parameters().size() + " parameters, expected " + placeholders);
            }
        }
        scenarios = List.copyOf(scenarios);
    }

    /**
     * A single-scenario query without parameters.
     */
    public static BenchmarkQuery simple(String identifier, String sqlText, int repetitionCount) {
        return new BenchmarkQuery(identifier, sqlText, List.of(TestScenario.of("default", repetitionCount)));
    }

    /**
     * @return number of placeholders in the SQL text
     */
    public int parameterCount() {
        return SqlPlaceholders.count(sqlText);
    }

    /**
     * @return total executions this query contributes to a run
     */
    public int totalRepetitions() {
        return scenarios.stream().mapToInt(TestScenario::repetitionCount).sum();
    }
}
