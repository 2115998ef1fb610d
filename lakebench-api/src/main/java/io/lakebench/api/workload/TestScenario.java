package io.lakebench.api.workload;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One named set of bound parameter values for a query, executed a fixed number of times.
 *
 * @param name            scenario name, reported with every execution
 * @param parameters      positional values, one per {@code %s} placeholder (null values allowed)
 * @param repetitionCount how many times the query runs with these values
 * @param description     free text, may be null
 */
public record TestScenario(String name, List<Object> parameters, int repetitionCount, String description) {

    public static final int MAX_REPETITIONS = 1000;

    public TestScenario {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Scenario name must not be blank");
        }
        if (repetitionCount < 1 || repetitionCount > MAX_REPETITIONS) {
            throw new IllegalArgumentException(
                    "Scenario '" + name + "' repetition count must be between 1 and " + MAX_REPETITIONS);
        }
        parameters = parameters == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public TestScenario(String name, List<Object> parameters, int repetitionCount) {
        this(name, parameters, repetitionCount, null);
    }

    /**
     * A scenario without parameters.
     */
    public static TestScenario of(String name, int repetitionCount) {
        return new TestScenario(name, List.of(), repetitionCount, null);
    }
}
