package io.lakebench.api.report;

/**
 * Where a report's latency percentiles come from.
 */
public enum PercentileSource {
    /** Computed from individual latency samples. */
    MEASURED,
    /** Approximated from mean and standard deviation assuming a normal distribution. */
    ESTIMATED,
    /** No latency data was available. */
    NONE
}
