package io.lakebench.core.metrics;

import java.util.Arrays;
import java.util.Collection;

/**
 * Nearest-rank percentiles: for percentile p over n ascending values the zero-based index
 * is {@code floor(p * (n - 1))}, clamped to the last value.
 */
public final class Percentiles {

    private Percentiles() {}

    /**
     * @param sorted ascending values
     * @param p      percentile as a fraction, e.g. 0.95
     * @return the value at the nearest rank, 0 for an empty array
     */
    public static double nearestRank(double[] sorted, double p) {
        if (sorted.length == 0) {
            return 0.0;
        }
        int index = (int) Math.floor(p * (sorted.length - 1));
        index = Math.max(0, Math.min(index, sorted.length - 1));
        return sorted[index];
    }

    public static double[] sorted(Collection<Double> values) {
        double[] array = values.stream().mapToDouble(Double::doubleValue).toArray();
        Arrays.sort(array);
        return array;
    }

    /**
     * Normal-distribution approximation from mean and standard deviation.
     *
     * @param z standard score, e.g. 1.645 for p95
     */
    public static double estimate(double mean, double stddev, double z) {
        return mean + z * stddev;
    }
}
