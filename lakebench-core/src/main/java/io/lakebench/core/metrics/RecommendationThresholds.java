package io.lakebench.core.metrics;

/**
 * Thresholds that turn report figures into recommendations.
 */
public final class RecommendationThresholds {

    private double minSuccessRate = 0.95;
    private double errorInvestigationSuccessRate = 0.99;
    private double maxAverageLatencyMs = 5000;
    private double criticalAverageLatencyMs = 10000;
    private double minThroughputQps = 10;
    private int highConcurrencyLevel = 50;
    private double highConcurrencyMinSuccessRate = 0.99;

    private double pgbenchMinTps = 100;
    private double pgbenchMaxAverageLatencyMs = 100;
    private int pgbenchHighClientCount = 50;
    private double pgbenchMinTpsPerClient = 2;
    private double pgbenchMaxTailRatio = 5;

    private RecommendationThresholds() {}

    public static RecommendationThresholds defaults() {
        return new RecommendationThresholds();
    }

    public RecommendationThresholds minSuccessRate(double minSuccessRate) {
        this.minSuccessRate = rate(minSuccessRate);
        return this;
    }

    /**
     * Below this success rate the most common error is called out.
     */
    public RecommendationThresholds errorInvestigationSuccessRate(double rate) {
        this.errorInvestigationSuccessRate = rate(rate);
        return this;
    }

    public RecommendationThresholds maxAverageLatencyMs(double maxAverageLatencyMs) {
        this.maxAverageLatencyMs = maxAverageLatencyMs;
        return this;
    }

    public RecommendationThresholds criticalAverageLatencyMs(double criticalAverageLatencyMs) {
        this.criticalAverageLatencyMs = criticalAverageLatencyMs;
        return this;
    }

    public RecommendationThresholds minThroughputQps(double minThroughputQps) {
        this.minThroughputQps = minThroughputQps;
        return this;
    }

    public RecommendationThresholds highConcurrencyLevel(int highConcurrencyLevel) {
        this.highConcurrencyLevel = highConcurrencyLevel;
        return this;
    }

    public RecommendationThresholds highConcurrencyMinSuccessRate(double rate) {
        this.highConcurrencyMinSuccessRate = rate(rate);
        return this;
    }

    public RecommendationThresholds pgbenchMinTps(double pgbenchMinTps) {
        this.pgbenchMinTps = pgbenchMinTps;
        return this;
    }

    public RecommendationThresholds pgbenchMaxAverageLatencyMs(double latencyMs) {
        this.pgbenchMaxAverageLatencyMs = latencyMs;
        return this;
    }

    public RecommendationThresholds pgbenchHighClientCount(int clients) {
        this.pgbenchHighClientCount = clients;
        return this;
    }

    public RecommendationThresholds pgbenchMinTpsPerClient(double tpsPerClient) {
        this.pgbenchMinTpsPerClient = tpsPerClient;
        return this;
    }

    /**
     * Maximum tolerated p95 / p50 ratio.
     */
    public RecommendationThresholds pgbenchMaxTailRatio(double ratio) {
        this.pgbenchMaxTailRatio = ratio;
        return this;
    }

    public double minSuccessRate() { return minSuccessRate; }
    public double errorInvestigationSuccessRate() { return errorInvestigationSuccessRate; }
    public double maxAverageLatencyMs() { return maxAverageLatencyMs; }
    public double criticalAverageLatencyMs() { return criticalAverageLatencyMs; }
    public double minThroughputQps() { return minThroughputQps; }
    public int highConcurrencyLevel() { return highConcurrencyLevel; }
    public double highConcurrencyMinSuccessRate() { return highConcurrencyMinSuccessRate; }
    public double pgbenchMinTps() { return pgbenchMinTps; }
    public double pgbenchMaxAverageLatencyMs() { return pgbenchMaxAverageLatencyMs; }
    public int pgbenchHighClientCount() { return pgbenchHighClientCount; }
    public double pgbenchMinTpsPerClient() { return pgbenchMinTpsPerClient; }
    public double pgbenchMaxTailRatio() { return pgbenchMaxTailRatio; }

    private static double rate(double value) {
        if (value < 0 || value > 1) {
            throw new IllegalArgumentException("Rate must be between 0 and 1: " + value);
        }
        return value;
    }
}
