package io.lakebench.api.report;

/**
 * One time-windowed progress line: at {@code elapsedSeconds}, {@code tps} transactions per second
 * with {@code latencyMs} average latency (null when not reported).
 */
public record ProgressSample(double elapsedSeconds, double tps, Double latencyMs, Double latencyStddevMs) {}
