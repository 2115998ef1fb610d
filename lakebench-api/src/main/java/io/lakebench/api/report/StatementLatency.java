package io.lakebench.api.report;

/**
 * Average latency of one statement as reported by pgbench's per-statement table.
 *
 * @param script           script file the statement belongs to
 * @param statement        statement text as echoed by the tool
 * @param averageLatencyMs average latency in milliseconds
 * @param failures         failures reported for the statement, 0 if the tool does not report them
 */
public record StatementLatency(String script, String statement, double averageLatencyMs, long failures) {}
