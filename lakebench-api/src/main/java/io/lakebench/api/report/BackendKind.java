package io.lakebench.api.report;

/**
 * Which execution backend produced a report.
 */
public enum BackendKind {
    /** Queries dispatched by the engine over its own connection pool. */
    IN_PROCESS,
    /** Load generated by an external pgbench process. */
    PGBENCH
}
