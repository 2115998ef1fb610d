package io.lakebench.api.pool;

import java.time.Instant;

/**
 * Snapshot of a connection pool at a point in time.
 *
 * @param baseSize       configured base size
 * @param maxOverflow    configured overflow allowance
 * @param maxConnections base size plus overflow
 * @param total          physical connections currently open
 * @param active         connections checked out by callers
 * @param idle           open connections waiting in the pool
 * @param waiting        callers blocked waiting for a connection
 * @param overflow       open connections beyond the base size
 * @param timestamp      when the snapshot was taken
 */
public record PoolStatus(
        int baseSize,
        int maxOverflow,
        int maxConnections,
        int total,
        int active,
        int idle,
        int waiting,
        int overflow,
        Instant timestamp
) {}
