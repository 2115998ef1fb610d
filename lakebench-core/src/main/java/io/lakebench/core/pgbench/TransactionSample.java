package io.lakebench.core.pgbench;

/**
 * One line of a pgbench transaction log.
 *
 * @param scriptSlot 0-based script slot the transaction ran
 * @param latencyMs  elapsed time, null for a failed transaction
 */
public record TransactionSample(int scriptSlot, Double latencyMs) {

    public boolean failed() {
        return latencyMs == null;
    }
}
