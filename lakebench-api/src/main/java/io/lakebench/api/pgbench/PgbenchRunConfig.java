package io.lakebench.api.pgbench;

import java.time.Duration;

/**
 * Options for a run of the external {@code pgbench} process.
 * <p>
 * A run is bounded either by wall-clock duration or by transactions per client, never both.
 * When neither is set the run lasts {@link #DEFAULT_DURATION}.
 */
public final class PgbenchRunConfig {

    public static final Duration DEFAULT_DURATION = Duration.ofSeconds(30);
    public static final int DEFAULT_MAX_JOBS = 8;
    public static final Duration DEFAULT_TRANSACTION_RUN_LIMIT = Duration.ofMinutes(10);

    private int clients = 8;
    private Integer jobs = null; // null = min(clients, DEFAULT_MAX_JOBS)
    private Duration duration = null;
    private Integer transactionsPerClient = null;
    private Integer progressIntervalSeconds = null;
    private ProtocolMode protocol = ProtocolMode.PREPARED;
    private Integer targetRate = null;
    private boolean perStatementLatency = true;
    private boolean detailedLogging = true;
    private boolean reconnectPerTransaction = false;
    private String executable = "pgbench";
    private Duration deadlineGrace = Duration.ofSeconds(60);
    private Duration transactionRunLimit = DEFAULT_TRANSACTION_RUN_LIMIT;

    private PgbenchRunConfig() {}

    public static PgbenchRunConfig create() {
        return new PgbenchRunConfig();
    }

    public PgbenchRunConfig clients(int clients) {
        if (clients < 1 || clients > 1000) {
            throw new IllegalArgumentException("Clients must be between 1 and 1000");
        }
        this.clients = clients;
        return this;
    }

    /**
     * Worker threads inside the tool. Must not exceed the client count.
     */
    public PgbenchRunConfig jobs(int jobs) {
        if (jobs < 1 || jobs > 100) {
            throw new IllegalArgumentException("Jobs must be between 1 and 100");
        }
        this.jobs = jobs;
        return this;
    }

    public PgbenchRunConfig duration(Duration duration) {
        if (transactionsPerClient != null) {
            throw new IllegalArgumentException("Duration and transaction count are mutually exclusive");
        }
        if (duration.isNegative() || duration.toSeconds() < 1) {
            throw new IllegalArgumentException("Duration must be at least one second");
        }
        this.duration = duration;
        return this;
    }

    public PgbenchRunConfig transactionsPerClient(int transactionsPerClient) {
        if (duration != null) {
            throw new IllegalArgumentException("Duration and transaction count are mutually exclusive");
        }
        if (transactionsPerClient < 1) {
            throw new IllegalArgumentException("Transactions per client must be positive");
        }
        this.transactionsPerClient = transactionsPerClient;
        return this;
    }

    public PgbenchRunConfig progressIntervalSeconds(int progressIntervalSeconds) {
        if (progressIntervalSeconds < 1 || progressIntervalSeconds > 60) {
            throw new IllegalArgumentException("Progress interval must be between 1 and 60 seconds");
        }
        this.progressIntervalSeconds = progressIntervalSeconds;
        return this;
    }

    public PgbenchRunConfig protocol(ProtocolMode protocol) {
        this.protocol = protocol;
        return this;
    }

    /**
     * Throttle to a target rate in transactions per second.
     */
    public PgbenchRunConfig targetRate(int targetRate) {
        if (targetRate < 1) {
            throw new IllegalArgumentException("Target rate must be positive");
        }
        this.targetRate = targetRate;
        return this;
    }

    public PgbenchRunConfig perStatementLatency(boolean perStatementLatency) {
        this.perStatementLatency = perStatementLatency;
        return this;
    }

    /**
     * Write per-transaction log files, which give measured percentiles.
     */
    public PgbenchRunConfig detailedLogging(boolean detailedLogging) {
        this.detailedLogging = detailedLogging;
        return this;
    }

    public PgbenchRunConfig reconnectPerTransaction(boolean reconnectPerTransaction) {
        this.reconnectPerTransaction = reconnectPerTransaction;
        return this;
    }

    /**
     * Path or name of the tool binary.
     */
    public PgbenchRunConfig executable(String executable) {
        this.executable = executable;
        return this;
    }

    /**
     * Extra time on top of the configured duration before the process is killed.
     */
    public PgbenchRunConfig deadlineGrace(Duration deadlineGrace) {
        this.deadlineGrace = deadlineGrace;
        return this;
    }

    /**
     * Wall-clock limit of a transaction-bounded run, before the grace period.
     */
    public PgbenchRunConfig transactionRunLimit(Duration transactionRunLimit) {
        this.transactionRunLimit = transactionRunLimit;
        return this;
    }

    /**
     * Check cross-field constraints. Called before the command line is built.
     */
    public PgbenchRunConfig validate() {
        if (jobs != null && jobs > clients) {
            throw new IllegalArgumentException("Jobs (" + jobs + ") must not exceed clients (" + clients + ")");
        }
        return this;
    }

    public int clients() { return clients; }
    public int jobs() { return jobs != null ? jobs : Math.min(clients, DEFAULT_MAX_JOBS); }
    public Integer transactionsPerClient() { return transactionsPerClient; }
    public Integer progressIntervalSeconds() { return progressIntervalSeconds; }
    public ProtocolMode protocol() { return protocol; }
    public Integer targetRate() { return targetRate; }
    public boolean perStatementLatency() { return perStatementLatency; }
    public boolean detailedLogging() { return detailedLogging; }
    public boolean reconnectPerTransaction() { return reconnectPerTransaction; }
    public String executable() { return executable; }
    public Duration deadlineGrace() { return deadlineGrace; }

    /**
     * @return the configured duration, the default when no bound was set, or null for a
     * transaction-bounded run
     */
    public Duration duration() {
        if (duration != null) {
            return duration;
        }
        return transactionsPerClient == null ? DEFAULT_DURATION : null;
    }

    /**
     * @return how long the process may run before it is killed
     */
    public Duration deadline() {
        Duration bound = transactionBounded() ? transactionRunLimit : duration();
        return bound.plus(deadlineGrace);
    }

    public boolean transactionBounded() {
        return transactionsPerClient != null;
    }

    @Override
    public String toString() {
        return "PgbenchRunConfig[clients=" + clients + ", jobs=" + jobs()
                + (transactionBounded() ? ", transactions=" + transactionsPerClient : ", duration=" + duration().toSeconds() + "s")
                + ", protocol=" + protocol.flagValue()
                + (targetRate != null ? ", rate=" + targetRate : "")
                + ", perStatement=" + perStatementLatency + ", logging=" + detailedLogging
                + ", reconnect=" + reconnectPerTransaction + "]";
    }
}
