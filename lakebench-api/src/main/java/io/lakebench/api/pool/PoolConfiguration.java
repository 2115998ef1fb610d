package io.lakebench.api.pool;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Map;

/**
 * Configuration for the connection pool that serves a benchmark target.
 * Controls pool sizing, acquisition and statement timeouts, connection recycling, TLS
 * and how often the access credential is refreshed.
 * <p>
 * Effective maximum of concurrent physical connections is {@code baseSize + maxOverflow}.
 */
public final class PoolConfiguration {

    public static final String KEY_POOL_SIZE = "DB_POOL_SIZE";
    public static final String KEY_MAX_OVERFLOW = "DB_MAX_OVERFLOW";
    public static final String KEY_POOL_TIMEOUT = "DB_POOL_TIMEOUT";
    public static final String KEY_RECYCLE_INTERVAL = "DB_POOL_RECYCLE_INTERVAL";
    public static final String KEY_COMMAND_TIMEOUT = "DB_COMMAND_TIMEOUT";
    public static final String KEY_SSL_MODE = "DB_SSL_MODE";

    private int baseSize = 5;
    private Integer maxOverflow = null; // null = same as baseSize
    private int acquireTimeoutSeconds = 10;
    private int recycleIntervalSeconds = 3600;
    private int statementTimeoutSeconds = 30;
    private TlsMode tlsMode = TlsMode.REQUIRE;
    private Duration refreshInterval = Duration.ofMinutes(50);

    private PoolConfiguration() {}

    public static PoolConfiguration create() {
        return new PoolConfiguration();
    }

    /**
     * Build a configuration from the loosely typed overrides the API layer accepts.
     * Values may be numbers or numeric strings. When no pool size is given the base size
     * follows the requested concurrency level.
     *
     * @param overrides        {@code DB_*} keys, may be empty
     * @param concurrencyLevel concurrency of the run the pool will serve
     */
    public static PoolConfiguration fromOverrides(Map<String, ?> overrides, int concurrencyLevel) {
        PoolConfiguration config = create();
        int base = intValue(overrides, KEY_POOL_SIZE, Math.max(1, concurrencyLevel));
        config.baseSize(base);
        config.maxOverflow(intValue(overrides, KEY_MAX_OVERFLOW, base));
        config.acquireTimeoutSeconds(intValue(overrides, KEY_POOL_TIMEOUT, config.acquireTimeoutSeconds));
        config.recycleIntervalSeconds(intValue(overrides, KEY_RECYCLE_INTERVAL, config.recycleIntervalSeconds));
        config.statementTimeoutSeconds(intValue(overrides, KEY_COMMAND_TIMEOUT, config.statementTimeoutSeconds));
        Object ssl = overrides.get(KEY_SSL_MODE);
        if (ssl != null) {
            config.tlsMode(TlsMode.fromSslMode(ssl.toString()));
        }
        return config;
    }

    public PoolConfiguration baseSize(int baseSize) {
        if (baseSize < 1) {
            throw new IllegalArgumentException("Base pool size must be at least 1");
        }
        this.baseSize = baseSize;
        return this;
    }

    public PoolConfiguration maxOverflow(int maxOverflow) {
        if (maxOverflow < 0) {
            throw new IllegalArgumentException("Max overflow must not be negative");
        }
        this.maxOverflow = maxOverflow;
        return this;
    }

    public PoolConfiguration acquireTimeoutSeconds(int acquireTimeoutSeconds) {
        if (acquireTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("Acquire timeout must be positive");
        }
        this.acquireTimeoutSeconds = acquireTimeoutSeconds;
        return this;
    }

    public PoolConfiguration recycleIntervalSeconds(int recycleIntervalSeconds) {
        if (recycleIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Recycle interval must be positive");
        }
        this.recycleIntervalSeconds = recycleIntervalSeconds;
        return this;
    }

    /**
     * Per-statement timeout. Zero disables it.
     */
    public PoolConfiguration statementTimeoutSeconds(int statementTimeoutSeconds) {
        if (statementTimeoutSeconds < 0) {
            throw new IllegalArgumentException("Statement timeout must not be negative");
        }
        this.statementTimeoutSeconds = statementTimeoutSeconds;
        return this;
    }

    public PoolConfiguration tlsMode(TlsMode tlsMode) {
        this.tlsMode = tlsMode;
        return this;
    }

    /**
     * How often the background refresher asks for a new credential.
     * Must be shorter than the credential's validity window.
     */
    public PoolConfiguration refreshInterval(Duration refreshInterval) {
        if (refreshInterval.isNegative() || refreshInterval.isZero()) {
            throw new IllegalArgumentException("Refresh interval must be positive");
        }
        this.refreshInterval = refreshInterval;
        return this;
    }

    public int baseSize() { return baseSize; }
    public int maxOverflow() { return maxOverflow != null ? maxOverflow : baseSize; }
    public int maxConnections() { return baseSize() + maxOverflow(); }
    public int acquireTimeoutSeconds() { return acquireTimeoutSeconds; }
    public int recycleIntervalSeconds() { return recycleIntervalSeconds; }
    public int statementTimeoutSeconds() { return statementTimeoutSeconds; }
    public TlsMode tlsMode() { return tlsMode; }
    public Duration refreshInterval() { return refreshInterval; }

    private static int intValue(Map<String, ?> overrides, String key, int defaultValue) {
        Object value = overrides.get(key);
        if (value == null) {
            return defaultValue;
        }
        try {
            if (value instanceof Integer number) {
                return number;
            }
            // whole numbers only: 2.5 or an out-of-range long is an error, not a truncation
            return new BigDecimal(value.toString().trim()).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    @Override
    public String toString() {
        return "PoolConfiguration[base=" + baseSize() + ", overflow=" + maxOverflow()
                + ", acquireTimeout=" + acquireTimeoutSeconds + "s, recycle=" + recycleIntervalSeconds
                + "s, statementTimeout=" + statementTimeoutSeconds + "s, tls=" + tlsMode.sslMode()
                + ", refresh=" + refreshInterval + "]";
    }
}
