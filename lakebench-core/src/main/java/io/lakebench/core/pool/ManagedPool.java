package io.lakebench.core.pool;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.error.PoolExhaustedException;
import io.lakebench.api.pool.PoolConfiguration;
import io.lakebench.api.pool.PoolStatus;
import io.lakebench.core.credential.CredentialHolder;
import io.lakebench.core.credential.CredentialRefresher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A bounded connection pool serving one target, together with the credential it
 * authenticates with and the refresher keeping that credential fresh.
 * <p>
 * At most {@code baseSize + maxOverflow} connections are checked out at any instant.
 */
public class ManagedPool implements ConnectionSource, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ManagedPool.class);

    private final InstanceIdentity identity;
    private final DatabaseTarget target;
    private final PoolConfiguration config;
    private final CredentialHolder credentials;
    private final CredentialRefresher refresher;
    private final CredentialInjectingDataSource physicalSource;
    private final HikariDataSource dataSource;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ManagedPool(InstanceIdentity identity, DatabaseTarget target, PoolConfiguration config,
                CredentialHolder credentials, CredentialRefresher refresher,
                CredentialInjectingDataSource physicalSource, HikariDataSource dataSource, Runnable onClose) {
        this.identity = identity;
        this.target = target;
        this.config = config;
        this.credentials = credentials;
        this.refresher = refresher;
        this.physicalSource = physicalSource;
        this.dataSource = dataSource;
        this.onClose = onClose;
    }

    /**
     * Check out a connection. Closing it returns it to the pool, so use it in try-with-resources.
     *
     * @throws PoolExhaustedException if none became available within the acquire timeout, also when
     *                                opening a replacement failed meanwhile (kept as the cause)
     * @throws SQLException           if the pool is closed
     */
    @Override
    public Connection connection() throws SQLException {
        if (closed.get()) {
            throw new SQLException("Pool '" + key() + "' is closed");
        }
        try {
            return dataSource.getConnection();
        } catch (SQLTransientConnectionException e) {
            // Hikari reports every checkout that outlasts connectionTimeout this way; a failed
            // attempt to open a physical connection along the way is only the cause
            throw new PoolExhaustedException(Duration.ofSeconds(config.acquireTimeoutSeconds()), e);
        }
    }

    /**
     * Retire a checked-out connection. It is closed instead of returned, and the pool opens a
     * replacement with the credential current at that moment.
     */
    public void evict(Connection connection) {
        dataSource.evictConnection(connection);
    }

    public PoolStatus status() {
        HikariPoolMXBean bean = dataSource.getHikariPoolMXBean();
        int total = bean != null ? bean.getTotalConnections() : 0;
        int active = bean != null ? bean.getActiveConnections() : 0;
        int idle = bean != null ? bean.getIdleConnections() : 0;
        int waiting = bean != null ? bean.getThreadsAwaitingConnection() : 0;
        return new PoolStatus(
                config.baseSize(),
                config.maxOverflow(),
                config.maxConnections(),
                total,
                active,
                idle,
                waiting,
                Math.max(0, total - config.baseSize()),
                Instant.now()
        );
    }

    public String key() {
        return identity.poolKey();
    }

    public InstanceIdentity identity() {
        return identity;
    }

    public DatabaseTarget target() {
        return target;
    }

    public PoolConfiguration config() {
        return config;
    }

    public CredentialHolder credentials() {
        return credentials;
    }

    public CredentialRefresher refresher() {
        return refresher;
    }

    /**
     * @return physical connections opened over the life of the pool
     */
    public long openedConnections() {
        return physicalSource.openedConnections();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stop the refresher, then close every physical connection.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        refresher.close();
        dataSource.close();
        onClose.run();
        log.info("Pool '{}' closed after opening {} connections", key(), physicalSource.openedConnections());
    }
}
