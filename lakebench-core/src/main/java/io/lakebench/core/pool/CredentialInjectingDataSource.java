package io.lakebench.core.pool;

import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.pool.PoolConfiguration;
import io.lakebench.core.credential.CredentialHolder;

import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * DataSource handed to the pool. Every physical connection it opens authenticates with the
 * credential current in the holder at that moment, so a refreshed token reaches every
 * connection opened after the refresh.
 */
public class CredentialInjectingDataSource implements DataSource {

    private final DatabaseTarget target;
    private final PoolConfiguration config;
    private final CredentialHolder holder;
    private final PhysicalConnectionFactory factory;
    private final AtomicLong opened = new AtomicLong(0);
    private volatile PrintWriter logWriter;
    private volatile int loginTimeout;

    public CredentialInjectingDataSource(DatabaseTarget target, PoolConfiguration config,
                                         CredentialHolder holder, PhysicalConnectionFactory factory) {
        this.target = target;
        this.config = config;
        this.holder = holder;
        this.factory = factory;
    }

    @Override
    public Connection getConnection() throws SQLException {
        Connection connection = factory.open(target, holder.current(), config);
        opened.incrementAndGet();
        return connection;
    }

    /**
     * Credentials always come from the holder.
     */
    @Override
    public Connection getConnection(String username, String password) throws SQLException {
        throw new SQLFeatureNotSupportedException("Explicit credentials are not supported");
    }

    /**
     * @return physical connections opened so far
     */
    public long openedConnections() {
        return opened.get();
    }

    @Override
    public PrintWriter getLogWriter() {
        return logWriter;
    }

    @Override
    public void setLogWriter(PrintWriter out) {
        this.logWriter = out;
    }

    @Override
    public void setLoginTimeout(int seconds) {
        this.loginTimeout = seconds;
    }

    @Override
    public int getLoginTimeout() {
        return loginTimeout;
    }

    @Override
    public Logger getParentLogger() throws SQLFeatureNotSupportedException {
        throw new SQLFeatureNotSupportedException();
    }

    @Override
    public <T> T unwrap(Class<T> iface) throws SQLException {
        if (iface.isInstance(this)) {
            return iface.cast(this);
        }
        throw new SQLException("Not a wrapper for " + iface.getName());
    }

    @Override
    public boolean isWrapperFor(Class<?> iface) {
        return iface.isInstance(this);
    }
}
