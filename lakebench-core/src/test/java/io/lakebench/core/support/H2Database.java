package io.lakebench.core.support;

import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.pool.PoolConfiguration;
import io.lakebench.core.pool.PhysicalConnectionFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory H2 database in PostgreSQL mode standing in for the benchmark target.
 * Records the token of every credential a physical connection was opened with.
 */
public final class H2Database implements PhysicalConnectionFactory {

    private final String url;
    private final List<String> tokens = new CopyOnWriteArrayList<>();
    private volatile boolean refuseConnections;

    private H2Database(String url) {
        this.url = url;
    }

    public static H2Database create() {
        H2Database db = new H2Database("jdbc:h2:mem:lakebench-" + UUID.randomUUID()
                + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1");
        db.execute(
                "CREATE ALIAS PG_SLEEP FOR 'io.lakebench.core.support.H2Database.sleep'",
                "CREATE TABLE items (id INT PRIMARY KEY, name VARCHAR(50), price DECIMAL(10, 2))",
                "INSERT INTO items VALUES (1, 'apple', 1.20), (2, 'pear', 0.80), (3, 'plum', 2.50)");
        return db;
    }

    /**
     * Backs the {@code PG_SLEEP(seconds)} SQL function.
     */
    public static int sleep(double seconds) {
        try {
            Thread.sleep((long) (seconds * 1000));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return 0;
    }

    @Override
    public Connection open(DatabaseTarget target, Credential credential, PoolConfiguration config) throws SQLException {
        if (refuseConnections) {
            throw new SQLException("Connection refused", "08001");
        }
        tokens.add(credential.token());
        return DriverManager.getConnection(url, "sa", "");
    }

    public void refuseConnections(boolean refuse) {
        this.refuseConnections = refuse;
    }

    /**
     * @return token of every physical connection opened, in order
     */
    public List<String> tokens() {
        return tokens;
    }

    public void execute(String... statements) {
        try (Connection connection = DriverManager.getConnection(url, "sa", "");
             Statement statement = connection.createStatement()) {
            for (String sql : statements) {
                statement.execute(sql);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to prepare test database", e);
        }
    }

    public void drop() {
        execute("SHUTDOWN");
    }
}
