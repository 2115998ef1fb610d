package io.lakebench.core.pool;

import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.pool.PoolConfiguration;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Properties;

/**
 * Opens connections with the PostgreSQL JDBC driver. The credential token is the password.
 */
public class PostgresConnectionFactory implements PhysicalConnectionFactory {

    public static final String APPLICATION_NAME = "lakebench";

    @Override
    public Connection open(DatabaseTarget target, Credential credential, PoolConfiguration config) throws SQLException {
        return DriverManager.getConnection(jdbcUrl(target), properties(target, credential, config));
    }

    static String jdbcUrl(DatabaseTarget target) {
        return "jdbc:postgresql://" + target.host() + ":" + target.port() + "/" + target.database();
    }

    static Properties properties(DatabaseTarget target, Credential credential, PoolConfiguration config) {
        Properties props = new Properties();
        props.setProperty("user", target.user());
        props.setProperty("password", credential.token());
        props.setProperty("sslmode", config.tlsMode().sslMode());
        props.setProperty("ApplicationName", APPLICATION_NAME);
        props.setProperty("connectTimeout", String.valueOf(config.acquireTimeoutSeconds()));
        if (config.statementTimeoutSeconds() > 0) {
            props.setProperty("options", "-c statement_timeout=" + config.statementTimeoutSeconds() * 1000L);
        }
        return props;
    }
}
