package io.lakebench.core.pool;

import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.pool.PoolConfiguration;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens one physical database connection with the credential that is current at that moment.
 */
@FunctionalInterface
public interface PhysicalConnectionFactory {

    Connection open(DatabaseTarget target, Credential credential, PoolConfiguration config) throws SQLException;
}
