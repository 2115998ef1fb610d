package io.lakebench.core.pool;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Hands out connections that are returned by closing them.
 */
@FunctionalInterface
public interface ConnectionSource {

    Connection connection() throws SQLException;
}
