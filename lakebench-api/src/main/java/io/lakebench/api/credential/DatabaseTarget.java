package io.lakebench.api.credential;

import java.util.Objects;

/**
 * Resolved network coordinates and principal for a database instance.
 */
public record DatabaseTarget(String host, int port, String database, String user) {

    public static final int DEFAULT_PORT = 5432;

    public DatabaseTarget {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(database, "database");
        Objects.requireNonNull(user, "user");
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
    }
}
