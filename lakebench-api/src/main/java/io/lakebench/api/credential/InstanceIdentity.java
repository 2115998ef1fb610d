package io.lakebench.api.credential;

import java.util.Objects;

/**
 * Identifies the database a benchmark targets: workspace, instance and database name.
 */
public record InstanceIdentity(String workspaceUrl, String instanceName, String database) {

    public static final String DEFAULT_DATABASE = "databricks_postgres";

    public InstanceIdentity {
        Objects.requireNonNull(instanceName, "instanceName");
        if (instanceName.isBlank()) {
            throw new IllegalArgumentException("Instance name must not be blank");
        }
        if (database == null || database.isBlank()) {
            database = DEFAULT_DATABASE;
        }
    }

    /**
     * Key used to register the pool for this target.
     */
    public String poolKey() {
        return instanceName + "/" + database;
    }
}
