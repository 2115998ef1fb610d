package io.lakebench.api.error;

/**
 * The named database instance does not exist or is not visible to the caller.
 */
public class TargetNotFoundException extends BenchmarkException {

    private final String instanceName;

    public TargetNotFoundException(String instanceName) {
        super("Database instance not found: " + instanceName);
        this.instanceName = instanceName;
    }

    public String instanceName() {
        return instanceName;
    }
}
