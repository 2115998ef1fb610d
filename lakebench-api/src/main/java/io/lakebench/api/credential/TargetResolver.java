package io.lakebench.api.credential;

/**
 * Looks up where an instance lives and which principal connects to it.
 */
@FunctionalInterface
public interface TargetResolver {

    /**
     * @throws io.lakebench.api.error.TargetNotFoundException if the instance does not exist
     * @throws io.lakebench.api.error.ConnectivityException   if the lookup service cannot be reached
     */
    DatabaseTarget resolve(InstanceIdentity identity);
}
