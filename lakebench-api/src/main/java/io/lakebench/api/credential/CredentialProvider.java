package io.lakebench.api.credential;

/**
 * Obtains short-lived database credentials from the platform's identity service.
 */
@FunctionalInterface
public interface CredentialProvider {

    /**
     * Issue a fresh credential for the given instance.
     *
     * @param identity the instance to authenticate against
     * @return a newly issued credential
     * @throws io.lakebench.api.error.AuthenticationException if the service is unreachable or denies access
     */
    Credential acquire(InstanceIdentity identity);
}
