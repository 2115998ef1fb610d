package io.lakebench.core.credential;

import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.CredentialProvider;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.credential.TargetResolver;

import java.time.Instant;
import java.util.Objects;

/**
 * Fixed password and fixed coordinates, for plain Postgres servers that do not rotate credentials.
 */
public class StaticCredentialProvider implements CredentialProvider, TargetResolver {

    private final DatabaseTarget target;
    private final String password;

    public StaticCredentialProvider(DatabaseTarget target, String password) {
        this.target = Objects.requireNonNull(target, "target");
        this.password = Objects.requireNonNull(password, "password");
    }

    @Override
    public Credential acquire(InstanceIdentity identity) {
        return new Credential(password, Instant.now(), identity.instanceName());
    }

    @Override
    public DatabaseTarget resolve(InstanceIdentity identity) {
        return target;
    }
}
