package io.lakebench.core.support;

import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.CredentialProvider;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.credential.TargetResolver;
import io.lakebench.api.error.AuthenticationException;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Issues {@code token-1}, {@code token-2}, ... and resolves every instance to a fixed local target.
 */
public final class TestCredentials implements CredentialProvider, TargetResolver {

    public static final InstanceIdentity IDENTITY = new InstanceIdentity("https://workspace.test", "bench-instance", null);

    private final AtomicInteger issued = new AtomicInteger(0);
    private volatile boolean failing;

    @Override
    public Credential acquire(InstanceIdentity identity) {
        if (failing) {
            throw new AuthenticationException("identity service unavailable");
        }
        return new Credential("token-" + issued.incrementAndGet(), Instant.now(), identity.instanceName());
    }

    @Override
    public DatabaseTarget resolve(InstanceIdentity identity) {
        return new DatabaseTarget("localhost", 5432, identity.database(), "bench_user");
    }

    public void failing(boolean failing) {
        this.failing = failing;
    }

    public int issued() {
        return issued.get();
    }
}
