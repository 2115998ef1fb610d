package io.lakebench.core.credential;

import io.lakebench.api.credential.Credential;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The current credential of one pool. Written by the refresher, read every time a
 * physical connection is opened.
 */
public class CredentialHolder {

    private final AtomicReference<Credential> current;

    public CredentialHolder(Credential initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public Credential current() {
        return current.get();
    }

    /**
     * Replace the current credential.
     *
     * @return the credential that was superseded
     */
    public Credential replace(Credential next) {
        return current.getAndSet(Objects.requireNonNull(next, "next"));
    }
}
