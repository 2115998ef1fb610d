package io.lakebench.api.credential;

import java.time.Instant;
import java.util.Objects;

/**
 * A short-lived database access token.
 * <p>
 * Exactly one credential is current per pool at any instant. A refresh supersedes it for
 * connections opened afterwards; connections already open keep the token they authenticated with.
 *
 * @param token          the secret presented as the database password
 * @param issuedAt       when the identity service issued it
 * @param owningInstance the instance the token is scoped to
 * @param expiresAt      expiry reported by the identity service, or null if unknown
 */
public record Credential(String token, Instant issuedAt, String owningInstance, Instant expiresAt) {

    public Credential {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(owningInstance, "owningInstance");
    }

    public Credential(String token, Instant issuedAt, String owningInstance) {
        this(token, issuedAt, owningInstance, null);
    }

    @Override
    public String toString() {
        return "Credential[instance=" + owningInstance + ", issuedAt=" + issuedAt + ", token=****]";
    }
}
