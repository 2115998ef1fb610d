package io.lakebench.core.credential;

import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.CredentialProvider;
import io.lakebench.api.credential.InstanceIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically asks the identity service for a new credential and swaps it into the holder.
 * <p>
 * A failed refresh is logged and retried at the next tick; the previous credential stays
 * current in the meantime. Connections already open are never touched.
 */
public class CredentialRefresher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CredentialRefresher.class);

    private final InstanceIdentity identity;
    private final CredentialProvider provider;
    private final CredentialHolder holder;
    private final Duration interval;
    private final AtomicLong refreshCount = new AtomicLong(0);
    private final AtomicLong failureCount = new AtomicLong(0);
    private ScheduledExecutorService scheduler;

    public CredentialRefresher(InstanceIdentity identity, CredentialProvider provider,
                               CredentialHolder holder, Duration interval) {
        this.identity = identity;
        this.provider = provider;
        this.holder = holder;
        this.interval = interval;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "lakebench-credential-refresher-" + identity.instanceName());
            t.setDaemon(true);
            return t;
        });
        scheduler.scheduleAtFixedRate(this::refreshNow,
                interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Credential refresh for '{}' scheduled every {}s", identity.instanceName(), interval.toSeconds());
    }

    /**
     * Perform one refresh synchronously.
     *
     * @return true if a new credential was installed
     */
    public boolean refreshNow() {
        try {
            Credential next = provider.acquire(identity);
            holder.replace(next);
            refreshCount.incrementAndGet();
            log.debug("Credential for '{}' refreshed, issued at {}", identity.instanceName(), next.issuedAt());
            return true;
        } catch (Exception e) {
            failureCount.incrementAndGet();
            log.warn("Credential refresh for '{}' failed, keeping current credential: {}",
                    identity.instanceName(), e.getMessage());
            return false;
        }
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    public long refreshCount() {
        return refreshCount.get();
    }

    public long failureCount() {
        return failureCount.get();
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            log.info("Credential refresh for '{}' stopped after {} refreshes ({} failed)",
                    identity.instanceName(), refreshCount.get(), failureCount.get());
        }
    }
}
