package io.lakebench.core.pool;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.metrics.micrometer.MicrometerMetricsTrackerFactory;
import com.zaxxer.hikari.pool.HikariPool;
import io.lakebench.api.credential.Credential;
import io.lakebench.api.credential.CredentialProvider;
import io.lakebench.api.credential.DatabaseTarget;
import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.credential.TargetResolver;
import io.lakebench.api.error.ConnectivityException;
import io.lakebench.api.pool.PoolConfiguration;
import io.lakebench.core.credential.CredentialHolder;
import io.lakebench.core.credential.CredentialRefresher;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manages one connection pool per target instance.
 * Pools are created from the pool configuration and authenticate with rotating credentials.
 */
public class ConnectionPoolManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionPoolManager.class);

    private final Map<String, ManagedPool> pools = new ConcurrentHashMap<>();
    private final PhysicalConnectionFactory connectionFactory;
    private final MeterRegistry registry;

    public ConnectionPoolManager() {
        this(new PostgresConnectionFactory(), new SimpleMeterRegistry());
    }

    public ConnectionPoolManager(PhysicalConnectionFactory connectionFactory, MeterRegistry registry) {
        this.connectionFactory = connectionFactory;
        this.registry = registry;
    }

    /**
     * Resolve the target, obtain a first credential, open the pool and start refreshing.
     *
     * @throws io.lakebench.api.error.TargetNotFoundException if the instance does not exist
     * @throws io.lakebench.api.error.AuthenticationException if no credential could be issued
     * @throws ConnectivityException                          if the database cannot be reached
     * @throws IllegalStateException                          if a pool for the target is already open
     */
    public ManagedPool initialize(InstanceIdentity identity, PoolConfiguration config,
                                  CredentialProvider credentialProvider, TargetResolver targetResolver) {
        String key = identity.poolKey();
        if (pools.containsKey(key)) {
            throw new IllegalStateException("Pool already open for " + key);
        }

        DatabaseTarget target = targetResolver.resolve(identity);
        Credential initial = credentialProvider.acquire(identity);
        CredentialHolder holder = new CredentialHolder(initial);
        CredentialInjectingDataSource physicalSource =
                new CredentialInjectingDataSource(target, config, holder, connectionFactory);

        HikariDataSource dataSource;
        try {
            dataSource = new HikariDataSource(hikariConfig(key, config, physicalSource));
        } catch (HikariPool.PoolInitializationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ConnectivityException("Cannot connect to " + target.host() + ":" + target.port()
                    + "/" + target.database() + ": " + cause.getMessage(), e);
        }

        CredentialRefresher refresher =
                new CredentialRefresher(identity, credentialProvider, holder, config.refreshInterval());
        ManagedPool pool = new ManagedPool(identity, target, config, holder, refresher, physicalSource, dataSource,
                () -> pools.remove(key));
        if (pools.putIfAbsent(key, pool) != null) {
            dataSource.close();
            throw new IllegalStateException("Pool already open for " + key);
        }
        refresher.start();

        log.info("Created pool '{}' for {}:{} ({})", key, target.host(), target.port(), config);
        return pool;
    }

    /**
     * Get the pool for a target key.
     */
    public ManagedPool pool(String key) {
        ManagedPool pool = pools.get(key);
        if (pool == null) {
            throw new IllegalArgumentException("No pool for target: " + key);
        }
        return pool;
    }

    /**
     * @return all open pools
     */
    public Collection<ManagedPool> allPools() {
        return Collections.unmodifiableCollection(pools.values());
    }

    /**
     * Close all pools.
     */
    public void shutdown() {
        List.copyOf(pools.values()).forEach(ManagedPool::close);
        pools.clear();
    }

    private HikariConfig hikariConfig(String key, PoolConfiguration config, CredentialInjectingDataSource source) {
        HikariConfig hikari = new HikariConfig();
        hikari.setPoolName("lakebench-" + key.replace('/', '-'));
        hikari.setDataSource(source);
        hikari.setMinimumIdle(config.baseSize());
        hikari.setMaximumPoolSize(config.maxConnections());
        hikari.setConnectionTimeout(config.acquireTimeoutSeconds() * 1000L);
        hikari.setMaxLifetime(config.recycleIntervalSeconds() * 1000L);
        hikari.setMetricsTrackerFactory(new MicrometerMetricsTrackerFactory(registry));
        return hikari;
    }
}
