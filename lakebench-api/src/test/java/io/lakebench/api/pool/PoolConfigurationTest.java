package io.lakebench.api.pool;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PoolConfigurationTest {

    @Test
    void shouldUseDefaults() {
        var config = PoolConfiguration.create();

        assertThat(config.baseSize()).isEqualTo(5);
        assertThat(config.maxOverflow()).isEqualTo(5);
        assertThat(config.maxConnections()).isEqualTo(10);
        assertThat(config.acquireTimeoutSeconds()).isEqualTo(10);
        assertThat(config.recycleIntervalSeconds()).isEqualTo(3600);
        assertThat(config.statementTimeoutSeconds()).isEqualTo(30);
        assertThat(config.tlsMode()).isEqualTo(TlsMode.REQUIRE);
        assertThat(config.refreshInterval()).isEqualTo(Duration.ofMinutes(50));
    }

    @Test
    void overflowShouldFollowBaseSizeUntilSet() {
        var config = PoolConfiguration.create().baseSize(8);
        assertThat(config.maxOverflow()).isEqualTo(8);

        config.maxOverflow(0);
        assertThat(config.maxConnections()).isEqualTo(8);
    }

    @Test
    void shouldApplyOverrides() {
        var config = PoolConfiguration.fromOverrides(Map.of(
                "DB_POOL_SIZE", "4",
                "DB_MAX_OVERFLOW", 2,
                "DB_POOL_TIMEOUT", " 15 ",
                "DB_POOL_RECYCLE_INTERVAL", 600,
                "DB_COMMAND_TIMEOUT", "0",
                "DB_SSL_MODE", "Verify-Full"), 20);

        assertThat(config.baseSize()).isEqualTo(4);
        assertThat(config.maxOverflow()).isEqualTo(2);
        assertThat(config.acquireTimeoutSeconds()).isEqualTo(15);
        assertThat(config.recycleIntervalSeconds()).isEqualTo(600);
        assertThat(config.statementTimeoutSeconds()).isZero();
        assertThat(config.tlsMode()).isEqualTo(TlsMode.VERIFY_FULL);
    }

    @Test
    void baseSizeShouldFollowConcurrencyWithoutOverride() {
        var config = PoolConfiguration.fromOverrides(Map.of(), 12);

        assertThat(config.baseSize()).isEqualTo(12);
        assertThat(config.maxConnections()).isEqualTo(24);
    }

    @Test
    void shouldRejectFractionalOverrides() {
        assertThatThrownBy(() -> PoolConfiguration.fromOverrides(Map.of("DB_POOL_SIZE", 2.5), 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DB_POOL_SIZE");
        assertThatThrownBy(() -> PoolConfiguration.fromOverrides(Map.of("DB_MAX_OVERFLOW", "1.5"), 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DB_MAX_OVERFLOW");
        assertThatThrownBy(() -> PoolConfiguration.fromOverrides(Map.of("DB_POOL_TIMEOUT", 10_000_000_000L), 1))
                .isInstanceOf(IllegalArgumentException.class);

        assertThat(PoolConfiguration.fromOverrides(Map.of("DB_POOL_SIZE", 3.0, "DB_MAX_OVERFLOW", 2L), 1)
                .maxConnections()).isEqualTo(5);
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> PoolConfiguration.create().baseSize(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolConfiguration.create().maxOverflow(-1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolConfiguration.create().acquireTimeoutSeconds(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolConfiguration.create().refreshInterval(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> PoolConfiguration.fromOverrides(Map.of("DB_POOL_SIZE", "many"), 1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DB_POOL_SIZE");
        assertThatThrownBy(() -> TlsMode.fromSslMode("sometimes"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
