package io.lakebench.core.credential;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkspaceConfigTest {

    @Test
    void shouldReadHostAndTokenFromEnvironment() {
        var config = WorkspaceConfig.fromEnvironment(Map.of(
                "DATABRICKS_HOST", "my-workspace.cloud.example.com/",
                "DATABRICKS_TOKEN", "dapi-secret"));

        assertThat(config.host()).isEqualTo("https://my-workspace.cloud.example.com");
        assertThat(config.token()).isEqualTo("dapi-secret");
        assertThat(config.toString()).doesNotContain("dapi-secret");
    }

    @Test
    void shouldKeepExplicitScheme() {
        assertThat(WorkspaceConfig.create().host("http://localhost:8080//").host())
                .isEqualTo("http://localhost:8080");
    }

    @Test
    void shouldRejectMissingVariables() {
        assertThatThrownBy(() -> WorkspaceConfig.fromEnvironment(Map.of("DATABRICKS_TOKEN", "x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DATABRICKS_HOST");
        assertThatThrownBy(() -> WorkspaceConfig.fromEnvironment(Map.of("DATABRICKS_HOST", "h")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("DATABRICKS_TOKEN");
    }
}
