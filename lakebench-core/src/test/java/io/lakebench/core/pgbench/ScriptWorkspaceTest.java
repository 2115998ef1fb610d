package io.lakebench.core.pgbench;

import io.lakebench.api.workload.BenchmarkQuery;
import io.lakebench.api.workload.TestScenario;
import io.lakebench.api.workload.WeightedQuery;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScriptWorkspaceTest {

    @Test
    void shouldWriteOneScriptPerQuery() throws Exception {
        Path directory;
        try (ScriptWorkspace workspace = ScriptWorkspace.create(List.of(
                WeightedQuery.of("count", "  SELECT COUNT(*) FROM orders;  ", 1),
                WeightedQuery.of("lookup", "SELECT * FROM orders WHERE id = 1;", 3)))) {
            directory = workspace.directory();

            assertThat(directory.getFileName().toString()).startsWith("pgbench_");
            assertThat(workspace.scripts()).containsExactly(
                    new ScriptWorkspace.Script("query_0.sql", "count", 1),
                    new ScriptWorkspace.Script("query_1.sql", "lookup", 3));
            assertThat(Files.readString(directory.resolve("query_0.sql"))).isEqualTo("SELECT COUNT(*) FROM orders;\n");
            assertThat(workspace.scriptSlots()).containsExactly("count", "lookup", "lookup", "lookup");
        }
        assertThat(directory).doesNotExist();
    }

    @Test
    void shouldListTransactionLogsInNameOrder() throws Exception {
        try (ScriptWorkspace workspace = ScriptWorkspace.create(List.of(WeightedQuery.of("q", "SELECT 1", 1)))) {
            Files.writeString(workspace.directory().resolve("pgbench_log.200.1"), "");
            Files.writeString(workspace.directory().resolve("pgbench_log.200"), "");
            Files.writeString(workspace.directory().resolve("other.txt"), "");

            assertThat(workspace.transactionLogs())
                    .extracting(p -> p.getFileName().toString())
                    .containsExactly("pgbench_log.200", "pgbench_log.200.1");
        }
    }

    @Test
    void shouldRejectParameterisedQueries() {
        var parameterised = new WeightedQuery(new BenchmarkQuery("lookup", "SELECT * FROM t WHERE id = %s",
                List.of(new TestScenario("one", List.of(1), 1))), 1);

        assertThatThrownBy(() -> ScriptWorkspace.create(List.of(parameterised)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("lookup");
    }

    @Test
    void shouldTolerateRepeatedClose() {
        ScriptWorkspace workspace = ScriptWorkspace.create(List.of(WeightedQuery.of("q", "SELECT 1", 1)));

        workspace.close();
        workspace.close();

        assertThat(workspace.exists()).isFalse();
    }
}
