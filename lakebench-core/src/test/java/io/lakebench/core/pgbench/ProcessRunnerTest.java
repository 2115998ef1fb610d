package io.lakebench.core.pgbench;

import io.lakebench.api.error.BenchmarkExecutionException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    @TempDir
    Path workDir;

    @Test
    void shouldCaptureBothStreamsAndExitCode() {
        List<String> lines = new CopyOnWriteArrayList<>();

        ProcessOutput output = runner.run(List.of("/bin/sh", "-c", "echo out; echo err >&2; exit 3"),
                Map.of(), workDir, Duration.ofSeconds(10), lines::add);

        assertThat(output.exitCode()).isEqualTo(3);
        assertThat(output.stdout()).isEqualTo("out\n");
        assertThat(output.stderr()).isEqualTo("err\n");
        assertThat(output.deadlineExceeded()).isFalse();
        assertThat(output.succeeded()).isFalse();
        assertThat(lines).containsExactlyInAnyOrder("out", "err");
    }

    @Test
    void shouldPassEnvironmentAndWorkingDirectory() throws Exception {
        ProcessOutput output = runner.run(List.of("/bin/sh", "-c", "echo \"$LAKEBENCH_TEST_VAR\"; pwd"),
                Map.of("LAKEBENCH_TEST_VAR", "hello"), workDir, Duration.ofSeconds(10), line -> {});

        assertThat(output.succeeded()).isTrue();
        assertThat(output.stdout().lines().toList()).hasSize(2);
        assertThat(output.stdout().lines().toList().get(0)).isEqualTo("hello");
        assertThat(Path.of(output.stdout().lines().toList().get(1)).toRealPath().toString())
                .isEqualTo(workDir.toRealPath().toString());
    }

    @Test
    void shouldKillProcessAtDeadline() {
        long start = System.nanoTime();

        ProcessOutput output = runner.run(List.of("/bin/sh", "-c", "echo started; exec sleep 30"),
                Map.of(), workDir, Duration.ofMillis(500), line -> {});

        assertThat(output.deadlineExceeded()).isTrue();
        assertThat(output.exitCode()).isEqualTo(-1);
        assertThat(output.stdout()).isEqualTo("started\n");
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    void shouldFailWhenExecutableMissing() {
        assertThatThrownBy(() -> runner.run(List.of(workDir.resolve("no-such-binary").toString()),
                Map.of(), workDir, Duration.ofSeconds(5), line -> {}))
                .isInstanceOf(BenchmarkExecutionException.class)
                .hasMessageContaining("no-such-binary");
    }

    @Test
    void shouldKeepDrainingWhenLineHandlerFails() {
        ProcessOutput output = runner.run(List.of("/bin/sh", "-c", "echo a; echo b"),
                Map.of(), workDir, Duration.ofSeconds(10), line -> {
                    throw new IllegalStateException("handler broken");
                });

        assertThat(output.stdout()).isEqualTo("a\nb\n");
    }
}
