package io.lakebench.core.pgbench;

import io.lakebench.api.error.BenchmarkExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Runs an external process with a hard deadline, draining stdout and stderr on their own
 * threads so neither pipe can fill up and block the process.
 */
public class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
    private static final long DRAIN_TIMEOUT_MS = 5_000;

    /**
     * @param command     argv
     * @param environment variables added to the inherited environment
     * @param workDir     working directory
     * @param deadline    time after which the process is killed
     * @param lineSink    receives every output line as it arrives, from either stream
     * @throws BenchmarkExecutionException if the process cannot be started
     */
    public ProcessOutput run(List<String> command, Map<String, String> environment, Path workDir,
                             Duration deadline, Consumer<String> lineSink) {
        ProcessBuilder builder = new ProcessBuilder(command).directory(workDir.toFile());
        builder.environment().putAll(environment);

        long startNanos = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new BenchmarkExecutionException("Cannot start " + command.get(0) + ": " + e.getMessage(), e);
        }

        StringBuilder stdout = new StringBuilder();
        StringBuilder stderr = new StringBuilder();
        Thread outDrain = drain(process.getInputStream(), stdout, lineSink, "lakebench-process-stdout");
        Thread errDrain = drain(process.getErrorStream(), stderr, lineSink, "lakebench-process-stderr");

        boolean finished;
        try {
            finished = process.waitFor(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new BenchmarkExecutionException("Interrupted while waiting for " + command.get(0), e);
        }
        if (!finished) {
            log.error("{} exceeded its deadline of {}s, killing it", command.get(0), deadline.toSeconds());
            process.destroyForcibly();
            try {
                process.waitFor(DRAIN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        join(outDrain);
        join(errDrain);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        int exitCode = finished ? process.exitValue() : -1;
        return new ProcessOutput(exitCode, snapshot(stdout), snapshot(stderr), !finished, elapsed);
    }

    private static Thread drain(InputStream stream, StringBuilder into, Consumer<String> lineSink, String name) {
        Thread thread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    synchronized (into) {
                        into.append(line).append('\n');
                    }
                    try {
                        lineSink.accept(line);
                    } catch (RuntimeException e) {
                        log.warn("Output line handler failed: {}", e.getMessage());
                    }
                }
            } catch (IOException e) {
                log.debug("Output stream closed: {}", e.getMessage());
            }
        }, name);
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void join(Thread thread) {
        try {
            thread.join(DRAIN_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String snapshot(StringBuilder buffer) {
        synchronized (buffer) {
            return buffer.toString();
        }
    }
}
