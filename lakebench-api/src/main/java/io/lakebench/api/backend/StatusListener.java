package io.lakebench.api.backend;

import io.lakebench.api.report.RunStatus;

/**
 * Receives incremental status while a benchmark runs. Called from engine threads;
 * implementations must be thread-safe and return quickly.
 */
@FunctionalInterface
public interface StatusListener {

    void onStatus(RunStatus status);
}
