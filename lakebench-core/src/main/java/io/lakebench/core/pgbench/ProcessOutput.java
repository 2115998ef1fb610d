package io.lakebench.core.pgbench;

import java.time.Duration;

/**
 * Captured result of an external process run.
 *
 * @param exitCode         exit status, -1 when the process was killed at the deadline
 * @param deadlineExceeded whether the process had to be killed
 */
public record ProcessOutput(int exitCode, String stdout, String stderr, boolean deadlineExceeded, Duration elapsed) {

    public boolean succeeded() {
        return !deadlineExceeded && exitCode == 0;
    }
}
