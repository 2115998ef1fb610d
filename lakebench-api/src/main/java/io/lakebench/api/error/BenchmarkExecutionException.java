package io.lakebench.api.error;

import io.lakebench.api.report.TestReport;

/**
 * The external benchmark process exited non-zero or overran its deadline.
 * <p>
 * Carries the full stderr, whatever stdout was produced before the failure, and the
 * partial report that could still be built from it.
 */
public class BenchmarkExecutionException extends BenchmarkException {

    private final int exitCode;
    private final boolean deadlineExceeded;
    private final String stderr;
    private final String stdout;
    private final TestReport partialReport;

    public BenchmarkExecutionException(String message, int exitCode, boolean deadlineExceeded,
                                       String stderr, String stdout, TestReport partialReport) {
        super(message);
        this.exitCode = exitCode;
        this.deadlineExceeded = deadlineExceeded;
        this.stderr = stderr;
        this.stdout = stdout;
        this.partialReport = partialReport;
    }

    public BenchmarkExecutionException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.deadlineExceeded = false;
        this.stderr = "";
        this.stdout = "";
        this.partialReport = null;
    }

    /**
     * @return process exit code, or -1 when the process was killed or never started
     */
    public int exitCode() { return exitCode; }
    public boolean deadlineExceeded() { return deadlineExceeded; }
    public String stderr() { return stderr; }
    public String stdout() { return stdout; }

    /**
     * @return the FAILED report built from partial output, or null if the process never started
     */
    public TestReport partialReport() { return partialReport; }
}
