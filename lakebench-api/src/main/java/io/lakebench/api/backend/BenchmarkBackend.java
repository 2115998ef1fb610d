package io.lakebench.api.backend;

import io.lakebench.api.report.BackendKind;
import io.lakebench.api.report.TestReport;

/**
 * Executes one kind of benchmark request and produces a report.
 *
 * @param <R> the request variant this backend serves
 */
public interface BenchmarkBackend<R extends BenchmarkRequest> {

    /**
     * Run the benchmark to completion.
     *
     * @return the report of the run
     * @throws io.lakebench.api.error.BenchmarkException on setup or fatal run errors
     */
    TestReport run(R request);

    BackendKind kind();

    /**
     * Register a listener for incremental run status.
     */
    void onStatus(StatusListener listener);
}
