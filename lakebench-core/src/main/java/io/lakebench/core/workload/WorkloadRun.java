package io.lakebench.core.workload;

import io.lakebench.api.workload.ExecutionResult;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle to a running workload. Allows monitoring progress and stopping the run.
 */
public class WorkloadRun {

    public enum State {
        RUNNING,
        STOPPING,
        COMPLETED,
        CANCELLED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.RUNNING);
    private final CompletableFuture<List<ExecutionResult>> results = new CompletableFuture<>();
    private final AdmissionGate gate;
    private final int expectedExecutions;

    WorkloadRun(AdmissionGate gate, int expectedExecutions) {
        this.gate = gate;
        this.expectedExecutions = expectedExecutions;
    }

    /**
     * Stop admitting new executions. Executions already in flight finish and are reported;
     * executions never admitted produce no result.
     */
    public void stop() {
        state.compareAndSet(State.RUNNING, State.STOPPING);
    }

    public boolean isRunning() {
        return state.get() == State.RUNNING;
    }

    boolean stopRequested() {
        return state.get() == State.STOPPING;
    }

    void finish(List<ExecutionResult> collected) {
        State end = state.get() == State.STOPPING ? State.CANCELLED : State.COMPLETED;
        state.set(end);
        results.complete(collected);
    }

    void fail(Throwable error) {
        state.set(State.CANCELLED);
        results.completeExceptionally(error);
    }

    /**
     * @return future that completes with one result per attempted execution, in workload order
     */
    public CompletableFuture<List<ExecutionResult>> results() {
        return results;
    }

    public State state() {
        return state.get();
    }

    public boolean wasCancelled() {
        return state.get() == State.CANCELLED;
    }

    public int inFlight() {
        return gate.inFlight();
    }

    public int peakInFlight() {
        return gate.peakInFlight();
    }

    public int expectedExecutions() {
        return expectedExecutions;
    }
}
