package io.lakebench.api.report;

public enum RunOutcome {
    COMPLETED,
    CANCELLED,
    FAILED
}
