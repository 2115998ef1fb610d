package io.lakebench.api.backend;

import io.lakebench.api.credential.InstanceIdentity;
import io.lakebench.api.report.BackendKind;

/**
 * A request to run one benchmark against a target instance.
 * Each implementation names the backend that serves it.
 */
public interface BenchmarkRequest {

    InstanceIdentity target();

    BackendKind backend();
}
