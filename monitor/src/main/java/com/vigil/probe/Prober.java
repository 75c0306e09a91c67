package com.vigil.probe;

import com.vigil.model.HealthCheckConfig;
import com.vigil.model.ProbeOutcome;

/**
 * Performs one liveness check. Implementations must return within {@link HealthCheckConfig#getTimeout()}
 * and report every network failure as a {@link ProbeOutcome}, never as an exception.
 */
@FunctionalInterface
public interface Prober {

    ProbeOutcome probe(HealthCheckConfig config);
}
