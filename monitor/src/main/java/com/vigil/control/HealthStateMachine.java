package com.vigil.control;

import com.vigil.model.Effect;
import com.vigil.model.EndpointState;
import com.vigil.model.HealthCheckConfig;
import com.vigil.model.ProbeOutcome;
import com.vigil.model.Transition;
import org.springframework.stereotype.Component;

/**
 * Pure transition function from (config, consecutive failures, probe outcome) to the next endpoint state.
 * <p>
 * Below the failure threshold every failing probe yields {@link EndpointState#DEGRADED}. From the
 * threshold on, every failing probe yields the failure state for its outcome kind and requests both an
 * alert and a failover; repeated failures re-trigger both.
 */
@Component
public class HealthStateMachine {

    public Transition apply(HealthCheckConfig config, int consecutiveFailures, ProbeOutcome outcome) {
        return switch (outcome.getKind()) {
            case SUCCESS, UNEXPECTED_STATUS -> {
                if (outcome.hasStatusCode() && outcome.getStatusCode() == config.getExpectedStatus()) {
                    yield healthy(outcome);
                }
                yield failure(config, consecutiveFailures, EndpointState.UNHEALTHY, "HTTP " + outcome.getStatusCode());
            }
            case TIMEOUT -> failure(config, consecutiveFailures, EndpointState.TIMED_OUT, outcome.getMessage());
            case CONNECTION_FAILED -> failure(config, consecutiveFailures, EndpointState.CONNECTION_ERROR, outcome.getMessage());
            case OTHER_ERROR -> failure(config, consecutiveFailures, EndpointState.ERROR_OTHER, outcome.getMessage());
        };
    }

    private Transition healthy(ProbeOutcome outcome) {
        return Transition.builder()
                .state(EndpointState.HEALTHY)
                .consecutiveFailures(0)
                .success(true)
                .responseTimeMs(round(outcome.getResponseTimeMs()))
                .build();
    }

    private Transition failure(HealthCheckConfig config, int consecutiveFailures,
                               EndpointState failureState, String error) {
        int failures = consecutiveFailures + 1;
        boolean thresholdReached = failures >= config.getFailureThreshold();

        Transition.TransitionBuilder builder = Transition.builder()
                .state(thresholdReached ? failureState : EndpointState.DEGRADED)
                .consecutiveFailures(failures)
                .success(false)
                .lastError(error);

        if (thresholdReached) {
            builder.effect(Effect.RAISE_ALERT).effect(Effect.TRIGGER_FAILOVER);
        }
        return builder.build();
    }

    private static Double round(Double responseTimeMs) {
        if (responseTimeMs == null) {
            return null;
        }
        return Math.round(responseTimeMs * 100.0) / 100.0;
    }
}
