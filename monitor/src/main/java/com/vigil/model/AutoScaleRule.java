package com.vigil.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

@Value
@Builder
public class AutoScaleRule {

    public static final Duration DEFAULT_COOLDOWN = Duration.ofSeconds(300);

    int id;
    ScalingMetric metric;
    double threshold;
    ScalingAction action;

    // recorded for the provider; the engine does not enforce it
    @Builder.Default
    Duration cooldown = DEFAULT_COOLDOWN;

    String alarmName;
    Instant createdAt;

    public static String alarmName(ScalingMetric metric, ScalingAction action, int id) {
        return "vigil-" + metric.getWireName() + "-" + action.getWireName() + "-" + id;
    }
}
