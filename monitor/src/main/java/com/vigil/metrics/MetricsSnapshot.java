package com.vigil.metrics;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MetricsSnapshot {
    long totalRequests;
    long successfulProbes;
    long failedProbes;
    long trafficRulesCreated;
    long autoScaleTriggers;
}
