package com.vigil.metrics;

import java.util.concurrent.atomic.AtomicLong;

public class SystemMetrics {

    private final AtomicLong totalRequests = new AtomicLong();
    private final AtomicLong successfulProbes = new AtomicLong();
    private final AtomicLong failedProbes = new AtomicLong();
    private final AtomicLong trafficRulesCreated = new AtomicLong();
    private final AtomicLong autoScaleTriggers = new AtomicLong();

    public void recordRequest() {
        totalRequests.incrementAndGet();
    }

    public void recordProbe(boolean success) {
        if (success) {
            successfulProbes.incrementAndGet();
        } else {
            failedProbes.incrementAndGet();
        }
    }

    public void recordTrafficRule() {
        trafficRulesCreated.incrementAndGet();
    }

    public void recordAutoScaleRule() {
        autoScaleTriggers.incrementAndGet();
    }

    public void resetKeepingRequests() {
        successfulProbes.set(0);
        failedProbes.set(0);
        trafficRulesCreated.set(0);
        autoScaleTriggers.set(0);
    }

    public MetricsSnapshot snapshot() {
        return MetricsSnapshot.builder()
                .totalRequests(totalRequests.get())
                .successfulProbes(successfulProbes.get())
                .failedProbes(failedProbes.get())
                .trafficRulesCreated(trafficRulesCreated.get())
                .autoScaleTriggers(autoScaleTriggers.get())
                .build();
    }
}
