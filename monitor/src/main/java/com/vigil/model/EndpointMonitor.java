package com.vigil.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

@Getter
public class EndpointMonitor {

    private final String endpoint;
    private HealthCheckConfig config;
    private long generation;
    private EndpointState state;
    private int consecutiveFailures;
    private long successCount;
    private long failureCount;
    private Instant lastProbeAt;
    private Double lastResponseTimeMs;
    private String lastError;
    private Instant createdAt;

    public EndpointMonitor(HealthCheckConfig config, long generation, Instant createdAt) {
        this.endpoint = config.getEndpoint();
        this.config = config;
        this.generation = generation;
        this.state = EndpointState.INITIALIZING;
        this.createdAt = createdAt;
    }

    /**
     * Replaces the configuration and restarts the state machine from {@link EndpointState#INITIALIZING}.
     */
    public void reconfigure(HealthCheckConfig newConfig, long newGeneration, boolean keepLifetimeCounters, Instant now) {
        this.config = newConfig;
        this.generation = newGeneration;
        this.state = EndpointState.INITIALIZING;
        this.consecutiveFailures = 0;
        this.lastProbeAt = null;
        this.lastResponseTimeMs = null;
        this.lastError = null;
        if (!keepLifetimeCounters) {
            this.successCount = 0;
            this.failureCount = 0;
            this.createdAt = now;
        }
    }

    public void applyTransition(Transition transition, Instant probedAt) {
        this.state = transition.getState();
        this.consecutiveFailures = transition.getConsecutiveFailures();
        if (transition.isSuccess()) {
            successCount++;
        } else {
            failureCount++;
        }
        if (transition.getResponseTimeMs() != null) {
            this.lastResponseTimeMs = transition.getResponseTimeMs();
        }
        if (transition.getLastError() != null) {
            this.lastError = transition.getLastError();
        }
        this.lastProbeAt = probedAt;
    }

    public boolean isDue(Instant now) {
        if (lastProbeAt == null) {
            return true;
        }
        return Duration.between(lastProbeAt, now).compareTo(config.getPollInterval()) >= 0;
    }

    public EndpointSnapshot toSnapshot() {
        return EndpointSnapshot.builder()
                .endpoint(endpoint)
                .config(config)
                .state(state)
                .consecutiveFailures(consecutiveFailures)
                .successCount(successCount)
                .failureCount(failureCount)
                .lastProbeAt(lastProbeAt)
                .lastResponseTimeMs(lastResponseTimeMs)
                .lastError(lastError)
                .createdAt(createdAt)
                .build();
    }
}
