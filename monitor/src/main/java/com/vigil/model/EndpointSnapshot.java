package com.vigil.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EndpointSnapshot {

    String endpoint;
    HealthCheckConfig config;
    EndpointState state;
    int consecutiveFailures;
    long successCount;
    long failureCount;
    Instant lastProbeAt;
    Double lastResponseTimeMs;
    String lastError;
    Instant createdAt;
}
