package com.vigil.status;

import com.vigil.model.EndpointState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class EndpointDetail {
    EndpointState status;
    Instant lastCheck;
    int failures;
    long successCount;
    long failureCount;
    Double responseTimeMs;
    String lastError;
    String uptime;
    Instant createdAt;
}
