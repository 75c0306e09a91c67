package com.vigil.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder(toBuilder = true)
public class HealthCheckConfig {

    public static final int DEFAULT_EXPECTED_STATUS = 200;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);
    public static final int DEFAULT_FAILURE_THRESHOLD = 3;
    public static final Duration MAX_POLL_INTERVAL = Duration.ofDays(1);
    public static final Duration MAX_TIMEOUT = Duration.ofMinutes(5);

    String endpoint;

    @Builder.Default
    int expectedStatus = DEFAULT_EXPECTED_STATUS;

    @Builder.Default
    Duration timeout = DEFAULT_TIMEOUT;

    @Builder.Default
    Duration pollInterval = DEFAULT_POLL_INTERVAL;

    @Builder.Default
    int failureThreshold = DEFAULT_FAILURE_THRESHOLD;
}
