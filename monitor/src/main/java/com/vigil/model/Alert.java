package com.vigil.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Alert {

    public static final String TYPE_ENDPOINT_UNHEALTHY = "endpoint_unhealthy";
    public static final String ACTION_FAILOVER_ATTEMPTED = "failover_attempted";

    long id;
    Instant timestamp;
    String type;
    String endpoint;
    EndpointState state;
    int consecutiveFailures;
    String lastError;
    String actionTaken;
    boolean failoverSuccess;
}
