package com.vigil.status;

import com.vigil.metrics.MetricsSnapshot;
import com.vigil.model.OperatingMode;
import com.vigil.model.OverallStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class SystemStatus {
    Instant timestamp;
    OverallStatus overallStatus;
    int totalEndpoints;
    int healthyEndpoints;
    int trafficRules;
    int autoScaleRules;
    boolean monitoringActive;
    long recentAlerts;
    MetricsSnapshot metrics;
    double avgResponseTimeMs;
    OperatingMode mode;
    Map<String, EndpointSummary> endpoints;
}
