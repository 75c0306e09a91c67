package com.vigil.status;

import com.vigil.control.MonitorLoop;
import com.vigil.metrics.SystemMetrics;
import com.vigil.model.EndpointSnapshot;
import com.vigil.model.EndpointState;
import com.vigil.model.OverallStatus;
import com.vigil.model.ResultStatus;
import com.vigil.provider.ProviderAdapter;
import com.vigil.registry.AlertLog;
import com.vigil.registry.AutoScaleRuleBook;
import com.vigil.registry.HealthRecordStore;
import com.vigil.registry.TrafficTable;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class StatusAggregator {

    static final Duration RECENT_ALERT_WINDOW = Duration.ofHours(1);

    private final HealthRecordStore store;
    private final TrafficTable trafficTable;
    private final AutoScaleRuleBook autoScaleRuleBook;
    private final AlertLog alertLog;
    private final SystemMetrics metrics;
    private final MonitorLoop monitorLoop;
    private final ProviderAdapter providerAdapter;
    private final RecommendationEngine recommendationEngine;
    private final Clock clock;

    public SystemStatus systemStatus() {
        Instant now = clock.instant();
        List<EndpointSnapshot> endpoints = store.snapshot();

        int healthy = (int) endpoints.stream()
                .filter(e -> e.getState() == EndpointState.HEALTHY)
                .count();

        Map<String, EndpointSummary> summaries = new LinkedHashMap<>();
        for (EndpointSnapshot endpoint : endpoints) {
            summaries.put(endpoint.getEndpoint(), EndpointSummary.builder()
                    .status(endpoint.getState())
                    .responseTimeMs(endpoint.getLastResponseTimeMs())
                    .uptime(Uptime.format(endpoint.getSuccessCount(), endpoint.getFailureCount()))
                    .build());
        }

        return SystemStatus.builder()
                .timestamp(now)
                .overallStatus(overallStatus(endpoints.size(), healthy))
                .totalEndpoints(endpoints.size())
                .healthyEndpoints(healthy)
                .trafficRules(trafficTable.size())
                .autoScaleRules(autoScaleRuleBook.size())
                .monitoringActive(monitorLoop.isActive())
                .recentAlerts(recentAlerts(now))
                .metrics(metrics.snapshot())
                .avgResponseTimeMs(averageResponseTime(endpoints))
                .mode(providerAdapter.mode())
                .endpoints(summaries)
                .build();
    }

    /**
     * Detail for every endpoint whose URL contains {@code target}, ignoring case.
     */
    public TargetStatus targetStatus(String target) {
        String needle = target == null ? "" : target.toLowerCase(Locale.ROOT);

        Map<String, EndpointDetail> results = new LinkedHashMap<>();
        for (EndpointSnapshot endpoint : store.snapshot()) {
            if (endpoint.getEndpoint().toLowerCase(Locale.ROOT).contains(needle)) {
                results.put(endpoint.getEndpoint(), detail(endpoint));
            }
        }

        if (results.isEmpty()) {
            return TargetStatus.builder()
                    .status(ResultStatus.ERROR)
                    .message("No endpoints found matching \"" + target + "\"")
                    .target(target)
                    .matches(0)
                    .results(Map.of())
                    .build();
        }

        return TargetStatus.builder()
                .status(ResultStatus.SUCCESS)
                .target(target)
                .matches(results.size())
                .results(results)
                .build();
    }

    public Map<String, EndpointDetail> endpoints() {
        Map<String, EndpointDetail> details = new LinkedHashMap<>();
        for (EndpointSnapshot endpoint : store.snapshot()) {
            details.put(endpoint.getEndpoint(), detail(endpoint));
        }
        return details;
    }

    public List<String> recommendations() {
        return recommendationEngine.recommend(
                store.snapshot(),
                recentAlerts(clock.instant()),
                trafficTable.size(),
                autoScaleRuleBook.size(),
                monitorLoop.isActive());
    }

    static OverallStatus overallStatus(int total, int healthy) {
        return total > 0 && healthy == total ? OverallStatus.HEALTHY : OverallStatus.DEGRADED;
    }

    static double averageResponseTime(List<EndpointSnapshot> endpoints) {
        double average = endpoints.stream()
                .filter(e -> e.getState() == EndpointState.HEALTHY)
                .filter(e -> e.getLastResponseTimeMs() != null)
                .mapToDouble(EndpointSnapshot::getLastResponseTimeMs)
                .average()
                .orElse(0.0);
        return Math.round(average * 100.0) / 100.0;
    }

    private long recentAlerts(Instant now) {
        return alertLog.countSince(now.minus(RECENT_ALERT_WINDOW));
    }

    private static EndpointDetail detail(EndpointSnapshot endpoint) {
        return EndpointDetail.builder()
                .status(endpoint.getState())
                .lastCheck(endpoint.getLastProbeAt())
                .failures(endpoint.getConsecutiveFailures())
                .successCount(endpoint.getSuccessCount())
                .failureCount(endpoint.getFailureCount())
                .responseTimeMs(endpoint.getLastResponseTimeMs())
                .lastError(endpoint.getLastError())
                .uptime(Uptime.format(endpoint.getSuccessCount(), endpoint.getFailureCount()))
                .createdAt(endpoint.getCreatedAt())
                .build();
    }
}
