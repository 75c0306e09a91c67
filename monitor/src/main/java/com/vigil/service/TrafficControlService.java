package com.vigil.service;

import com.vigil.config.VigilProperties;
import com.vigil.control.MonitorLoop;
import com.vigil.metrics.MetricsSnapshot;
import com.vigil.metrics.SystemMetrics;
import com.vigil.model.AutoScaleRule;
import com.vigil.model.HealthCheckConfig;
import com.vigil.model.OperatingMode;
import com.vigil.model.ResultStatus;
import com.vigil.model.ScalingAction;
import com.vigil.model.ScalingMetric;
import com.vigil.model.TrafficRule;
import com.vigil.provider.ProviderAdapter;
import com.vigil.provider.ScalingAlarmIntent;
import com.vigil.provider.TrafficIntent;
import com.vigil.registry.AlertLog;
import com.vigil.registry.AutoScaleRuleBook;
import com.vigil.registry.HealthRecordStore;
import com.vigil.registry.TrafficTable;
import com.vigil.status.EndpointDetail;
import com.vigil.status.StatusAggregator;
import com.vigil.status.SystemStatus;
import com.vigil.status.TargetStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class TrafficControlService {

    public static final int DEFAULT_ALERT_LIMIT = 50;

    private final HealthRecordStore store;
    private final TrafficTable trafficTable;
    private final AutoScaleRuleBook autoScaleRuleBook;
    private final AlertLog alertLog;
    private final SystemMetrics metrics;
    private final MonitorLoop monitorLoop;
    private final ProviderAdapter providerAdapter;
    private final StatusAggregator statusAggregator;
    private final VigilProperties properties;
    private final Clock clock;

    public RegistrationResult registerEndpoint(String url, Duration interval) {
        return registerEndpoint(EndpointRegistration.of(url, interval));
    }

    public RegistrationResult registerEndpoint(EndpointRegistration registration) {
        metrics.recordRequest();

        Optional<String> endpoint = EndpointIdentity.normalize(registration.url());
        if (endpoint.isEmpty()) {
            log.warn("Rejected endpoint registration: invalid endpoint '{}'", registration.url());
            return RegistrationResult.error("Invalid endpoint: " + registration.url());
        }

        VigilProperties.Health defaults = properties.getHealth();
        Duration interval = valueOrDefault(registration.interval(), defaults.getPollInterval());
        Duration timeout = valueOrDefault(registration.timeout(), defaults.getTimeout());
        int expectedStatus = valueOrDefault(registration.expectedStatus(), defaults.getExpectedStatus());
        int failureThreshold = valueOrDefault(registration.failureThreshold(), defaults.getFailureThreshold());

        if (interval.isNegative() || interval.isZero()) {
            return RegistrationResult.error("Interval must be positive: " + interval.toSeconds() + "s");
        }
        if (interval.compareTo(HealthCheckConfig.MAX_POLL_INTERVAL) > 0) {
            return RegistrationResult.error("Interval must not exceed "
                    + HealthCheckConfig.MAX_POLL_INTERVAL.toSeconds() + "s: " + interval.toSeconds() + "s");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            return RegistrationResult.error("Timeout must be positive: " + timeout.toSeconds() + "s");
        }
        if (timeout.compareTo(HealthCheckConfig.MAX_TIMEOUT) > 0) {
            return RegistrationResult.error("Timeout must not exceed "
                    + HealthCheckConfig.MAX_TIMEOUT.toSeconds() + "s: " + timeout.toSeconds() + "s");
        }
        if (failureThreshold < 1) {
            return RegistrationResult.error("Failure threshold must be at least 1: " + failureThreshold);
        }
        if (expectedStatus < 100 || expectedStatus > 599) {
            return RegistrationResult.error("Expected status must be a valid HTTP status: " + expectedStatus);
        }

        HealthCheckConfig config = HealthCheckConfig.builder()
                .endpoint(endpoint.get())
                .pollInterval(interval)
                .timeout(timeout)
                .expectedStatus(expectedStatus)
                .failureThreshold(failureThreshold)
                .build();

        store.register(config);
        monitorLoop.start();

        return new RegistrationResult(
                ResultStatus.SUCCESS,
                "Health check configured for " + endpoint.get(),
                endpoint.get(),
                interval.toSeconds(),
                monitorLoop.isActive());
    }

    public OperationResult unregisterEndpoint(String url) {
        metrics.recordRequest();

        Optional<String> endpoint = EndpointIdentity.normalize(url);
        if (endpoint.isEmpty() || !store.unregister(endpoint.get())) {
            return OperationResult.error("Endpoint not monitored: " + url);
        }
        return OperationResult.success("Health check removed for " + endpoint.get());
    }

    public RuleResult<TrafficRule> addTrafficRule(String source, String target, int weight) {
        return addTrafficRule(source, target, weight, null);
    }

    public RuleResult<TrafficRule> addTrafficRule(String source, String target, int weight, String condition) {
        metrics.recordRequest();

        if (source == null || source.isBlank() || target == null || target.isBlank()) {
            return RuleResult.error("Traffic rule needs both a source and a target");
        }

        TrafficRule rule = trafficTable.addRule(source.trim(), target.trim(), weight, condition);
        metrics.recordTrafficRule();

        if (!providerAdapter.applyTrafficWeight(TrafficIntent.forRule(rule))) {
            log.warn("Traffic rule #{} stored but provider update failed", rule.getId());
            return new RuleResult<>(ResultStatus.DEGRADED,
                    "Traffic rule stored but provider update failed", rule.getId(), rule);
        }

        return new RuleResult<>(ResultStatus.SUCCESS,
                "Traffic routing configured: " + rule.getWeight() + "% from " + rule.getSourcePattern()
                        + " to " + rule.getTarget(),
                rule.getId(), rule);
    }

    public RuleResult<AutoScaleRule> addAutoScaleRule(String metric, double threshold, String action) {
        metrics.recordRequest();

        Optional<ScalingMetric> scalingMetric = ScalingMetric.fromName(metric);
        if (scalingMetric.isEmpty()) {
            return RuleResult.error("Unknown metric: " + metric + " (expected cpu, memory, disk or network)");
        }
        Optional<ScalingAction> scalingAction = ScalingAction.fromName(action);
        if (scalingAction.isEmpty()) {
            return RuleResult.error("Unknown action: " + action + " (expected scale_up or scale_down)");
        }
        if (Double.isNaN(threshold) || threshold < 0 || threshold > 100) {
            return RuleResult.error("Threshold must be a percentage between 0 and 100: " + threshold);
        }

        AutoScaleRule rule = autoScaleRuleBook.addRule(scalingMetric.get(), threshold, scalingAction.get());
        metrics.recordAutoScaleRule();

        if (!providerAdapter.createScalingAlarm(ScalingAlarmIntent.forRule(rule))) {
            log.warn("Auto-scale rule #{} stored but alarm creation failed", rule.getId());
            return new RuleResult<>(ResultStatus.DEGRADED,
                    "Auto-scale rule stored but alarm creation failed", rule.getId(), rule);
        }

        return new RuleResult<>(ResultStatus.SUCCESS,
                "Auto-scaling configured: " + rule.getAction() + " when " + rule.getMetric()
                        + " reaches " + rule.getThreshold() + "%",
                rule.getId(), rule);
    }

    public SystemStatus getStatus() {
        return statusAggregator.systemStatus();
    }

    public TargetStatus getStatus(String target) {
        return statusAggregator.targetStatus(target);
    }

    public Map<String, EndpointDetail> listEndpoints() {
        return statusAggregator.endpoints();
    }

    public List<TrafficRule> getTrafficRules() {
        return trafficTable.rules();
    }

    public List<AutoScaleRule> getAutoScaleRules() {
        return autoScaleRuleBook.rules();
    }

    public List<String> getRecommendations() {
        return statusAggregator.recommendations();
    }

    public AlertsView getAlerts(int limit) {
        return new AlertsView(alertLog.recent(limit), alertLog.size(), clock.instant());
    }

    public MetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    /**
     * Drops every endpoint, rule and alert and zeroes the metrics, except the request counter which
     * counts this call too. The monitor loop keeps running and simply idles.
     */
    public OperationResult clearAll() {
        store.clear();
        trafficTable.clear();
        autoScaleRuleBook.clear();
        alertLog.clear();
        metrics.resetKeepingRequests();
        metrics.recordRequest();

        log.info("System configuration cleared");
        return OperationResult.success("All configurations cleared and system reset");
    }

    public OperatingMode getMode() {
        return providerAdapter.mode();
    }

    public boolean isMonitoringActive() {
        return monitorLoop.isActive();
    }

    private static <T> T valueOrDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
