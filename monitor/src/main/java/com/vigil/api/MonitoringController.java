package com.vigil.api;

import com.vigil.service.AlertsView;
import com.vigil.service.TrafficControlService;
import com.vigil.status.SystemStatus;
import com.vigil.status.TargetStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class MonitoringController {

    static final String SERVICE_NAME = "Vigil Traffic Control API";
    static final String SERVICE_VERSION = "1.0.0";

    private final TrafficControlService service;
    private final Clock clock;

    @GetMapping("/status")
    public ResponseEntity<SystemStatus> getSystemStatus() {
        return ResponseEntity.ok(service.getStatus());
    }

    @GetMapping("/status/{target}")
    public ResponseEntity<TargetStatus> getTargetStatus(@PathVariable String target) {
        TargetStatus status = service.getStatus(target);
        if (!status.isFound()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(status);
        }
        return ResponseEntity.ok(status);
    }

    @GetMapping("/recommendations")
    public ResponseEntity<Map<String, Object>> getRecommendations() {
        return ResponseEntity.ok(Map.of(
                "recommendations", service.getRecommendations(),
                "timestamp", clock.instant()));
    }

    @GetMapping("/health")
    public ResponseEntity<HealthInfo> health() {
        return ResponseEntity.ok(new HealthInfo(
                "healthy",
                clock.instant().toString(),
                SERVICE_NAME,
                SERVICE_VERSION,
                service.getMode().name(),
                service.isMonitoringActive()));
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> getMetrics() {
        return ResponseEntity.ok(Map.of(
                "metrics", service.getMetrics(),
                "timestamp", clock.instant()));
    }

    @GetMapping("/alerts")
    public ResponseEntity<AlertsView> getAlerts(
            @RequestParam(defaultValue = "" + TrafficControlService.DEFAULT_ALERT_LIMIT) int limit) {
        return ResponseEntity.ok(service.getAlerts(limit));
    }

    @GetMapping("/endpoints")
    public ResponseEntity<Map<String, Object>> getEndpoints() {
        var endpoints = service.listEndpoints();
        return ResponseEntity.ok(Map.of(
                "endpoints", endpoints,
                "total", endpoints.size(),
                "timestamp", clock.instant()));
    }

    public record HealthInfo(
            String status,
            String timestamp,
            String service,
            String version,
            String mode,
            boolean monitoringActive
    ) {}
}
