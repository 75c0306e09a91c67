package com.vigil.config;

import com.vigil.control.MonitorSettings;
import com.vigil.model.HealthCheckConfig;
import com.vigil.registry.AlertLog;
import com.vigil.registry.ReRegistrationPolicy;
import lombok.Data;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
public class VigilProperties {

    private Health health = new Health();
    private Monitor monitor = new Monitor();
    private Alerts alerts = new Alerts();
    private Provider provider = new Provider();
    private Websocket websocket = new Websocket();
    private List<EndpointDefinition> endpoints = new ArrayList<>();

    @Data
    public static class Health {
        private int expectedStatus = HealthCheckConfig.DEFAULT_EXPECTED_STATUS;
        private Duration timeout = HealthCheckConfig.DEFAULT_TIMEOUT;
        private Duration pollInterval = HealthCheckConfig.DEFAULT_POLL_INTERVAL;
        private int failureThreshold = HealthCheckConfig.DEFAULT_FAILURE_THRESHOLD;
        private ReRegistrationPolicy reRegistration = ReRegistrationPolicy.PRESERVE_COUNTERS;
    }

    @Data
    public static class Monitor {
        private Duration tickInterval = Duration.ofSeconds(2);
        private Duration idleInterval = Duration.ofSeconds(5);
        private int probeParallelism = 8;
        private Duration probeGrace = Duration.ofSeconds(1);

        public MonitorSettings toSettings() {
            return new MonitorSettings(tickInterval, idleInterval, probeParallelism, probeGrace);
        }
    }

    @Data
    public static class Alerts {
        private int capacity = AlertLog.DEFAULT_CAPACITY;
    }

    public enum ProviderMode {
        SIMULATED,
        HTTP
    }

    @Data
    public static class Provider {
        private ProviderMode mode = ProviderMode.SIMULATED;
        private String url;
        private Duration timeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Websocket {
        private String statusPath = "/websocket/status";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }

    @Data
    public static class EndpointDefinition {
        private String url;
        private Duration interval;
        private Integer expectedStatus;
        private Duration timeout;
        private Integer failureThreshold;
    }
}
