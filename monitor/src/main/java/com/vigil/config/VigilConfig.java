package com.vigil.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vigil.control.FailoverCoordinator;
import com.vigil.control.HealthStateMachine;
import com.vigil.control.MonitorLoop;
import com.vigil.metrics.SystemMetrics;
import com.vigil.model.ResultStatus;
import com.vigil.probe.HttpProber;
import com.vigil.probe.Prober;
import com.vigil.provider.HttpProviderAdapter;
import com.vigil.provider.ProviderAdapter;
import com.vigil.provider.SimulatedProviderAdapter;
import com.vigil.registry.AlertLog;
import com.vigil.registry.AutoScaleRuleBook;
import com.vigil.registry.HealthRecordStore;
import com.vigil.registry.TrafficTable;
import com.vigil.service.EndpointRegistration;
import com.vigil.service.RegistrationResult;
import com.vigil.service.TrafficControlService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class VigilConfig {

    @Bean
    @ConfigurationProperties(prefix = "vigil")
    public VigilProperties vigilProperties() {
        return new VigilProperties();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HealthRecordStore healthRecordStore(Clock clock, VigilProperties properties) {
        return new HealthRecordStore(clock, properties.getHealth().getReRegistration());
    }

    @Bean
    public TrafficTable trafficTable(Clock clock) {
        return new TrafficTable(clock);
    }

    @Bean
    public AutoScaleRuleBook autoScaleRuleBook(Clock clock) {
        return new AutoScaleRuleBook(clock);
    }

    @Bean
    public AlertLog alertLog(Clock clock, VigilProperties properties) {
        return new AlertLog(clock, properties.getAlerts().getCapacity());
    }

    @Bean
    public SystemMetrics systemMetrics() {
        return new SystemMetrics();
    }

    @Bean
    public Prober prober(VigilProperties properties) {
        return new HttpProber(properties.getHealth().getTimeout());
    }

    @Bean
    public ProviderAdapter providerAdapter(ObjectMapper objectMapper, VigilProperties properties) {
        VigilProperties.ProviderMode mode = properties.getProvider().getMode();
        if (mode == null) {
            throw new IllegalStateException("vigil.provider.mode must be one of: simulated, http");
        }
        log.info("Provider adapter mode: {}", mode);
        return switch (mode) {
            case SIMULATED -> new SimulatedProviderAdapter();
            case HTTP -> new HttpProviderAdapter(objectMapper, properties);
        };
    }

    @Bean(destroyMethod = "shutdown")
    public MonitorLoop monitorLoop(HealthRecordStore store, HealthStateMachine stateMachine, Prober prober,
                                   FailoverCoordinator failoverCoordinator, AlertLog alertLog,
                                   SystemMetrics metrics, Clock clock, VigilProperties properties) {
        return new MonitorLoop(store, stateMachine, prober, failoverCoordinator, alertLog, metrics, clock,
                properties.getMonitor().toSettings());
    }

    @Bean
    public ApplicationRunner seedEndpoints(TrafficControlService service, VigilProperties properties) {
        return args -> {
            for (VigilProperties.EndpointDefinition def : properties.getEndpoints()) {
                RegistrationResult result = service.registerEndpoint(new EndpointRegistration(
                        def.getUrl(), def.getInterval(), def.getExpectedStatus(),
                        def.getTimeout(), def.getFailureThreshold()));
                if (result.status() != ResultStatus.SUCCESS) {
                    log.warn("Skipping configured endpoint {}: {}", def.getUrl(), result.message());
                }
            }
            if (!properties.getEndpoints().isEmpty()) {
                log.info("Registered {} configured endpoints", properties.getEndpoints().size());
            }
        };
    }
}
