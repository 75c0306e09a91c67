package com.vigil.control;

import com.vigil.provider.ProviderAdapter;
import com.vigil.provider.TrafficIntent;
import com.vigil.registry.HealthRecordStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class FailoverCoordinator {

    private final HealthRecordStore store;
    private final ProviderAdapter providerAdapter;

    public boolean failover(String failedEndpoint) {
        log.info("Initiating failover for {}", failedEndpoint);

        List<String> candidates = store.healthyEndpointsExcept(failedEndpoint);
        if (candidates.isEmpty()) {
            log.error("No healthy endpoints available for failover of {}", failedEndpoint);
            return false;
        }

        String target = candidates.get(0);
        log.info("Available healthy endpoints: {}, redirecting {} to {}", candidates, failedEndpoint, target);

        boolean accepted = providerAdapter.applyTrafficWeight(TrafficIntent.failover(failedEndpoint, target));
        if (!accepted) {
            log.error("Provider did not accept failover intent {} -> {}", failedEndpoint, target);
        }
        return accepted;
    }
}
