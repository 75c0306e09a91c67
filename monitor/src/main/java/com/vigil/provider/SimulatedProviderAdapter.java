package com.vigil.provider;

import com.vigil.model.OperatingMode;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SimulatedProviderAdapter implements ProviderAdapter {

    @Override
    public boolean applyTrafficWeight(TrafficIntent intent) {
        log.info("SIMULATED: routing {}% traffic from {} to {} ({})",
                intent.getWeight(), intent.getSource(), intent.getTarget(), intent.getReason());
        return true;
    }

    @Override
    public boolean createScalingAlarm(ScalingAlarmIntent intent) {
        log.info("SIMULATED: scaling alarm {} - {} when {} reaches {}%",
                intent.getAlarmName(), intent.getAction(), intent.getMetric(), intent.getThreshold());
        return true;
    }

    @Override
    public OperatingMode mode() {
        return OperatingMode.SIMULATED;
    }
}
