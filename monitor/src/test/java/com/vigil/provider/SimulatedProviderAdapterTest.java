package com.vigil.provider;

import com.vigil.model.OperatingMode;
import com.vigil.model.ScalingAction;
import com.vigil.model.ScalingMetric;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedProviderAdapterTest {

    private final SimulatedProviderAdapter adapter = new SimulatedProviderAdapter();

    @Test
    void acceptsEveryIntent() {
        assertThat(adapter.applyTrafficWeight(TrafficIntent.failover("a", "b"))).isTrue();
        assertThat(adapter.createScalingAlarm(ScalingAlarmIntent.builder()
                .alarmName("vigil-cpu-scale_up-1")
                .metric(ScalingMetric.CPU)
                .threshold(80)
                .action(ScalingAction.SCALE_UP)
                .cooldownSeconds(300)
                .build())).isTrue();
        assertThat(adapter.mode()).isEqualTo(OperatingMode.SIMULATED);
    }
}
