package com.vigil.provider;

import com.vigil.model.OperatingMode;

/**
 * Boundary to whatever actually reroutes traffic or creates scaling alarms.
 * <p>
 * Calls are fire-and-forget: the return value only says whether the intent was handed over, not whether
 * the provider has applied it. Implementations must not throw.
 */
public interface ProviderAdapter {

    boolean applyTrafficWeight(TrafficIntent intent);

    boolean createScalingAlarm(ScalingAlarmIntent intent);

    OperatingMode mode();
}
