package com.vigil.control;

import java.time.Duration;

/**
 * @param tickInterval     pause between ticks while endpoints are registered
 * @param idleInterval     pause while nothing is registered
 * @param probeParallelism size of the probe pool
 * @param probeGrace       extra wait on top of an endpoint's timeout before a probe counts as timed out
 */
public record MonitorSettings(Duration tickInterval, Duration idleInterval, int probeParallelism, Duration probeGrace) {}
