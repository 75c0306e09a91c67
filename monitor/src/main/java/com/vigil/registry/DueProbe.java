package com.vigil.registry;

import com.vigil.model.HealthCheckConfig;

public record DueProbe(String endpoint, long generation, HealthCheckConfig config) {}
