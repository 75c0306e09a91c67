package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OverallStatus {
    HEALTHY,
    DEGRADED;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
