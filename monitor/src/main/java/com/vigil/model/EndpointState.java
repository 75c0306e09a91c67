package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EndpointState {
    INITIALIZING("initializing"),
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy"),
    TIMED_OUT("timeout"),
    CONNECTION_ERROR("connection_error"),
    ERROR_OTHER("error");

    private final String wireName;

    EndpointState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * States that are only entered once the failure threshold has been reached.
     */
    public boolean isFailure() {
        return this == UNHEALTHY || this == TIMED_OUT || this == CONNECTION_ERROR || this == ERROR_OTHER;
    }

    /**
     * Anything that is neither healthy nor still waiting for its first probe.
     */
    public boolean needsAttention() {
        return this != HEALTHY && this != INITIALIZING;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
