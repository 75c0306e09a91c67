package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * {@code DEGRADED}: engine state updated, provider hand-off failed.
 */
public enum ResultStatus {
    SUCCESS,
    DEGRADED,
    ERROR;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase();
    }
}
