package com.vigil.model;

public enum Effect {
    RAISE_ALERT,
    TRIGGER_FAILOVER
}
