package com.vigil.model;

public enum OperatingMode {
    LIVE,
    SIMULATED
}
