package com.vigil.registry;

public enum ReRegistrationPolicy {
    PRESERVE_COUNTERS,
    RESET
}
