package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ScalingMetric {
    CPU("cpu"),
    MEMORY("memory"),
    DISK("disk"),
    NETWORK("network");

    private final String wireName;

    ScalingMetric(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<ScalingMetric> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(m -> m.wireName.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
