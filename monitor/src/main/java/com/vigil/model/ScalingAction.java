package com.vigil.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ScalingAction {
    SCALE_UP("scale_up"),
    SCALE_DOWN("scale_down");

    private final String wireName;

    ScalingAction(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Optional<ScalingAction> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(a -> a.wireName.equals(normalized))
                .findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
