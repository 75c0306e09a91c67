package com.vigil.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class TrafficRule {

    public static final int MIN_WEIGHT = 0;
    public static final int MAX_WEIGHT = 100;

    int id;
    String sourcePattern;
    String target;
    int weight;
    String condition;
    Instant createdAt;

    public static int clampWeight(int weight) {
        return Math.max(MIN_WEIGHT, Math.min(MAX_WEIGHT, weight));
    }
}
