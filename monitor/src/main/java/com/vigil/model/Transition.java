package com.vigil.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Set;

@Value
@Builder
public class Transition {

    EndpointState state;
    int consecutiveFailures;
    boolean success;
    Double responseTimeMs;
    String lastError;

    @Singular
    Set<Effect> effects;

    public boolean hasEffect(Effect effect) {
        return effects.contains(effect);
    }
}
