package com.vigil.registry;

import com.vigil.model.EndpointSnapshot;
import com.vigil.model.Transition;

public record AppliedTransition(Transition transition, EndpointSnapshot snapshot) {}
