package com.vigil.status;

import com.vigil.model.EndpointState;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EndpointSummary {
    EndpointState status;
    Double responseTimeMs;
    String uptime;
}
