package com.vigil.status;

import com.vigil.model.ResultStatus;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class TargetStatus {
    ResultStatus status;
    String message;
    String target;
    int matches;
    Map<String, EndpointDetail> results;

    public boolean isFound() {
        return status == ResultStatus.SUCCESS;
    }
}
