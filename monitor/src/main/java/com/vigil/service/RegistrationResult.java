package com.vigil.service;

import com.vigil.model.ResultStatus;

public record RegistrationResult(ResultStatus status, String message, String endpoint,
                                 Long interval, boolean monitoringActive) {

    public static RegistrationResult error(String message) {
        return new RegistrationResult(ResultStatus.ERROR, message, null, null, false);
    }
}
