package com.vigil.service;

import com.vigil.model.ResultStatus;

public record OperationResult(ResultStatus status, String message) {

    public static OperationResult success(String message) {
        return new OperationResult(ResultStatus.SUCCESS, message);
    }

    public static OperationResult error(String message) {
        return new OperationResult(ResultStatus.ERROR, message);
    }
}
