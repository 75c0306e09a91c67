package com.vigil.service;

import com.vigil.model.ResultStatus;

public record RuleResult<T>(ResultStatus status, String message, Integer ruleId, T rule) {

    public static <T> RuleResult<T> error(String message) {
        return new RuleResult<>(ResultStatus.ERROR, message, null, null);
    }
}
