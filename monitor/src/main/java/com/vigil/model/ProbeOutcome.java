package com.vigil.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProbeOutcome {

    public enum Kind {
        SUCCESS,
        UNEXPECTED_STATUS,
        TIMEOUT,
        CONNECTION_FAILED,
        OTHER_ERROR
    }

    Kind kind;
    Integer statusCode;
    Double responseTimeMs;
    String message;

    public static ProbeOutcome success(int statusCode, double responseTimeMs) {
        return new ProbeOutcome(Kind.SUCCESS, statusCode, responseTimeMs, null);
    }

    public static ProbeOutcome unexpectedStatus(int statusCode, double responseTimeMs) {
        return new ProbeOutcome(Kind.UNEXPECTED_STATUS, statusCode, responseTimeMs, null);
    }

    public static ProbeOutcome timeout() {
        return new ProbeOutcome(Kind.TIMEOUT, null, null, "Request timeout");
    }

    public static ProbeOutcome connectionFailed() {
        return new ProbeOutcome(Kind.CONNECTION_FAILED, null, null, "Connection failed");
    }

    public static ProbeOutcome otherError(String message) {
        return new ProbeOutcome(Kind.OTHER_ERROR, null, null, message != null ? message : "Unknown error");
    }

    public boolean hasStatusCode() {
        return statusCode != null;
    }
}
