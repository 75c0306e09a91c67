package com.vigil.service;

import java.time.Duration;

public record EndpointRegistration(String url, Duration interval, Integer expectedStatus,
                                   Duration timeout, Integer failureThreshold) {

    public static EndpointRegistration of(String url, Duration interval) {
        return new EndpointRegistration(url, interval, null, null, null);
    }
}
