package com.vigil.registry;

import com.vigil.model.Alert;
import com.vigil.model.EndpointSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

@Slf4j
public class AlertLog {

    public static final int DEFAULT_CAPACITY = 100;

    private final Deque<Alert> alerts = new ArrayDeque<>();
    private final int capacity;
    private final Clock clock;
    private long nextId = 1;

    public AlertLog(Clock clock, int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Alert capacity must be positive: " + capacity);
        }
        this.clock = clock;
        this.capacity = capacity;
    }

    public synchronized Alert record(EndpointSnapshot endpoint, boolean failoverSuccess) {
        Alert alert = Alert.builder()
                .id(nextId++)
                .timestamp(clock.instant())
                .type(Alert.TYPE_ENDPOINT_UNHEALTHY)
                .endpoint(endpoint.getEndpoint())
                .state(endpoint.getState())
                .consecutiveFailures(endpoint.getConsecutiveFailures())
                .lastError(endpoint.getLastError() != null ? endpoint.getLastError() : "Unknown error")
                .actionTaken(Alert.ACTION_FAILOVER_ATTEMPTED)
                .failoverSuccess(failoverSuccess)
                .build();

        alerts.addLast(alert);
        while (alerts.size() > capacity) {
            alerts.removeFirst();
        }
        return alert;
    }

    /**
     * Most recent {@code limit} alerts, oldest first.
     */
    public synchronized List<Alert> recent(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<Alert> all = new ArrayList<>(alerts);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized long countSince(Instant since) {
        return alerts.stream()
                .filter(a -> !a.getTimestamp().isBefore(since))
                .count();
    }

    public synchronized int size() {
        return alerts.size();
    }

    public synchronized void clear() {
        alerts.clear();
    }
}
