package com.vigil.control;

import com.vigil.MutableClock;
import com.vigil.metrics.SystemMetrics;
import com.vigil.model.Alert;
import com.vigil.model.EndpointSnapshot;
import com.vigil.model.EndpointState;
import com.vigil.model.HealthCheckConfig;
import com.vigil.model.ProbeOutcome;
import com.vigil.probe.Prober;
import com.vigil.provider.ProviderAdapter;
import com.vigil.registry.AlertLog;
import com.vigil.registry.HealthRecordStore;
import com.vigil.registry.ReRegistrationPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MonitorLoopTest {

    private static final String API = "https://api.example.com";
    private static final String BACKUP = "https://backup.example.com";

    private final MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    private final HealthRecordStore store = new HealthRecordStore(clock, ReRegistrationPolicy.PRESERVE_COUNTERS);
    private final AlertLog alertLog = new AlertLog(clock, AlertLog.DEFAULT_CAPACITY);
    private final SystemMetrics metrics = new SystemMetrics();
    private final ProviderAdapter providerAdapter = mock(ProviderAdapter.class);
    private final ScriptedProber prober = new ScriptedProber();

    private MonitorLoop loop;

    @AfterEach
    void tearDown() {
        if (loop != null) {
            loop.shutdown();
        }
    }

    @Test
    void consecutiveConnectionFailuresRaiseSingleAlertAtThreshold() {
        loop = newLoop(prober);
        store.register(config(API, 3));
        prober.script(API, ProbeOutcome.connectionFailed(), ProbeOutcome.connectionFailed(), ProbeOutcome.connectionFailed());

        loop.tick();
        assertThat(state(API)).isEqualTo(EndpointState.DEGRADED);
        clock.advance(Duration.ofSeconds(30));
        loop.tick();
        assertThat(state(API)).isEqualTo(EndpointState.DEGRADED);
        assertThat(alertLog.size()).isZero();
        clock.advance(Duration.ofSeconds(30));
        loop.tick();

        EndpointSnapshot snapshot = store.find(API).orElseThrow();
        assertThat(snapshot.getState()).isEqualTo(EndpointState.CONNECTION_ERROR);
        assertThat(snapshot.getConsecutiveFailures()).isEqualTo(3);
        assertThat(snapshot.getFailureCount()).isEqualTo(3);
        assertThat(alertLog.size()).isEqualTo(1);

        Alert alert = alertLog.recent(1).get(0);
        assertThat(alert.getEndpoint()).isEqualTo(API);
        assertThat(alert.getConsecutiveFailures()).isEqualTo(3);
        assertThat(alert.isFailoverSuccess()).isFalse();
        assertThat(metrics.snapshot().getFailedProbes()).isEqualTo(3);
    }

    @Test
    void failoverSucceedsWhenAnotherEndpointIsHealthy() {
        when(providerAdapter.applyTrafficWeight(any())).thenReturn(true);
        loop = newLoop(prober);
        store.register(config(BACKUP, 3));
        store.register(config(API, 1));
        prober.script(BACKUP, ProbeOutcome.success(200, 12.5));
        prober.script(API, ProbeOutcome.timeout());

        loop.tick();

        assertThat(state(BACKUP)).isEqualTo(EndpointState.HEALTHY);
        assertThat(state(API)).isEqualTo(EndpointState.TIMED_OUT);
        assertThat(alertLog.recent(1).get(0).isFailoverSuccess()).isTrue();
        assertThat(metrics.snapshot().getSuccessfulProbes()).isEqualTo(1);
        assertThat(metrics.snapshot().getFailedProbes()).isEqualTo(1);
    }

    @Test
    void endpointsAreProbedOnlyWhenDue() {
        loop = newLoop(prober);
        store.register(config(API, 3));

        loop.tick();
        loop.tick();
        clock.advance(Duration.ofSeconds(29));
        loop.tick();
        assertThat(prober.calls(API)).isEqualTo(1);

        clock.advance(Duration.ofSeconds(1));
        loop.tick();
        assertThat(prober.calls(API)).isEqualTo(2);
    }

    @Test
    void tickWithoutEndpointsReportsIdle() {
        loop = newLoop(prober);

        assertThat(loop.tick()).isFalse();
    }

    @Test
    void hungProbeIsRecordedAsTimeout() {
        Prober hanging = config -> {
            try {
                Thread.sleep(2_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return ProbeOutcome.success(200, 1);
        };
        loop = newLoop(hanging);
        store.register(HealthCheckConfig.builder()
                .endpoint(API)
                .timeout(Duration.ofMillis(100))
                .failureThreshold(3)
                .build());

        loop.tick();

        EndpointSnapshot snapshot = store.find(API).orElseThrow();
        assertThat(snapshot.getState()).isEqualTo(EndpointState.DEGRADED);
        assertThat(snapshot.getLastError()).isEqualTo("Request timeout");
    }

    @Test
    void failingProberDoesNotAffectOtherEndpoints() {
        Prober flaky = config -> {
            if (config.getEndpoint().equals(API)) {
                throw new IllegalStateException("prober bug");
            }
            return ProbeOutcome.success(200, 3);
        };
        loop = newLoop(flaky);
        store.register(config(API, 3));
        store.register(config(BACKUP, 3));

        loop.tick();

        assertThat(state(API)).isEqualTo(EndpointState.INITIALIZING);
        assertThat(state(BACKUP)).isEqualTo(EndpointState.HEALTHY);
    }

    @Test
    void endpointWithHugeIntervalDoesNotStallOthers() {
        loop = newLoop(prober);
        store.register(config(API, 3));
        store.register(HealthCheckConfig.builder()
                .endpoint(BACKUP)
                .pollInterval(Duration.ofSeconds(Long.MAX_VALUE))
                .build());

        for (int i = 0; i < 6; i++) {
            loop.tick();
            clock.advance(Duration.ofSeconds(31));
        }

        assertThat(prober.calls(API)).isEqualTo(6);
        assertThat(prober.calls(BACKUP)).isEqualTo(1);
    }

    @Test
    void tickListenersRunAfterEveryTick() {
        loop = newLoop(prober);
        store.register(config(API, 3));
        AtomicInteger ticks = new AtomicInteger();
        loop.addTickListener(ticks::incrementAndGet);
        loop.addTickListener(() -> {
            throw new IllegalStateException("listener bug");
        });

        loop.tick();
        loop.tick();

        assertThat(ticks.get()).isEqualTo(2);
    }

    @Test
    void startIsIdempotentAndStopEndsLoop() throws InterruptedException {
        loop = newLoop(prober);

        MonitorHandle first = loop.start();
        MonitorHandle second = loop.start();

        assertThat(second).isSameAs(first);
        assertThat(loop.isActive()).isTrue();

        first.stop();
        assertThat(first.awaitTermination(Duration.ofSeconds(5))).isTrue();
        assertThat(loop.isActive()).isFalse();

        MonitorHandle restarted = loop.start();
        assertThat(restarted).isNotSameAs(first);
        assertThat(loop.isActive()).isTrue();
    }

    @Test
    void startAfterShutdownIsRefused() {
        loop = newLoop(prober);
        loop.start();

        loop.shutdown();

        assertThat(loop.isActive()).isFalse();
        assertThatThrownBy(() -> loop.start())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("shut down");
    }

    private MonitorLoop newLoop(Prober prober) {
        MonitorSettings settings = new MonitorSettings(
                Duration.ofMillis(50), Duration.ofMillis(50), 4, Duration.ofMillis(100));
        return new MonitorLoop(store, new HealthStateMachine(), prober,
                new FailoverCoordinator(store, providerAdapter), alertLog, metrics, clock, settings);
    }

    private EndpointState state(String endpoint) {
        return store.find(endpoint).orElseThrow().getState();
    }

    private static HealthCheckConfig config(String endpoint, int failureThreshold) {
        return HealthCheckConfig.builder()
                .endpoint(endpoint)
                .pollInterval(Duration.ofSeconds(30))
                .timeout(Duration.ofSeconds(2))
                .failureThreshold(failureThreshold)
                .build();
    }

    /**
     * Replays queued outcomes per endpoint, then keeps answering with a healthy 200.
     */
    private static class ScriptedProber implements Prober {

        private final Map<String, Deque<ProbeOutcome>> scripts = new ConcurrentHashMap<>();
        private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

        synchronized void script(String endpoint, ProbeOutcome... outcomes) {
            scripts.computeIfAbsent(endpoint, e -> new ArrayDeque<>()).addAll(List.of(outcomes));
        }

        int calls(String endpoint) {
            AtomicInteger count = calls.get(endpoint);
            return count == null ? 0 : count.get();
        }

        @Override
        public ProbeOutcome probe(HealthCheckConfig config) {
            calls.computeIfAbsent(config.getEndpoint(), e -> new AtomicInteger()).incrementAndGet();
            synchronized (this) {
                Deque<ProbeOutcome> script = scripts.get(config.getEndpoint());
                if (script != null && !script.isEmpty()) {
                    return script.pollFirst();
                }
            }
            return ProbeOutcome.success(200, 10);
        }
    }
}
