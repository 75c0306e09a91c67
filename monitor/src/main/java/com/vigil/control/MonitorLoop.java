package com.vigil.control;

import com.vigil.metrics.SystemMetrics;
import com.vigil.model.Effect;
import com.vigil.model.EndpointSnapshot;
import com.vigil.model.ProbeOutcome;
import com.vigil.model.Transition;
import com.vigil.probe.Prober;
import com.vigil.registry.AlertLog;
import com.vigil.registry.AppliedTransition;
import com.vigil.registry.DueProbe;
import com.vigil.registry.HealthRecordStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * The single scheduler that drives health monitoring. A due probe may start up to one tick late.
 */
@Slf4j
public class MonitorLoop {

    private final HealthRecordStore store;
    private final HealthStateMachine stateMachine;
    private final Prober prober;
    private final FailoverCoordinator failoverCoordinator;
    private final AlertLog alertLog;
    private final SystemMetrics metrics;
    private final Clock clock;
    private final MonitorSettings settings;
    private final ExecutorService probeExecutor;
    private final List<TickListener> tickListeners = new CopyOnWriteArrayList<>();

    private MonitorHandle current;
    private boolean shutDown;

    public MonitorLoop(HealthRecordStore store, HealthStateMachine stateMachine, Prober prober,
                       FailoverCoordinator failoverCoordinator, AlertLog alertLog, SystemMetrics metrics,
                       Clock clock, MonitorSettings settings) {
        this.store = store;
        this.stateMachine = stateMachine;
        this.prober = prober;
        this.failoverCoordinator = failoverCoordinator;
        this.alertLog = alertLog;
        this.metrics = metrics;
        this.clock = clock;
        this.settings = settings;
        this.probeExecutor = Executors.newFixedThreadPool(settings.probeParallelism(), daemonThreads("vigil-probe-"));
    }

    /**
     * Starts the loop unless one is already running, in which case its handle is returned.
     *
     * @throws IllegalStateException once {@link #shutdown()} has released the probe pool
     */
    public synchronized MonitorHandle start() {
        if (shutDown) {
            throw new IllegalStateException("Monitor loop has been shut down");
        }
        if (current != null && current.isRunning()) {
            return current;
        }

        MonitorHandle handle = new MonitorHandle();
        Thread thread = new Thread(() -> run(handle), "vigil-monitor");
        thread.setDaemon(true);
        current = handle;
        thread.start();

        log.info("Health monitoring loop started (tick={}ms, idle={}ms, parallelism={})",
                settings.tickInterval().toMillis(), settings.idleInterval().toMillis(), settings.probeParallelism());
        return handle;
    }

    public synchronized boolean isActive() {
        return current != null && current.isRunning();
    }

    public void addTickListener(TickListener listener) {
        tickListeners.add(listener);
    }

    /**
     * Stops the running loop, waits briefly for it to finish and releases the probe pool.
     */
    public void shutdown() {
        MonitorHandle handle;
        synchronized (this) {
            shutDown = true;
            handle = current;
        }
        if (handle != null) {
            handle.stop();
            try {
                if (!handle.awaitTermination(settings.tickInterval().plus(Duration.ofSeconds(5)))) {
                    log.warn("Monitor loop did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        probeExecutor.shutdownNow();
    }

    /**
     * Runs one pass over all registered endpoints.
     *
     * @return false if no endpoint was registered, so the caller can back off
     */
    public boolean tick() {
        if (store.isEmpty()) {
            return false;
        }

        Instant now = clock.instant();
        List<DueProbe> due = store.dueForProbe(now);

        if (!due.isEmpty()) {
            List<InflightProbe> inflight = new ArrayList<>(due.size());
            for (DueProbe probe : due) {
                inflight.add(new InflightProbe(probe,
                        CompletableFuture.supplyAsync(() -> prober.probe(probe.config()), probeExecutor)));
            }

            for (InflightProbe probe : inflight) {
                try {
                    ProbeOutcome outcome = await(probe);
                    if (outcome != null) {
                        handleOutcome(probe.probe(), outcome, now);
                    }
                } catch (RuntimeException e) {
                    log.error("Failed to process probe result for {}", probe.probe().endpoint(), e);
                }
            }
            log.debug("Monitor tick probed {} endpoints", due.size());
        }

        notifyListeners();
        return true;
    }

    private void run(MonitorHandle handle) {
        log.info("Starting health monitoring loop");
        try {
            while (!handle.isStopRequested()) {
                boolean hadEndpoints;
                try {
                    hadEndpoints = tick();
                } catch (RuntimeException e) {
                    log.error("Monitor tick failed", e);
                    hadEndpoints = true;
                }
                handle.pause(hadEndpoints ? settings.tickInterval() : settings.idleInterval());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Health monitoring loop interrupted");
        } finally {
            handle.markTerminated();
            log.info("Health monitoring loop stopped");
        }
    }

    private ProbeOutcome await(InflightProbe inflight) {
        DueProbe probe = inflight.probe();
        long budgetMs = probe.config().getTimeout().plus(settings.probeGrace()).toMillis();
        try {
            return inflight.outcome().get(budgetMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            inflight.outcome().cancel(true);
            log.warn("Probe for {} exceeded {}ms, counting as timeout", probe.endpoint(), budgetMs);
            return ProbeOutcome.timeout();
        } catch (ExecutionException e) {
            log.error("Prober failed for {}", probe.endpoint(), e.getCause());
            return null;
        } catch (InterruptedException e) {
            inflight.outcome().cancel(true);
            Thread.currentThread().interrupt();
            return null;
        }
    }

    private void handleOutcome(DueProbe probe, ProbeOutcome outcome, Instant probedAt) {
        store.applyOutcome(probe, outcome, stateMachine, probedAt).ifPresent(applied -> {
            metrics.recordProbe(applied.transition().isSuccess());
            executeEffects(applied);
        });
    }

    private void executeEffects(AppliedTransition applied) {
        Transition transition = applied.transition();
        EndpointSnapshot endpoint = applied.snapshot();

        if (!transition.hasEffect(Effect.RAISE_ALERT) && !transition.hasEffect(Effect.TRIGGER_FAILOVER)) {
            return;
        }

        log.error("ALERT: Endpoint {} is {} - {} consecutive failures ({})",
                endpoint.getEndpoint(), endpoint.getState(), endpoint.getConsecutiveFailures(), endpoint.getLastError());

        boolean failoverSuccess = transition.hasEffect(Effect.TRIGGER_FAILOVER)
                && failoverCoordinator.failover(endpoint.getEndpoint());

        if (transition.hasEffect(Effect.RAISE_ALERT)) {
            alertLog.record(endpoint, failoverSuccess);
        }
    }

    private void notifyListeners() {
        for (TickListener listener : tickListeners) {
            try {
                listener.onTick();
            } catch (RuntimeException e) {
                log.warn("Tick listener failed: {}", e.getMessage());
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record InflightProbe(DueProbe probe, CompletableFuture<ProbeOutcome> outcome) {}
}
