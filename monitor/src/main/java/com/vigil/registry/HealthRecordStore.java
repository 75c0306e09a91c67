package com.vigil.registry;

import com.vigil.control.HealthStateMachine;
import com.vigil.model.EndpointMonitor;
import com.vigil.model.EndpointSnapshot;
import com.vigil.model.EndpointState;
import com.vigil.model.HealthCheckConfig;
import com.vigil.model.ProbeOutcome;
import com.vigil.model.Transition;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Endpoint monitors keyed by normalized URL, in registration order. Readers only get snapshots.
 */
@Slf4j
public class HealthRecordStore {

    private final Map<String, EndpointMonitor> monitors = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final ReRegistrationPolicy reRegistrationPolicy;
    private long nextGeneration = 1;

    public HealthRecordStore(Clock clock, ReRegistrationPolicy reRegistrationPolicy) {
        this.clock = clock;
        this.reRegistrationPolicy = reRegistrationPolicy;
    }

    public EndpointSnapshot register(HealthCheckConfig config) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            long generation = nextGeneration++;
            EndpointMonitor existing = monitors.get(config.getEndpoint());
            if (existing != null) {
                existing.reconfigure(config, generation,
                        reRegistrationPolicy == ReRegistrationPolicy.PRESERVE_COUNTERS, now);
                log.info("Re-registered endpoint: {} (interval={}s, policy={})",
                        config.getEndpoint(), config.getPollInterval().toSeconds(), reRegistrationPolicy);
                return existing.toSnapshot();
            }

            EndpointMonitor monitor = new EndpointMonitor(config, generation, now);
            monitors.put(config.getEndpoint(), monitor);
            log.info("Registered endpoint: {} (interval={}s, timeout={}s, threshold={})",
                    config.getEndpoint(), config.getPollInterval().toSeconds(),
                    config.getTimeout().toSeconds(), config.getFailureThreshold());
            return monitor.toSnapshot();
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean unregister(String endpoint) {
        lock.writeLock().lock();
        try {
            EndpointMonitor removed = monitors.remove(endpoint);
            if (removed != null) {
                log.info("Unregistered endpoint: {}", endpoint);
                return true;
            }
            return false;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<DueProbe> dueForProbe(Instant now) {
        lock.readLock().lock();
        try {
            List<DueProbe> due = new ArrayList<>();
            for (EndpointMonitor monitor : monitors.values()) {
                if (monitor.isDue(now)) {
                    due.add(new DueProbe(monitor.getEndpoint(), monitor.getGeneration(), monitor.getConfig()));
                }
            }
            return due;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs the state machine for a finished probe and stores the result. Outcomes for an endpoint that
     * was removed or re-registered while the probe was in flight are dropped.
     */
    public Optional<AppliedTransition> applyOutcome(DueProbe probe, ProbeOutcome outcome,
                                                    HealthStateMachine stateMachine, Instant probedAt) {
        lock.writeLock().lock();
        try {
            EndpointMonitor monitor = monitors.get(probe.endpoint());
            if (monitor == null || monitor.getGeneration() != probe.generation()) {
                log.debug("Discarding stale probe outcome for {}", probe.endpoint());
                return Optional.empty();
            }

            EndpointState previous = monitor.getState();
            Transition transition = stateMachine.apply(
                    monitor.getConfig(), monitor.getConsecutiveFailures(), outcome);
            monitor.applyTransition(transition, probedAt);

            if (previous != transition.getState()) {
                log.info("Endpoint state transition: {}, {} -> {}",
                        probe.endpoint(), previous, transition.getState());
            }
            return Optional.of(new AppliedTransition(transition, monitor.toSnapshot()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<EndpointSnapshot> find(String endpoint) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(monitors.get(endpoint)).map(EndpointMonitor::toSnapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<EndpointSnapshot> snapshot() {
        lock.readLock().lock();
        try {
            return monitors.values().stream()
                    .map(EndpointMonitor::toSnapshot)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> healthyEndpointsExcept(String excluded) {
        lock.readLock().lock();
        try {
            return monitors.values().stream()
                    .filter(m -> m.getState() == EndpointState.HEALTHY)
                    .map(EndpointMonitor::getEndpoint)
                    .filter(endpoint -> !endpoint.equals(excluded))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return monitors.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public void clear() {
        lock.writeLock().lock();
        try {
            monitors.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }
}
