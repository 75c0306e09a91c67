package com.vigil.control;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Control token for one running monitor loop. Stopping is cooperative: the loop sees the flag at its
 * next tick boundary and never abandons a tick half way.
 */
public class MonitorHandle {

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CountDownLatch terminated = new CountDownLatch(1);

    public void stop() {
        if (stopRequested.compareAndSet(false, true)) {
            stopSignal.countDown();
        }
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public boolean isRunning() {
        return !stopRequested.get() && terminated.getCount() > 0;
    }

    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Waits between ticks. Returns early as soon as a stop is requested.
     */
    void pause(Duration interval) throws InterruptedException {
        stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS);
    }

    void markTerminated() {
        terminated.countDown();
    }
}
