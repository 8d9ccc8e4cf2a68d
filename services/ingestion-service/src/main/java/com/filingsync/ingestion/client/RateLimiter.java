package com.filingsync.ingestion.client;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Gate in front of every outbound portal request. A caller is let through once a concurrency
 * slot is free and the minimum interval since the previous admission has elapsed. Requests are
 * only ever delayed, never rejected.
 */
public class RateLimiter {

    private final Semaphore inFlight;
    private final int maxConcurrent;
    private final long minIntervalNanos;
    private final Object intervalLock = new Object();
    private long nextAllowedNanos;

    public RateLimiter(int maxConcurrent, Duration minInterval) {
        if (maxConcurrent <= 0) {
            throw new IllegalArgumentException("maxConcurrent must be positive: " + maxConcurrent);
        }
        if (minInterval == null || minInterval.isNegative()) {
            throw new IllegalArgumentException("minInterval must not be negative");
        }
        this.maxConcurrent = maxConcurrent;
        this.inFlight = new Semaphore(maxConcurrent, true);
        this.minIntervalNanos = minInterval.toNanos();
        this.nextAllowedNanos = System.nanoTime();
    }

    /**
     * Blocks until the next request may be issued. The returned permit must be closed once the
     * request has finished.
     */
    public Permit acquire() throws InterruptedException {
        inFlight.acquire();
        try {
            awaitInterval();
        } catch (InterruptedException e) {
            inFlight.release();
            throw e;
        }
        return new Permit();
    }

    public int inFlight() {
        return maxConcurrent - inFlight.availablePermits();
    }

    private void awaitInterval() throws InterruptedException {
        synchronized (intervalLock) {
            long waitNanos = nextAllowedNanos - System.nanoTime();
            if (waitNanos > 0) {
                TimeUnit.NANOSECONDS.sleep(waitNanos);
            }
            nextAllowedNanos = System.nanoTime() + minIntervalNanos;
        }
    }

    public final class Permit implements AutoCloseable {

        private final AtomicBoolean released = new AtomicBoolean(false);

        private Permit() {
        }

        @Override
        public void close() {
            if (released.compareAndSet(false, true)) {
                inFlight.release();
            }
        }
    }
}
