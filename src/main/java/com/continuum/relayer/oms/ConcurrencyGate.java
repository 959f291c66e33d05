package com.continuum.relayer.oms;

import java.util.concurrent.Semaphore;

/**
 * Bounds the number of execution attempts in flight. Non-blocking: the engine checks the gate
 * before dequeuing so that a full gate never costs the head of the queue its position.
 */
public class ConcurrencyGate {

    private final int limit;
    private final Semaphore permits;

    public ConcurrencyGate(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Concurrency limit must be at least 1, got " + limit);
        }
        this.limit = limit;
        this.permits = new Semaphore(limit);
    }

    public boolean tryAcquire() {
        return permits.tryAcquire();
    }

    /** Returns a permit. Releasing more permits than were acquired is a bug and is rejected. */
    public void release() {
        synchronized (permits) {
            if (permits.availablePermits() >= limit) {
                throw new IllegalStateException("ConcurrencyGate released without a held permit");
            }
            permits.release();
        }
    }

    public int limit() {
        return limit;
    }

    public int inUse() {
        return limit - permits.availablePermits();
    }
}
