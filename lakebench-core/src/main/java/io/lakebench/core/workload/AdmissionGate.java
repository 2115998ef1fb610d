package io.lakebench.core.workload;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counting gate bounding how many executions are past the admission point at once.
 * Tracks the current and the highest observed number of admitted executions.
 */
public class AdmissionGate {

    private final int capacity;
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicInteger peak = new AtomicInteger(0);

    public AdmissionGate(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Capacity must be at least 1");
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Wait up to the given time for a free slot.
     *
     * @return true if admitted, in which case {@link #release()} must follow
     */
    public boolean tryAdmit(long timeout, TimeUnit unit) throws InterruptedException {
        if (!permits.tryAcquire(timeout, unit)) {
            return false;
        }
        int current = inFlight.incrementAndGet();
        peak.accumulateAndGet(current, Math::max);
        return true;
    }

    public void release() {
        inFlight.decrementAndGet();
        permits.release();
    }

    public int capacity() {
        return capacity;
    }

    public int inFlight() {
        return inFlight.get();
    }

    public int peakInFlight() {
        return peak.get();
    }
}
