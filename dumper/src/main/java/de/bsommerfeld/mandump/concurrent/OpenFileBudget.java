package de.bsommerfeld.mandump.concurrent;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Weighted admission control over open file handles.
 *
 * <p>Every package worker holds {@link #PACKAGE_WEIGHT} units while it runs: one for the
 * package archive and one for the output file it may be writing. Acquisition is fair, so a
 * waiting worker is not overtaken by later ones, and polls its {@link Cancellation} so a
 * failed run does not leave producers parked on the semaphore.
 */
public final class OpenFileBudget {

    /** Units held by one package worker. */
    public static final int PACKAGE_WEIGHT = 2;

    private static final long POLL_MILLIS = 50;

    private final int capacity;
    private final Semaphore semaphore;

    public OpenFileBudget(int capacity) {
        if (capacity < PACKAGE_WEIGHT) {
            throw new IllegalArgumentException("capacity must be >= " + PACKAGE_WEIGHT + ": " + capacity);
        }
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity, true);
    }

    /**
     * Blocks until {@code units} are available or the run is cancelled.
     *
     * @throws java.util.concurrent.CancellationException if {@code cancellation} is raised
     *                                                    while waiting
     */
    public void acquire(int units, Cancellation cancellation) throws InterruptedException {
        if (units > capacity) {
            throw new IllegalArgumentException("cannot acquire " + units + " of " + capacity + " units");
        }
        while (!semaphore.tryAcquire(units, POLL_MILLIS, TimeUnit.MILLISECONDS)) {
            cancellation.throwIfCancelled();
        }
        if (cancellation.isCancelled()) {
            semaphore.release(units);
            cancellation.throwIfCancelled();
        }
    }

    public void release(int units) {
        semaphore.release(units);
    }

    public int capacity() {
        return capacity;
    }

    public int available() {
        return semaphore.availablePermits();
    }
}
