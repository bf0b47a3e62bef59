package com.phillippitts.mediametric.service.stage;

import com.phillippitts.mediametric.exception.MediaMetricException;

import java.util.concurrent.Semaphore;

/**
 * Bounds the number of streaming stage producers alive across all workers.
 *
 * <p>A worker reserves every producer its run needs before the first one starts and holds
 * the reservation until the run is cleaned up. A worker that finds the slots taken waits
 * for another run to finish instead of having its producers rejected by the stage executor.
 * Reserving all producers of a run at once keeps two half-started runs from waiting on
 * each other.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe. The semaphore is fair so a run needing
 * four slots is not starved by runs needing fewer.
 */
public final class StageSlots {

    /** Two roles, each with a transcode and a transform producer. */
    public static final int MAX_PRODUCERS_PER_RUN = 4;

    private static final Reservation NONE = () -> { };

    private final Semaphore semaphore;
    private final int capacity;

    /**
     * @param capacity number of producers that may run at once; at least
     *        {@link #MAX_PRODUCERS_PER_RUN} so any single run can proceed
     */
    public StageSlots(int capacity) {
        if (capacity < MAX_PRODUCERS_PER_RUN) {
            throw new IllegalArgumentException("Stage slot capacity must be at least "
                    + MAX_PRODUCERS_PER_RUN + ", got " + capacity);
        }
        this.capacity = capacity;
        this.semaphore = new Semaphore(capacity, true);
    }

    /**
     * Slots that never block, for callers whose stage executor is unbounded.
     */
    public static StageSlots unbounded() {
        return new StageSlots(Integer.MAX_VALUE);
    }

    public int capacity() {
        return capacity;
    }

    public int availableSlots() {
        return semaphore.availablePermits();
    }

    /**
     * Blocks until {@code producers} slots are free and takes them together.
     *
     * @throws MediaMetricException if the thread is interrupted while waiting
     */
    public Reservation reserve(int producers) {
        if (producers <= 0) {
            return NONE;
        }
        try {
            semaphore.acquire(producers);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaMetricException("Interrupted while waiting for " + producers + " stage slots", e);
        }
        return new Held(producers);
    }

    /** Slots held by one run. Closing returns them; closing twice is a no-op. */
    public interface Reservation extends AutoCloseable {
        @Override
        void close();
    }

    private final class Held implements Reservation {
        private final int producers;
        private boolean released;

        private Held(int producers) {
            this.producers = producers;
        }

        @Override
        public synchronized void close() {
            if (!released) {
                released = true;
                semaphore.release(producers);
            }
        }
    }
}
