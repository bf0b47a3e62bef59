package com.phillippitts.mediametric.service.stage;

import com.phillippitts.mediametric.exception.MediaMetricException;
import com.phillippitts.mediametric.exception.ResourceTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Producers started by the streaming stages of one run.
 *
 * <p>Not thread-safe; owned by the worker running the asset.
 */
public final class StageHandles {

    private static final Logger LOG = LogManager.getLogger(StageHandles.class);

    private record Producer(String label, Future<?> future, List<Path> pipes) {}

    private final List<Producer> producers = new ArrayList<>();
    private final PipeFactory pipeFactory;

    public StageHandles(PipeFactory pipeFactory) {
        this.pipeFactory = pipeFactory;
    }

    void add(String label, Future<?> future, List<Path> pipes) {
        producers.add(new Producer(label, future, List.copyOf(pipes)));
    }

    public boolean isEmpty() {
        return producers.isEmpty();
    }

    public int size() {
        return producers.size();
    }

    /**
     * Cause of the first producer that already finished with a failure, if any.
     */
    public Optional<Throwable> failedProducerCause() {
        for (Producer p : producers) {
            if (p.future().isDone() && !p.future().isCancelled()) {
                try {
                    p.future().get();
                } catch (ExecutionException e) {
                    return Optional.of(e.getCause());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return Optional.empty();
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Waits for every producer to finish and rethrows the first failure.
     *
     * @param timeout total time budget for all producers
     * @throws ResourceTimeoutException if producers are still running when the budget is spent
     */
    public void awaitProducers(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            for (Producer p : producers) {
                long remaining = Math.max(0, deadline - System.nanoTime());
                try {
                    p.future().get(remaining, TimeUnit.NANOSECONDS);
                } catch (ExecutionException e) {
                    throw unwrap(p.label(), e.getCause());
                } catch (TimeoutException e) {
                    throw new ResourceTimeoutException(p.pipes(), timeout.toMillis());
                } catch (CancellationException e) {
                    throw new MediaMetricException("Stage producer '" + p.label() + "' was cancelled", e);
                }
            }
            producers.clear();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaMetricException("Interrupted while waiting for stage producers", e);
        }
    }

    /**
     * Cancels every producer and unblocks anything waiting on their pipes. Best-effort.
     */
    public void abort() {
        for (Producer p : producers) {
            p.future().cancel(true);
        }
        for (Producer p : producers) {
            for (Path pipe : p.pipes()) {
                try {
                    pipeFactory.release(pipe);
                } catch (IOException e) {
                    LOG.warn("Could not release pipe {}: {}", pipe, e.toString());
                }
            }
        }
        producers.clear();
    }

    private static RuntimeException unwrap(String label, Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new MediaMetricException("Stage producer '" + label + "' failed: " + cause, cause);
    }
}
