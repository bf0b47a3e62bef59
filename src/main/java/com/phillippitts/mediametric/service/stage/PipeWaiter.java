package com.phillippitts.mediametric.service.stage;

import com.phillippitts.mediametric.exception.MediaMetricException;
import com.phillippitts.mediametric.exception.ResourceTimeoutException;
import com.phillippitts.mediametric.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Bounded poll for the pipes of a streaming stage to appear.
 */
public final class PipeWaiter {

    private static final Logger LOG = LogManager.getLogger(PipeWaiter.class);

    private final int retries;
    private final Duration interval;

    public PipeWaiter(int retries, Duration interval) {
        if (retries < 1) {
            throw new IllegalArgumentException("retries must be >= 1, got: " + retries);
        }
        this.retries = retries;
        this.interval = interval;
    }

    /**
     * Blocks until every path exists.
     *
     * @throws ResourceTimeoutException when some path is still missing after the last retry
     */
    public void awaitAll(Collection<Path> paths) {
        long start = System.nanoTime();
        List<Path> missing = missing(paths);
        for (int attempt = 0; attempt < retries && !missing.isEmpty(); attempt++) {
            sleep();
            missing = missing(paths);
        }
        if (!missing.isEmpty()) {
            throw new ResourceTimeoutException(missing, TimeUtils.elapsedMillis(start));
        }
        LOG.debug("Pipes ready after {} ms: {}", TimeUtils.elapsedMillis(start), paths);
    }

    private static List<Path> missing(Collection<Path> paths) {
        List<Path> result = new ArrayList<>();
        for (Path p : paths) {
            if (!Files.exists(p)) {
                result.add(p);
            }
        }
        return result;
    }

    private void sleep() {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MediaMetricException("Interrupted while waiting for pipes", e);
        }
    }
}
