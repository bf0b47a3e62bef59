package com.phillippitts.mediametric.exception;

import java.nio.file.Path;
import java.util.List;

/**
 * Thrown when a streaming stage's named pipe(s) did not appear within the bounded poll.
 */
public class ResourceTimeoutException extends MediaMetricException {

    private final List<Path> missing;
    private final long waitedMs;

    public ResourceTimeoutException(List<Path> missing, long waitedMs) {
        super("Stage pipe(s) " + missing + " missing after waiting " + waitedMs + " ms");
        this.missing = List.copyOf(missing);
        this.waitedMs = waitedMs;
    }

    public List<Path> getMissing() {
        return missing;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
