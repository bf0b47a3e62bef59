package com.phillippitts.mediametric.exception;

/**
 * Thrown when an external tool required by an asset's pipeline (transcoder, mkfifo)
 * cannot be found or executed. This is a fatal error that aborts the whole batch.
 */
public class MissingDependencyException extends MediaMetricException {

    private final String tool;

    public MissingDependencyException(String tool, String detail) {
        super("Required tool '" + tool + "' is not available: " + detail);
        this.tool = tool;
    }

    public MissingDependencyException(String tool, String detail, Throwable cause) {
        super("Required tool '" + tool + "' is not available: " + detail, cause);
        this.tool = tool;
    }

    public String getTool() {
        return tool;
    }
}
