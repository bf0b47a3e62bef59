package com.phillippitts.mediametric.exception;

/**
 * Thrown by a computation plugin when it fails to produce its raw score artifact.
 */
public class ComputeException extends MediaMetricException {

    private final String executorId;

    public ComputeException(String message, String executorId) {
        super(message + " (executor: " + executorId + ")");
        this.executorId = executorId;
    }

    public ComputeException(String message, String executorId, Throwable cause) {
        super(message + " (executor: " + executorId + ")", cause);
        this.executorId = executorId;
    }

    public String getExecutorId() {
        return executorId;
    }
}
