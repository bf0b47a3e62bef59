package com.phillippitts.mediametric.exception;

/**
 * Base exception for all mediametric application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class MediaMetricException extends RuntimeException {

    public MediaMetricException(String message) {
        super(message);
    }

    public MediaMetricException(String message, Throwable cause) {
        super(message, cause);
    }

    public MediaMetricException(Throwable cause) {
        super(cause);
    }
}
