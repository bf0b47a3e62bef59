package com.phillippitts.mediametric.exception;

/**
 * Thrown when an asset or runner configuration is structurally invalid
 * (unknown compute geometry, mismatched sample formats, missing explicit geometry
 * for crop/pad filters, incompatible runner options).
 *
 * <p>Always raised before any file, pipe or process is touched for the offending asset.
 */
public class ConfigurationException extends MediaMetricException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
