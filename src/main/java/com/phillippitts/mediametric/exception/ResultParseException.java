package com.phillippitts.mediametric.exception;

import java.nio.file.Path;

/**
 * Thrown by a computation plugin when its raw score artifact cannot be parsed into a Result.
 */
public class ResultParseException extends MediaMetricException {

    private final Path artifact;

    public ResultParseException(String message, Path artifact) {
        super(message + " (artifact: " + artifact + ")");
        this.artifact = artifact;
    }

    public ResultParseException(String message, Path artifact, Throwable cause) {
        super(message + " (artifact: " + artifact + ")", cause);
        this.artifact = artifact;
    }

    public Path getArtifact() {
        return artifact;
    }
}
