package com.phillippitts.mediametric.exception;

/**
 * Thrown when an external process (transcoder, mkfifo) fails to start, times out
 * or exits with a non-zero status.
 */
public class ExternalProcessException extends MediaMetricException {

    private final String tool;
    private final int exitCode;

    public ExternalProcessException(String message, String tool, int exitCode) {
        super(message + " (tool: " + tool + ")");
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public ExternalProcessException(String message, String tool, int exitCode, Throwable cause) {
        super(message + " (tool: " + tool + ")", cause);
        this.tool = tool;
        this.exitCode = exitCode;
    }

    public String getTool() {
        return tool;
    }

    /**
     * @return the process exit code, or -1 when the process never exited normally
     */
    public int getExitCode() {
        return exitCode;
    }
}
