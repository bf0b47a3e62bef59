package com.phillippitts.mediametric.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and worker management.
 *
 * @see com.phillippitts.mediametric.service.process.ProcessRunner
 */
public final class ProcessTimeouts {

    /**
     * Time given to stream gobbler threads to flush buffered output after the process exits.
     */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /**
     * Time given to gobbler threads during best-effort cleanup. They are daemon threads.
     */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /**
     * Upper bound for short helper tools such as {@code mkfifo}.
     */
    public static final Duration HELPER_TOOL_TIMEOUT = Duration.ofSeconds(10);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
