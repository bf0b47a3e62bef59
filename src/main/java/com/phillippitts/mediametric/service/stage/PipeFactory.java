package com.phillippitts.mediametric.service.stage;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Creates and releases named pipes used by streaming stages.
 */
public interface PipeFactory {

    /**
     * Creates a named pipe at {@code path}. The parent directory must exist.
     *
     * @throws com.phillippitts.mediametric.exception.MediaMetricException if creation fails
     */
    void create(Path path);

    /**
     * Whether pipes can be created on this host.
     */
    boolean isAvailable();

    /**
     * Short tool name for diagnostics.
     */
    String name();

    /**
     * Unblocks any reader or writer stuck opening the pipe at {@code path}.
     *
     * <p>Opening a FIFO read-write never blocks and satisfies a pending open on the other end;
     * closing it right away gives the blocked peer an immediate end of stream or broken pipe.
     * Does nothing when {@code path} is not present.
     */
    default void release(Path path) throws IOException {
        if (!Files.exists(path) || Files.isRegularFile(path)) {
            return;
        }
        try (RandomAccessFile ignored = new RandomAccessFile(path.toFile(), "rw")) {
            // open and close only
        }
    }
}
