package com.phillippitts.mediametric.service.stage;

import com.phillippitts.mediametric.domain.FrameCallback;
import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.service.io.RawFrame;
import com.phillippitts.mediametric.service.io.RawFrameReader;
import com.phillippitts.mediametric.service.io.RawFrameWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Per-sample transform stage: applies a callback to the luma plane of every frame.
 *
 * <p>Chroma passes through unmodified. Upstream end of stream ends the stage normally.
 */
public final class SampleTransformStage {

    private static final Logger LOG = LogManager.getLogger(SampleTransformStage.class);

    /**
     * Streams {@code input} to {@code output} through {@code callback}.
     *
     * @return number of frames written
     */
    public int run(Path input, Path output, Geometry geometry, PixelFormat format, FrameCallback callback)
            throws IOException {
        int frames = 0;
        try (RawFrameReader reader = RawFrameReader.open(input, geometry, format);
             RawFrameWriter writer = RawFrameWriter.open(output, format)) {
            Optional<RawFrame> next;
            while ((next = reader.next()).isPresent()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedIOException("Sample transform interrupted after " + frames + " frames");
                }
                writer.write(transform(next.get(), callback));
                frames++;
            }
            writer.flush();
        }
        LOG.debug("Transformed {} frames with '{}' into {}", frames, callback.name(), output.getFileName());
        return frames;
    }

    static RawFrame transform(RawFrame frame, FrameCallback callback) {
        int w = frame.geometry().width();
        int h = frame.geometry().height();
        float[] luma = callback.apply(frame.y(), w, h);
        if (luma == null || luma.length != frame.y().length) {
            throw new IllegalStateException("Callback '" + callback.name() + "' returned a plane of the wrong size");
        }
        return frame.withLuma(luma);
    }
}
