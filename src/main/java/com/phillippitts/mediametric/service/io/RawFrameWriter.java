package com.phillippitts.mediametric.service.io;

import com.phillippitts.mediametric.domain.PixelFormat;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Sequential writer of raw planar frames. Normalized samples are rounded and clamped to the
 * integer range of the target format.
 */
public final class RawFrameWriter implements Closeable {

    private final OutputStream out;
    private final PixelFormat format;
    private int framesWritten;

    public RawFrameWriter(OutputStream out, PixelFormat format) {
        this.out = new BufferedOutputStream(Objects.requireNonNull(out, "out"), 1 << 16);
        this.format = Objects.requireNonNull(format, "format");
        if (!format.isRaw()) {
            throw new IllegalArgumentException("Cannot write format " + format.formatName());
        }
    }

    /**
     * Opens {@code path} for writing, truncating a regular file. Opening a named pipe blocks
     * until a reader connects.
     */
    public static RawFrameWriter open(Path path, PixelFormat format) throws IOException {
        return new RawFrameWriter(Files.newOutputStream(path), format);
    }

    public void write(RawFrame frame) throws IOException {
        if (frame.format().chromaWidth(frame.geometry().width()) != format.chromaWidth(frame.geometry().width())
                || frame.format().chromaHeight(frame.geometry().height())
                != format.chromaHeight(frame.geometry().height())) {
            throw new IllegalArgumentException("Frame layout " + frame.format().formatName()
                    + " does not match writer format " + format.formatName());
        }
        encodePlane(frame.y());
        encodePlane(frame.u());
        encodePlane(frame.v());
        framesWritten++;
    }

    public int framesWritten() {
        return framesWritten;
    }

    private void encodePlane(float[] plane) throws IOException {
        int max = format.maxSampleValue();
        int bytesPerSample = format.bytesPerSample();
        byte[] bytes = new byte[plane.length * bytesPerSample];
        for (int i = 0; i < plane.length; i++) {
            int sample = Math.round(plane[i] * max);
            if (sample < 0) {
                sample = 0;
            } else if (sample > max) {
                sample = max;
            }
            if (bytesPerSample == 1) {
                bytes[i] = (byte) sample;
            } else {
                bytes[2 * i] = (byte) (sample & 0xFF);
                bytes[2 * i + 1] = (byte) (sample >>> 8);
            }
        }
        out.write(bytes);
    }

    public void flush() throws IOException {
        out.flush();
    }

    @Override
    public void close() throws IOException {
        out.close();
    }
}
