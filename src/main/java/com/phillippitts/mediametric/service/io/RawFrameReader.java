package com.phillippitts.mediametric.service.io;

import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;

import java.io.BufferedInputStream;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Sequential frame-at-a-time reader of raw planar samples from a file or named pipe.
 *
 * <p>Running out of data exactly on a frame boundary is the normal end of stream and is
 * reported as an empty {@link Optional}. A frame cut short is an {@link EOFException}.
 */
public final class RawFrameReader implements Closeable {

    private final InputStream in;
    private final Geometry geometry;
    private final PixelFormat format;
    private final byte[] buffer;
    private int framesRead;

    public RawFrameReader(InputStream in, Geometry geometry, PixelFormat format) {
        this.in = new BufferedInputStream(Objects.requireNonNull(in, "in"));
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        this.format = Objects.requireNonNull(format, "format");
        this.buffer = new byte[Math.toIntExact(format.frameBytes(geometry))];
    }

    /**
     * Opens {@code path} for reading. Opening a named pipe blocks until a writer connects.
     */
    public static RawFrameReader open(Path path, Geometry geometry, PixelFormat format) throws IOException {
        return new RawFrameReader(Files.newInputStream(path), geometry, format);
    }

    /**
     * Reads the next frame.
     *
     * @return the frame, or empty at end of stream
     * @throws EOFException if the stream ends inside a frame
     */
    public Optional<RawFrame> next() throws IOException {
        int filled = in.readNBytes(buffer, 0, buffer.length);
        if (filled == 0) {
            return Optional.empty();
        }
        if (filled < buffer.length) {
            throw new EOFException("Truncated frame " + framesRead + ": got " + filled + " of "
                    + buffer.length + " bytes");
        }
        int w = geometry.width();
        int h = geometry.height();
        int cw = format.chromaWidth(w);
        int ch = format.chromaHeight(h);
        int offset = 0;
        float[] y = new float[w * h];
        offset = decodePlane(offset, y);
        float[] u = new float[cw * ch];
        offset = decodePlane(offset, u);
        float[] v = new float[cw * ch];
        decodePlane(offset, v);
        framesRead++;
        return Optional.of(new RawFrame(geometry, format, y, u, v));
    }

    public int framesRead() {
        return framesRead;
    }

    private int decodePlane(int offset, float[] plane) {
        float scale = format.maxSampleValue();
        if (format.bytesPerSample() == 1) {
            for (int i = 0; i < plane.length; i++) {
                plane[i] = (buffer[offset + i] & 0xFF) / scale;
            }
            return offset + plane.length;
        }
        for (int i = 0; i < plane.length; i++) {
            int p = offset + 2 * i;
            int sample = (buffer[p] & 0xFF) | ((buffer[p + 1] & 0xFF) << 8);
            plane[i] = sample / scale;
        }
        return offset + 2 * plane.length;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
