package com.phillippitts.mediametric.service.io;

import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;

import java.util.Objects;

/**
 * One planar frame with samples normalized to {@code [0, 1]}.
 *
 * @param geometry luma plane size
 * @param format   sample layout the frame was read from or will be written as
 * @param y        luma plane, row-major
 * @param u        first chroma plane, row-major
 * @param v        second chroma plane, row-major
 */
public record RawFrame(Geometry geometry, PixelFormat format, float[] y, float[] u, float[] v) {

    public RawFrame {
        Objects.requireNonNull(geometry, "geometry");
        Objects.requireNonNull(format, "format");
        if (!format.isRaw()) {
            throw new IllegalArgumentException("Frames require a raw format, got: " + format.formatName());
        }
        int lumaSize = geometry.width() * geometry.height();
        int chromaSize = format.chromaWidth(geometry.width()) * format.chromaHeight(geometry.height());
        if (y.length != lumaSize || u.length != chromaSize || v.length != chromaSize) {
            throw new IllegalArgumentException("Plane sizes do not match " + geometry + " " + format.formatName());
        }
    }

    /**
     * Returns a frame with the luma plane replaced and chroma planes shared.
     */
    public RawFrame withLuma(float[] newLuma) {
        return new RawFrame(geometry, format, newLuma, u, v);
    }
}
