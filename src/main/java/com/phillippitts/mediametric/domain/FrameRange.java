package com.phillippitts.mediametric.domain;

/**
 * Inclusive frame sub-range of a stream.
 *
 * @param start first frame index (0-based)
 * @param end   last frame index, inclusive
 */
public record FrameRange(int start, int end) {

    public FrameRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid frame range: " + start + ".." + end);
        }
    }

    public int frameCount() {
        return end - start + 1;
    }
}
