package com.phillippitts.mediametric.domain;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Per-sample transform applied to the luma plane of every frame of a stream.
 *
 * <p>Chroma planes always pass through unmodified. Samples are normalized floats in
 * {@code [0, 1]}; out-of-range results are clamped when written back.
 *
 * <p>The {@link #name()} participates in asset identity and optional-parameter
 * normalization, so two callbacks with different behaviour must have different names.
 */
public interface FrameCallback {

    /**
     * Stable, declared name of this callback.
     */
    String name();

    /**
     * Transforms one luma plane.
     *
     * @param luma   row-major normalized luma samples (may be modified in place)
     * @param width  plane width
     * @param height plane height
     * @return transformed plane of the same length
     */
    float[] apply(float[] luma, int width, int height);

    /**
     * Creates a named callback from a plane-wide function.
     */
    static FrameCallback named(String name, UnaryOperator<float[]> fn) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fn, "fn");
        return new FrameCallback() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public float[] apply(float[] luma, int width, int height) {
                return fn.apply(luma);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
