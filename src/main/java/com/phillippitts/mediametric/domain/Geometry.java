package com.phillippitts.mediametric.domain;

/**
 * Frame width and height in pixels.
 *
 * @param width  frame width, must be positive
 * @param height frame height, must be positive
 */
public record Geometry(int width, int height) {

    public Geometry {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Geometry must be positive, got: " + width + "x" + height);
        }
    }

    public static Geometry of(int width, int height) {
        return new Geometry(width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
