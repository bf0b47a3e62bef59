package com.phillippitts.mediametric.domain;

import com.phillippitts.mediametric.exception.ConfigurationException;

import java.util.Locale;

/**
 * Planar sample formats understood by the raw frame reader and writer.
 *
 * <p>{@link #NOT_RAW} marks a container or compressed source that must be transcoded before
 * its samples can be read.
 */
public enum PixelFormat {
    YUV420P("yuv420p", 8, 2, 2),
    YUV422P("yuv422p", 8, 2, 1),
    YUV444P("yuv444p", 8, 1, 1),
    YUV420P10LE("yuv420p10le", 10, 2, 2),
    YUV422P10LE("yuv422p10le", 10, 2, 1),
    YUV444P10LE("yuv444p10le", 10, 1, 1),
    NOT_RAW("notyuv", 0, 1, 1);

    private final String formatName;
    private final int bitDepth;
    private final int chromaSubsampleX;
    private final int chromaSubsampleY;

    PixelFormat(String formatName, int bitDepth, int chromaSubsampleX, int chromaSubsampleY) {
        this.formatName = formatName;
        this.bitDepth = bitDepth;
        this.chromaSubsampleX = chromaSubsampleX;
        this.chromaSubsampleY = chromaSubsampleY;
    }

    /**
     * Name as understood by the transcoder's {@code -pix_fmt} option.
     */
    public String formatName() {
        return formatName;
    }

    public boolean isRaw() {
        return this != NOT_RAW;
    }

    public int bitDepth() {
        return bitDepth;
    }

    public int bytesPerSample() {
        return bitDepth > 8 ? 2 : 1;
    }

    /**
     * Largest integer sample value, used for float normalization.
     */
    public int maxSampleValue() {
        return (1 << bitDepth) - 1;
    }

    public int chromaWidth(int width) {
        return (width + chromaSubsampleX - 1) / chromaSubsampleX;
    }

    public int chromaHeight(int height) {
        return (height + chromaSubsampleY - 1) / chromaSubsampleY;
    }

    /**
     * Number of bytes occupied by one frame (all three planes).
     */
    public long frameBytes(Geometry geometry) {
        requireRaw();
        long luma = (long) geometry.width() * geometry.height();
        long chroma = (long) chromaWidth(geometry.width()) * chromaHeight(geometry.height());
        return (luma + 2 * chroma) * bytesPerSample();
    }

    private void requireRaw() {
        if (!isRaw()) {
            throw new IllegalStateException("Format " + formatName + " has no raw sample layout");
        }
    }

    /**
     * Resolves a format by its transcoder name.
     *
     * @throws ConfigurationException if the name is unknown
     */
    public static PixelFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Pixel format must not be blank");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (PixelFormat f : values()) {
            if (f.formatName.equals(normalized)) {
                return f;
            }
        }
        throw new ConfigurationException("Unsupported pixel format: " + name);
    }
}
