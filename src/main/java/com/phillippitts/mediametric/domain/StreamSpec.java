package com.phillippitts.mediametric.domain;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of one source stream of an asset.
 *
 * @param path           source path
 * @param nativeGeometry native frame size; required for raw formats, may be null otherwise
 * @param format         native sample format
 * @param frameRange     optional frame sub-range (null for the whole stream)
 * @param filters        requested transcoder filters with their arguments
 * @param resampling     resampling algorithm used when scaling
 * @param callback       optional per-sample luma transform (null for none)
 */
public record StreamSpec(
        Path path,
        Geometry nativeGeometry,
        PixelFormat format,
        FrameRange frameRange,
        Map<FilterKey, String> filters,
        String resampling,
        FrameCallback callback
) {

    public static final String DEFAULT_RESAMPLING = "bicubic";

    public StreamSpec {
        Objects.requireNonNull(path, "Stream path must not be null");
        Objects.requireNonNull(format, "Stream format must not be null");
        if (format.isRaw() && nativeGeometry == null) {
            throw new IllegalArgumentException("Raw stream " + path + " requires a native geometry");
        }
        EnumMap<FilterKey, String> copy = new EnumMap<>(FilterKey.class);
        if (filters != null) {
            copy.putAll(filters);
        }
        filters = Collections.unmodifiableMap(copy);
        resampling = resampling == null || resampling.isBlank() ? DEFAULT_RESAMPLING : resampling;
    }

    /**
     * Convenience factory for a raw stream without filters, range or callback.
     */
    public static StreamSpec raw(Path path, Geometry geometry, PixelFormat format) {
        return new StreamSpec(path, geometry, format, null, Map.of(), null, null);
    }

    public boolean hasGeometricFilter() {
        return filters.keySet().stream().anyMatch(FilterKey::isGeometric);
    }

    public StreamSpec withFilter(FilterKey key, String argument) {
        EnumMap<FilterKey, String> copy = new EnumMap<>(FilterKey.class);
        copy.putAll(filters);
        copy.put(key, argument);
        return new StreamSpec(path, nativeGeometry, format, frameRange, copy, resampling, callback);
    }

    public StreamSpec withFrameRange(FrameRange range) {
        return new StreamSpec(path, nativeGeometry, format, range, filters, resampling, callback);
    }

    public StreamSpec withResampling(String algorithm) {
        return new StreamSpec(path, nativeGeometry, format, frameRange, filters, algorithm, callback);
    }

    public StreamSpec withCallback(FrameCallback cb) {
        return new StreamSpec(path, nativeGeometry, format, frameRange, filters, resampling, cb);
    }
}
