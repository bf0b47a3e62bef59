package com.phillippitts.mediametric.service.transcode;

import com.phillippitts.mediametric.domain.FilterKey;
import com.phillippitts.mediametric.domain.FrameRange;
import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.domain.StreamSpec;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Everything a transcoder needs to turn one source stream into raw planar samples.
 *
 * @param source         source path
 * @param sourceGeometry native size of a raw source; null for containers
 * @param sourceFormat   native sample format
 * @param frameRange     optional frame sub-range
 * @param filters        requested filters
 * @param targetGeometry compute geometry of the output
 * @param targetFormat   workfile sample format
 * @param resampling     scaler algorithm
 * @param destination    workfile path or named pipe
 */
public record TranscodeRequest(
        Path source,
        Geometry sourceGeometry,
        PixelFormat sourceFormat,
        FrameRange frameRange,
        Map<FilterKey, String> filters,
        Geometry targetGeometry,
        PixelFormat targetFormat,
        String resampling,
        Path destination
) {

    public TranscodeRequest {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sourceFormat, "sourceFormat");
        Objects.requireNonNull(targetGeometry, "targetGeometry");
        Objects.requireNonNull(targetFormat, "targetFormat");
        Objects.requireNonNull(destination, "destination");
        filters = filters == null ? Map.of() : filters;
    }

    /**
     * Builds the request for one stream of an asset.
     */
    public static TranscodeRequest forStream(StreamSpec stream, Geometry target, PixelFormat targetFormat,
                                             Path destination) {
        return new TranscodeRequest(stream.path(), stream.nativeGeometry(), stream.format(), stream.frameRange(),
                stream.filters(), target, targetFormat, stream.resampling(), destination);
    }
}
