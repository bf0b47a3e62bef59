package com.phillippitts.mediametric.domain;

import com.phillippitts.mediametric.util.Hashing;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable description of one unit of work: one or two source streams plus processing options.
 *
 * <p>The canonical string form ({@link #toString()}) identifies the asset for caching and
 * locking. Two assets with the same canonical form are interchangeable: they share a cache
 * entry, a private working directory and a scheduler lock.
 *
 * <p>Each computation run on the asset gets its own subdirectory of the working directory
 * (see {@code RunArtifacts}); whether a stage actually writes there is decided per run, never
 * stored here.
 */
public final class Asset {

    /**
     * Workfile format used when neither an override nor a raw native format is available.
     */
    public static final PixelFormat DEFAULT_WORKFILE_FORMAT = PixelFormat.YUV420P;

    private final String dataset;
    private final int contentId;
    private final int assetId;
    private final Map<StreamRole, StreamSpec> streams;
    private final Geometry explicitComputeGeometry;
    private final PixelFormat workfileFormatOverride;
    private final String canonical;
    private final String fingerprint;
    private final Path workdir;

    private Asset(Builder builder) {
        this.dataset = builder.dataset;
        this.contentId = builder.contentId;
        this.assetId = builder.assetId;
        EnumMap<StreamRole, StreamSpec> copy = new EnumMap<>(StreamRole.class);
        copy.putAll(builder.streams);
        this.streams = Collections.unmodifiableMap(copy);
        this.explicitComputeGeometry = builder.computeGeometry;
        this.workfileFormatOverride = builder.workfileFormat;
        this.canonical = buildCanonical();
        this.fingerprint = Hashing.sha1Hex(canonical);
        if (builder.workdir != null) {
            this.workdir = builder.workdir;
        } else {
            Path root = builder.workdirRoot != null
                    ? builder.workdirRoot
                    : Path.of(System.getProperty("java.io.tmpdir"), "mediametric");
            this.workdir = root.resolve(fingerprint);
        }
    }

    public static Builder builder(String dataset, int contentId, int assetId) {
        return new Builder(dataset, contentId, assetId);
    }

    public String dataset() {
        return dataset;
    }

    public int contentId() {
        return contentId;
    }

    public int assetId() {
        return assetId;
    }

    public boolean hasStream(StreamRole role) {
        return streams.containsKey(role);
    }

    public Set<StreamRole> roles() {
        return streams.keySet();
    }

    /**
     * Returns the stream declared for {@code role}.
     *
     * @throws IllegalArgumentException if the asset has no stream for that role
     */
    public StreamSpec stream(StreamRole role) {
        StreamSpec spec = streams.get(role);
        if (spec == null) {
            throw new IllegalArgumentException("Asset " + canonical + " has no " + role.tag() + " stream");
        }
        return spec;
    }

    /**
     * Compute geometry: the explicit value when set, otherwise the native geometry shared by
     * every stream. Returns {@code null} when neither is known.
     */
    public Geometry computeGeometry() {
        if (explicitComputeGeometry != null) {
            return explicitComputeGeometry;
        }
        Geometry shared = null;
        for (StreamSpec spec : streams.values()) {
            Geometry g = spec.nativeGeometry();
            if (g == null) {
                return null;
            }
            if (shared != null && !shared.equals(g)) {
                return null;
            }
            shared = g;
        }
        return shared;
    }

    public boolean isComputeGeometryExplicit() {
        return explicitComputeGeometry != null;
    }

    public Optional<PixelFormat> workfileFormatOverride() {
        return Optional.ofNullable(workfileFormatOverride);
    }

    /**
     * Private working directory of this asset.
     */
    public Path workdir() {
        return workdir;
    }

    /**
     * Hex SHA-1 of the canonical string form.
     */
    public String fingerprint() {
        return fingerprint;
    }

    private String buildCanonical() {
        StringBuilder sb = new StringBuilder();
        sb.append(dataset).append('_').append(contentId).append('_').append(assetId);
        String sep = "_";
        for (Map.Entry<StreamRole, StreamSpec> e : streams.entrySet()) {
            StreamSpec spec = e.getValue();
            sb.append(sep).append(spec.path().toAbsolutePath().normalize());
            sb.append('_').append(spec.nativeGeometry() != null ? spec.nativeGeometry() : spec.format().formatName());
            sep = "_vs_";
        }
        Geometry q = computeGeometry();
        sb.append("_q_").append(q != null ? q.toString() : "unknown");
        for (Map.Entry<StreamRole, StreamSpec> e : streams.entrySet()) {
            appendStreamOptions(sb, e.getKey().tag(), e.getValue());
        }
        if (workfileFormatOverride != null) {
            sb.append("_wf").append(workfileFormatOverride.formatName());
        }
        return sb.toString();
    }

    private static void appendStreamOptions(StringBuilder sb, String tag, StreamSpec spec) {
        if (spec.nativeGeometry() != null && spec.format().isRaw()) {
            sb.append('_').append(tag).append(spec.format().formatName());
        }
        for (Map.Entry<FilterKey, String> f : spec.filters().entrySet()) {
            sb.append('_').append(tag).append(f.getKey().filterName()).append(f.getValue());
        }
        if (spec.frameRange() != null) {
            sb.append('_').append(tag).append(spec.frameRange().start()).append("to").append(spec.frameRange().end());
        }
        if (!StreamSpec.DEFAULT_RESAMPLING.equals(spec.resampling())) {
            sb.append('_').append(tag).append("rs").append(spec.resampling());
        }
        if (spec.callback() != null) {
            sb.append('_').append(tag).append("cb").append(spec.callback().name());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Asset other)) {
            return false;
        }
        return canonical.equals(other.canonical) && workdir.equals(other.workdir);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonical, workdir);
    }

    /**
     * Canonical string form.
     */
    @Override
    public String toString() {
        return canonical;
    }

    /**
     * Builder for {@link Asset}. A distorted stream is mandatory; the reference stream is
     * omitted for no-reference computations.
     */
    public static final class Builder {
        private final String dataset;
        private final int contentId;
        private final int assetId;
        private final Map<StreamRole, StreamSpec> streams = new EnumMap<>(StreamRole.class);
        private Geometry computeGeometry;
        private PixelFormat workfileFormat;
        private Path workdir;
        private Path workdirRoot;

        private Builder(String dataset, int contentId, int assetId) {
            if (dataset == null || dataset.isBlank()) {
                throw new IllegalArgumentException("Dataset must not be blank");
            }
            this.dataset = dataset;
            this.contentId = contentId;
            this.assetId = assetId;
        }

        public Builder reference(StreamSpec spec) {
            streams.put(StreamRole.REFERENCE, Objects.requireNonNull(spec, "reference"));
            return this;
        }

        public Builder distorted(StreamSpec spec) {
            streams.put(StreamRole.DISTORTED, Objects.requireNonNull(spec, "distorted"));
            return this;
        }

        public Builder computeGeometry(Geometry geometry) {
            this.computeGeometry = geometry;
            return this;
        }

        public Builder workfileFormat(PixelFormat format) {
            if (format != null && !format.isRaw()) {
                throw new IllegalArgumentException("Workfile format must be a raw format, got: " + format.formatName());
            }
            this.workfileFormat = format;
            return this;
        }

        /**
         * Uses {@code dir} as the private working directory verbatim.
         */
        public Builder workdir(Path dir) {
            this.workdir = dir;
            return this;
        }

        /**
         * Places the private working directory under {@code root}, named by the asset fingerprint.
         */
        public Builder workdirRoot(Path root) {
            this.workdirRoot = root;
            return this;
        }

        public Asset build() {
            if (!streams.containsKey(StreamRole.DISTORTED)) {
                throw new IllegalStateException("Asset requires a distorted stream");
            }
            return new Asset(this);
        }
    }
}
