package com.phillippitts.mediametric.service.stage;

import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.domain.StreamSpec;
import com.phillippitts.mediametric.domain.Topology;
import com.phillippitts.mediametric.exception.ConfigurationException;
import com.phillippitts.mediametric.identity.RunArtifacts;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which intermediate stages an asset needs. All methods are pure functions of the asset.
 */
public final class StagePlanner {

    /**
     * Resolves the workfile sample format.
     *
     * <p>An explicit override wins. Otherwise the first raw native format among the required
     * streams is used. When no required stream is raw the asset's default applies.
     */
    public PixelFormat resolveWorkfileFormat(Asset asset, Topology topology) {
        Optional<PixelFormat> override = asset.workfileFormatOverride();
        if (override.isPresent()) {
            return override.get();
        }
        for (StreamRole role : topology.roles()) {
            PixelFormat f = asset.stream(role).format();
            if (f.isRaw()) {
                return f;
            }
        }
        return Asset.DEFAULT_WORKFILE_FORMAT;
    }

    /**
     * Whether the transcode stage must run for {@code role}.
     */
    public boolean needsTranscode(Asset asset, StreamRole role) {
        StreamSpec stream = asset.stream(role);
        Geometry compute = asset.computeGeometry();
        if (!stream.format().isRaw()) {
            return true;
        }
        if (compute != null && !compute.equals(stream.nativeGeometry())) {
            return true;
        }
        if (stream.frameRange() != null) {
            return true;
        }
        Optional<PixelFormat> override = asset.workfileFormatOverride();
        if (override.isPresent() && override.get() != stream.format()) {
            return true;
        }
        return !stream.filters().isEmpty();
    }

    /**
     * Whether the sample-transform stage must run for {@code role}.
     */
    public boolean needsTransform(Asset asset, StreamRole role) {
        return asset.stream(role).callback() != null;
    }

    /**
     * Freezes every stage decision and effective path for one run of {@code executorId}.
     *
     * @throws ConfigurationException if a derived path would overwrite a source
     */
    public StageDecision plan(Asset asset, Topology topology, String executorId) {
        Map<StreamRole, StageDecision.RolePlan> plans = new EnumMap<>(StreamRole.class);
        for (StreamRole role : topology.roles()) {
            Path source = asset.stream(role).path();
            boolean transcode = needsTranscode(asset, role);
            boolean transform = needsTransform(asset, role);
            Path workfile = transcode ? RunArtifacts.workfilePath(asset, executorId, role) : source;
            Path procfile = transform ? RunArtifacts.procfilePath(asset, executorId, role) : workfile;
            if (transcode && sameFile(workfile, source)) {
                throw new ConfigurationException("Workfile of " + role.tag() + " stream would overwrite its source: "
                        + source);
            }
            if (transform && sameFile(procfile, workfile)) {
                throw new ConfigurationException("Procfile of " + role.tag() + " stream would overwrite its input: "
                        + workfile);
            }
            plans.put(role, new StageDecision.RolePlan(source, transcode, transform, workfile, procfile));
        }
        return new StageDecision(topology, asset.computeGeometry(), resolveWorkfileFormat(asset, topology),
                RunArtifacts.runDir(asset, executorId), plans);
    }

    private static boolean sameFile(Path a, Path b) {
        return a.toAbsolutePath().normalize().equals(b.toAbsolutePath().normalize());
    }
}
