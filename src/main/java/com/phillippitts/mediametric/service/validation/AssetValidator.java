package com.phillippitts.mediametric.service.validation;

import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.domain.StreamSpec;
import com.phillippitts.mediametric.domain.Topology;
import com.phillippitts.mediametric.exception.ConfigurationException;
import com.phillippitts.mediametric.exception.MissingDependencyException;
import com.phillippitts.mediametric.service.stage.PipeFactory;
import com.phillippitts.mediametric.service.stage.StagePlanner;
import com.phillippitts.mediametric.service.transcode.Transcoder;

import java.nio.file.Files;
import java.util.Objects;

/**
 * Structural and environmental preconditions of an asset, checked before any resource is touched.
 *
 * <p>Only the roles of the given {@link Topology} are inspected. {@link #validate} looks at the
 * descriptor and the installed tools only; {@link #validateSources} touches the filesystem.
 */
public class AssetValidator {

    private final StagePlanner planner;
    private final Transcoder transcoder;
    private final PipeFactory pipeFactory;
    private final ExecutionProperties execution;

    public AssetValidator(StagePlanner planner, Transcoder transcoder, PipeFactory pipeFactory,
                          ExecutionProperties execution) {
        this.planner = Objects.requireNonNull(planner, "planner");
        this.transcoder = Objects.requireNonNull(transcoder, "transcoder");
        this.pipeFactory = Objects.requireNonNull(pipeFactory, "pipeFactory");
        this.execution = Objects.requireNonNull(execution, "execution");
    }

    /**
     * Validates one asset.
     *
     * @throws ConfigurationException     when the asset cannot be processed as described
     * @throws MissingDependencyException when a required external tool is unavailable
     */
    public void validate(Asset asset, Topology topology) {
        validateStructure(asset, topology);
        validateDependencies(asset, topology);
    }

    /**
     * Checks that every required source exists. Only a cache miss needs the sources, so this
     * runs per asset inside the pipeline rather than for the whole batch.
     *
     * @throws ConfigurationException when a source is missing
     */
    public void validateSources(Asset asset, Topology topology) {
        for (StreamRole role : topology.roles()) {
            StreamSpec stream = asset.stream(role);
            if (!Files.exists(stream.path())) {
                throw new ConfigurationException("Source of the " + role.tag() + " stream does not exist: "
                        + stream.path());
            }
        }
    }

    void validateStructure(Asset asset, Topology topology) {
        for (StreamRole role : topology.roles()) {
            if (!asset.hasStream(role)) {
                throw new ConfigurationException("Asset " + asset + " lacks the " + role.tag()
                        + " stream required by a " + topology + " computation");
            }
        }
        if (asset.computeGeometry() == null) {
            throw new ConfigurationException("Compute geometry of asset " + asset + " is unknown; "
                    + "set it explicitly when streams differ in size or are not raw");
        }
        for (StreamRole role : topology.roles()) {
            StreamSpec stream = asset.stream(role);
            if (stream.hasGeometricFilter() && !asset.isComputeGeometryExplicit()) {
                throw new ConfigurationException("Crop/pad on the " + role.tag() + " stream of " + asset
                        + " requires an explicit compute geometry");
            }
        }
        if (topology == Topology.FULL_REFERENCE && asset.workfileFormatOverride().isEmpty()) {
            PixelFormat ref = asset.stream(StreamRole.REFERENCE).format();
            PixelFormat dis = asset.stream(StreamRole.DISTORTED).format();
            if (ref.isRaw() && dis.isRaw() && ref != dis) {
                throw new ConfigurationException("Reference format " + ref.formatName()
                        + " differs from distorted format " + dis.formatName()
                        + "; set a workfile format to convert both");
            }
        }
    }

    void validateDependencies(Asset asset, Topology topology) {
        boolean anyTranscode = false;
        boolean anyStage = false;
        for (StreamRole role : topology.roles()) {
            boolean transcode = planner.needsTranscode(asset, role);
            anyTranscode |= transcode;
            anyStage |= transcode || planner.needsTransform(asset, role);
        }
        if (anyTranscode && !transcoder.isAvailable()) {
            throw new MissingDependencyException(transcoder.name(), "needed to prepare " + asset);
        }
        if (execution.streamingMode() && anyStage && !pipeFactory.isAvailable()) {
            throw new MissingDependencyException(pipeFactory.name(), "needed for streaming mode");
        }
    }
}
