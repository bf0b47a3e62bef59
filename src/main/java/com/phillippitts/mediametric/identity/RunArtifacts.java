package com.phillippitts.mediametric.identity;

import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.StreamRole;

import java.nio.file.Path;

/**
 * Names the private artifacts of one (asset, executor) run.
 *
 * <p>Every artifact lives in a run directory under the asset's working directory, named from
 * the executor id and the asset fingerprint. Differently configured computations on the same
 * asset therefore never share a stage output or a score log.
 */
public final class RunArtifacts {

    private RunArtifacts() {
        // Utility class - prevent instantiation
    }

    /**
     * Private directory of one run.
     */
    public static Path runDir(Asset asset, String executorId) {
        return asset.workdir().resolve(executorId + "_" + asset.fingerprint());
    }

    /**
     * Target of the transcode stage for {@code role}.
     */
    public static Path workfilePath(Asset asset, String executorId, StreamRole role) {
        asset.stream(role);
        return runDir(asset, executorId).resolve(role.tag() + "_wf_" + asset.fingerprint() + ".yuv");
    }

    /**
     * Target of the sample-transform stage for {@code role}.
     */
    public static Path procfilePath(Asset asset, String executorId, StreamRole role) {
        asset.stream(role);
        return runDir(asset, executorId).resolve(role.tag() + "_pf_" + asset.fingerprint() + ".yuv");
    }

    /**
     * Path of the score log written by the computation plugin.
     */
    public static Path logPath(Asset asset, String executorId) {
        return runDir(asset, executorId).resolve("log_" + asset.fingerprint() + ".txt");
    }
}
