package com.phillippitts.mediametric.service.plugin;

import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.domain.Topology;
import com.phillippitts.mediametric.service.stage.StageDecision;

import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * What a {@link ComputationPlugin} sees of one run.
 */
public final class ExecutionContext {

    private final Asset asset;
    private final String executorId;
    private final StageDecision decision;
    private final Path logPath;
    private final Map<String, Object> optionalParams;
    private final Map<String, Object> optionalParams2;
    private final Runnable workfileRefresher;

    public ExecutionContext(Asset asset,
                            String executorId,
                            StageDecision decision,
                            Path logPath,
                            Map<String, Object> optionalParams,
                            Map<String, Object> optionalParams2,
                            Runnable workfileRefresher) {
        this.asset = Objects.requireNonNull(asset, "asset");
        this.executorId = Objects.requireNonNull(executorId, "executorId");
        this.decision = Objects.requireNonNull(decision, "decision");
        this.logPath = Objects.requireNonNull(logPath, "logPath");
        this.optionalParams = optionalParams == null ? Map.of() : optionalParams;
        this.optionalParams2 = optionalParams2 == null ? Map.of() : optionalParams2;
        this.workfileRefresher = workfileRefresher == null ? () -> { } : workfileRefresher;
    }

    public Asset asset() {
        return asset;
    }

    public String executorId() {
        return executorId;
    }

    public Topology topology() {
        return decision.topology();
    }

    /**
     * Stream the computation reads for {@code role}: the procfile, or whichever upstream
     * path stands in for it when stages were skipped.
     */
    public Path procfile(StreamRole role) {
        return decision.procfile(role);
    }

    public Path workfile(StreamRole role) {
        return decision.workfile(role);
    }

    public Geometry geometry() {
        return decision.computeGeometry();
    }

    public PixelFormat format() {
        return decision.workfileFormat();
    }

    /**
     * Private directory of this run; a plugin may leave diagnostics here.
     */
    public Path runDir() {
        return decision.runDir();
    }

    /**
     * Score log; its first line already holds the executor id.
     */
    public Path logPath() {
        return logPath;
    }

    /**
     * Result-affecting optional parameters (part of the executor id).
     */
    public Map<String, Object> optionalParams() {
        return optionalParams;
    }

    /**
     * Optional parameters that do not affect the result.
     */
    public Map<String, Object> optionalParams2() {
        return optionalParams2;
    }

    /**
     * Looks up a parameter in both maps, result-affecting first.
     */
    public Object param(String key, Object defaultValue) {
        if (optionalParams.containsKey(key)) {
            return optionalParams.get(key);
        }
        return optionalParams2.getOrDefault(key, defaultValue);
    }

    /**
     * Reopens the input streams for another pass. A no-op when every stage was materialized.
     */
    public void refreshWorkfiles() {
        workfileRefresher.run();
    }
}
