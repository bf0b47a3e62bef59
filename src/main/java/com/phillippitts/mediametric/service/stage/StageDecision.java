package com.phillippitts.mediametric.service.stage;

import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.domain.Topology;

import java.nio.file.Path;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Per-run stage plan, computed once before any file is touched and read by every later step.
 *
 * @param topology        roles taking part in the run
 * @param computeGeometry geometry every workfile is produced at
 * @param workfileFormat  sample format of every workfile
 * @param runDir          private directory of the run; holds every stage output
 * @param streams         per-role plan, one entry per required role
 */
public record StageDecision(
        Topology topology,
        Geometry computeGeometry,
        PixelFormat workfileFormat,
        Path runDir,
        Map<StreamRole, RolePlan> streams
) {

    /**
     * Frozen decisions and effective paths of one stream.
     *
     * @param source    source path
     * @param transcode whether the transcode stage runs; when false the source is the workfile
     * @param transform whether the sample-transform stage runs; when false the workfile is the procfile
     * @param workfile  effective workfile path
     * @param procfile  effective procfile path
     */
    public record RolePlan(Path source, boolean transcode, boolean transform, Path workfile, Path procfile) {

        public boolean workfileIsSource() {
            return !transcode;
        }

        public boolean procfileIsWorkfile() {
            return !transform;
        }
    }

    public StageDecision {
        EnumMap<StreamRole, RolePlan> copy = new EnumMap<>(StreamRole.class);
        copy.putAll(streams);
        streams = Collections.unmodifiableMap(copy);
    }

    public Set<StreamRole> roles() {
        return streams.keySet();
    }

    public RolePlan plan(StreamRole role) {
        RolePlan plan = streams.get(role);
        if (plan == null) {
            throw new IllegalArgumentException("No " + role.tag() + " stream in " + topology + " run");
        }
        return plan;
    }

    public Path workfile(StreamRole role) {
        return plan(role).workfile();
    }

    public Path procfile(StreamRole role) {
        return plan(role).procfile();
    }

    public boolean anyTranscode() {
        return streams.values().stream().anyMatch(RolePlan::transcode);
    }

    public boolean anyTransform() {
        return streams.values().stream().anyMatch(RolePlan::transform);
    }

    public boolean anyStage() {
        return anyTranscode() || anyTransform();
    }
}
