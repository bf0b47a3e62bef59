package com.phillippitts.mediametric.service.plugin;

import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.domain.Topology;
import com.phillippitts.mediametric.exception.ComputeException;
import com.phillippitts.mediametric.service.io.RawFrame;
import com.phillippitts.mediametric.service.io.RawFrameReader;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * No-reference per-frame mean of the normalized luma plane.
 */
public final class MeanLumaPlugin implements ComputationPlugin {

    public static final String TYPE = "MEAN_LUMA";
    public static final String VERSION = "1.0";
    public static final String SCORE_KEY = "mean_luma";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public String version() {
        return VERSION;
    }

    @Override
    public Topology topology() {
        return Topology.NO_REFERENCE;
    }

    @Override
    public void generateResult(ExecutionContext context) {
        try (RawFrameReader dis = RawFrameReader.open(context.procfile(StreamRole.DISTORTED), context.geometry(),
                context.format());
             ScoreLog.Appender log = ScoreLog.append(context.logPath())) {
            Optional<RawFrame> frame;
            while ((frame = dis.next()).isPresent()) {
                log.frame(Map.of(SCORE_KEY, mean(frame.get().y())));
            }
        } catch (IOException e) {
            throw new ComputeException("Mean luma computation failed: " + e.getMessage(), context.executorId(), e);
        }
    }

    @Override
    public Result readResult(ExecutionContext context) {
        return new Result(context.asset(), context.executorId(), ScoreLog.read(context.logPath(),
                context.executorId()));
    }

    static double mean(float[] plane) {
        double sum = 0.0;
        for (float v : plane) {
            sum += v;
        }
        return plane.length == 0 ? 0.0 : sum / plane.length;
    }
}
