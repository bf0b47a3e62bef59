package com.phillippitts.mediametric.service.plugin;

import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.domain.Topology;
import com.phillippitts.mediametric.exception.ComputeException;
import com.phillippitts.mediametric.service.io.RawFrame;
import com.phillippitts.mediametric.service.io.RawFrameReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.Map;
import java.util.Optional;

/**
 * Full-reference per-frame luma PSNR.
 *
 * <p>Identical frames score the format's ceiling ({@code 6 * bitDepth + 12} dB, i.e. 60 dB for
 * 8-bit samples) instead of infinity.
 */
public final class PsnrPlugin implements ComputationPlugin {

    private static final Logger LOG = LogManager.getLogger(PsnrPlugin.class);

    public static final String TYPE = "PSNR";
    public static final String VERSION = "1.0";
    public static final String SCORE_KEY = "psnr_y";

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
        return Topology.FULL_REFERENCE;
    }

    @Override
    public void generateResult(ExecutionContext context) {
        double ceiling = 6.0 * context.format().bitDepth() + 12.0;
        int frames = 0;
        try (RawFrameReader ref = RawFrameReader.open(context.procfile(StreamRole.REFERENCE), context.geometry(),
                context.format());
             RawFrameReader dis = RawFrameReader.open(context.procfile(StreamRole.DISTORTED), context.geometry(),
                     context.format());
             ScoreLog.Appender log = ScoreLog.append(context.logPath())) {
            while (true) {
                Optional<RawFrame> r = ref.next();
                Optional<RawFrame> d = dis.next();
                if (r.isEmpty() && d.isEmpty()) {
                    break;
                }
                if (r.isEmpty() || d.isEmpty()) {
                    throw new ComputeException("Reference and distorted streams differ in length after "
                            + frames + " frames", context.executorId());
                }
                log.frame(Map.of(SCORE_KEY, psnr(r.get().y(), d.get().y(), ceiling)));
                frames++;
            }
        } catch (IOException e) {
            throw new ComputeException("PSNR computation failed: " + e.getMessage(), context.executorId(), e);
        }
        LOG.debug("PSNR computed over {} frames", frames);
    }

    @Override
    public Result readResult(ExecutionContext context) {
        return new Result(context.asset(), context.executorId(), ScoreLog.read(context.logPath(),
                context.executorId()));
    }

    static double psnr(float[] a, float[] b, double ceiling) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        double mse = sum / a.length;
        if (mse == 0.0) {
            return ceiling;
        }
        return Math.min(ceiling, 10.0 * Math.log10(1.0 / mse));
    }
}
