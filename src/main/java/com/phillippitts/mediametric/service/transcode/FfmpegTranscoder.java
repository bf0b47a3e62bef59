package com.phillippitts.mediametric.service.transcode;

import com.phillippitts.mediametric.config.transcode.TranscoderConfig;
import com.phillippitts.mediametric.domain.FilterKey;
import com.phillippitts.mediametric.service.process.ExecutableLocator;
import com.phillippitts.mediametric.service.process.ProcessRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@link Transcoder} backed by the ffmpeg command-line tool.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} ${sourceFormatArgs} -i ${source} -an -vsync 0 -pix_fmt ${workfileFormat}
 *     [-vframes N] -vf select,crop,pad,scale=WxH,gblur,eq,lutyuv,yadif
 *     -f rawvideo -sws_flags ${resampling} -y -nostdin ${destination}
 * </pre>
 * Only the filters that are configured appear in the chain; {@code scale} is always present.
 */
public final class FfmpegTranscoder implements Transcoder {

    private static final Logger LOG = LogManager.getLogger(FfmpegTranscoder.class);

    private static final Set<String> IMAGE_SEQUENCE_EXTENSIONS = Set.of("j2c", "j2k", "tiff");
    private static final String HEVC_EXTENSION = "265";

    private final TranscoderConfig config;
    private final ProcessRunner processRunner;

    public FfmpegTranscoder(TranscoderConfig config, ProcessRunner processRunner) {
        this.config = Objects.requireNonNull(config, "config");
        this.processRunner = Objects.requireNonNull(processRunner, "processRunner");
    }

    @Override
    public void transcode(TranscodeRequest request) {
        List<String> command = buildCommand(request);
        LOG.info("Transcoding {} -> {}: {}", request.source().getFileName(), request.destination().getFileName(),
                String.join(" ", command));
        processRunner.run(command, name(), Duration.ofSeconds(config.timeoutSeconds()), config.maxStderrBytes());
    }

    @Override
    public boolean isAvailable() {
        return ExecutableLocator.isAvailable(config.binaryPath());
    }

    @Override
    public String name() {
        return "ffmpeg";
    }

    /**
     * Builds the argv for {@code request}. Package-private for tests.
     */
    List<String> buildCommand(TranscodeRequest request) {
        List<String> cmd = new ArrayList<>();
        cmd.add(config.binaryPath());
        cmd.addAll(sourceFormatArgs(request));
        cmd.add("-i");
        cmd.add(request.source().toString());
        cmd.add("-an");
        cmd.add("-vsync");
        cmd.add("0");
        cmd.add("-pix_fmt");
        cmd.add(request.targetFormat().formatName());
        if (request.frameRange() != null) {
            cmd.add("-vframes");
            cmd.add(String.valueOf(request.frameRange().frameCount()));
        }
        cmd.add("-vf");
        cmd.add(filterChain(request));
        cmd.add("-f");
        cmd.add("rawvideo");
        cmd.add("-sws_flags");
        cmd.add(request.resampling());
        cmd.add("-y");
        cmd.add("-nostdin");
        cmd.add(request.destination().toString());
        return cmd;
    }

    private static List<String> sourceFormatArgs(TranscodeRequest request) {
        List<String> args = new ArrayList<>();
        if (request.sourceFormat().isRaw()) {
            args.add("-f");
            args.add("rawvideo");
            args.add("-pix_fmt");
            args.add(request.sourceFormat().formatName());
            args.add("-s");
            args.add(request.sourceGeometry().toString());
            return args;
        }
        String ext = extension(request.source());
        if (IMAGE_SEQUENCE_EXTENSIONS.contains(ext)) {
            args.add("-f");
            args.add("image2");
            args.add("-start_number_range");
            args.add(String.valueOf(Integer.MAX_VALUE));
        } else if (HEVC_EXTENSION.equals(ext)) {
            args.add("-c:v");
            args.add("hevc");
        }
        return args;
    }

    private static String filterChain(TranscodeRequest request) {
        List<String> chain = new ArrayList<>();
        if (request.frameRange() != null) {
            // Commas inside the expression are escaped so they do not split the chain
            chain.add("select=between(n\\," + request.frameRange().start() + "\\," + request.frameRange().end() + ")");
            // Restart timestamps at the first selected frame
            chain.add("setpts=PTS-STARTPTS");
        }
        Map<FilterKey, String> filters = request.filters();
        boolean scaled = false;
        for (FilterKey key : FilterKey.values()) {
            if (!key.isGeometric() && !scaled) {
                chain.add("scale=" + request.targetGeometry());
                scaled = true;
            }
            String arg = filters.get(key);
            if (arg != null) {
                chain.add(key.filterName() + "=" + arg);
            }
        }
        if (!scaled) {
            chain.add("scale=" + request.targetGeometry());
        }
        return String.join(",", chain);
    }

    private static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
