package com.phillippitts.mediametric.config;

import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.config.transcode.TranscoderConfig;
import com.phillippitts.mediametric.service.stage.PipeFactory;
import com.phillippitts.mediametric.service.transcode.Transcoder;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Logs whether the external tools are available at startup.
 *
 * <p>Never fails startup: assets that need a missing tool are rejected when they are scheduled.
 */
@Component
@ConditionalOnProperty(name = "mediametric.preflight.enabled", havingValue = "true", matchIfMissing = true)
class TranscoderPreflightCheck {

    private static final Logger LOG = LogManager.getLogger(TranscoderPreflightCheck.class);

    private final Transcoder transcoder;
    private final PipeFactory pipeFactory;
    private final TranscoderConfig transcoderConfig;
    private final ExecutionProperties execution;

    TranscoderPreflightCheck(Transcoder transcoder, PipeFactory pipeFactory, TranscoderConfig transcoderConfig,
                             ExecutionProperties execution) {
        this.transcoder = transcoder;
        this.pipeFactory = pipeFactory;
        this.transcoderConfig = transcoderConfig;
        this.execution = execution;
    }

    @PostConstruct
    void check() {
        LOG.info("Checking external tools... os={}, arch={}", System.getProperty("os.name"),
                System.getProperty("os.arch"));
        if (transcoder.isAvailable()) {
            LOG.info("Transcoder '{}' available at '{}'", transcoder.name(), transcoderConfig.binaryPath());
        } else {
            LOG.warn("Transcoder '{}' not found at '{}'; assets that need transcoding will be rejected",
                    transcoder.name(), transcoderConfig.binaryPath());
        }
        if (!execution.streamingMode()) {
            LOG.info("Streaming mode off; stages are materialized");
        } else if (pipeFactory.isAvailable()) {
            LOG.info("Streaming mode on; '{}' available", pipeFactory.name());
        } else {
            LOG.warn("Streaming mode on but '{}' not found; assets that need a stage will be rejected",
                    pipeFactory.name());
        }
    }
}
