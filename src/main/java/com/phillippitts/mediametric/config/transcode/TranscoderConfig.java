package com.phillippitts.mediametric.config.transcode;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the external transcoder.
 * Binds to properties prefixed with "mediametric.transcoder".
 *
 * <p>Example application.properties:
 * <pre>
 * mediametric.transcoder.binary-path=/usr/local/bin/ffmpeg
 * mediametric.transcoder.timeout-seconds=3600
 * mediametric.transcoder.max-stderr-bytes=65536
 * </pre>
 *
 * @param binaryPath     transcoder executable, either a path or a bare name looked up on PATH
 * @param timeoutSeconds maximum run time of one transcode
 * @param maxStderrBytes cap on captured diagnostics per run
 */
@ConfigurationProperties(prefix = "mediametric.transcoder")
@Validated
public record TranscoderConfig(
        @DefaultValue("ffmpeg")
        @NotBlank(message = "Transcoder binary path must not be blank")
        String binaryPath,

        @DefaultValue("3600")
        @Positive(message = "Timeout must be positive")
        int timeoutSeconds,

        @DefaultValue("65536")
        @Positive(message = "Max stderr bytes must be positive")
        int maxStderrBytes
) {

    /**
     * Standard values, for use outside a Spring context.
     */
    public static TranscoderConfig defaults() {
        return new TranscoderConfig("ffmpeg", 3600, 65536);
    }
}
