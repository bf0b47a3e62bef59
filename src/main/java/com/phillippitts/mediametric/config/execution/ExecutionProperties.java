package com.phillippitts.mediametric.config.execution;

import com.phillippitts.mediametric.service.cache.CacheMissPolicy;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Per-asset pipeline behaviour.
 * Binds to properties prefixed with "mediametric.execution".
 *
 * @param streamingMode              connect stages through named pipes instead of files
 * @param deleteWorkdir              after a successful run, remove stage outputs and the score log,
 *                                   then the run and working directories if left empty
 * @param saveWorkfiles              retain workfiles in the result cache after a successful run
 * @param pipePollRetries            number of existence checks for a streaming stage's pipes
 * @param pipePollIntervalMs         pause between two existence checks
 * @param producerJoinTimeoutSeconds maximum wait for stage producers once the computation finished
 * @param cacheMissPolicy            handling of concurrent misses for the same cache entry
 */
@ConfigurationProperties(prefix = "mediametric.execution")
@Validated
public record ExecutionProperties(
        @DefaultValue("true")
        boolean streamingMode,

        @DefaultValue("true")
        boolean deleteWorkdir,

        @DefaultValue("false")
        boolean saveWorkfiles,

        @DefaultValue("10")
        @Min(value = 1, message = "At least one pipe poll is required")
        int pipePollRetries,

        @DefaultValue("100")
        @Positive(message = "Pipe poll interval must be positive")
        long pipePollIntervalMs,

        @DefaultValue("600")
        @Positive(message = "Producer join timeout must be positive")
        long producerJoinTimeoutSeconds,

        @DefaultValue("TOLERATE_DUPLICATE_WORK")
        @NotNull
        CacheMissPolicy cacheMissPolicy
) {

    public static ExecutionProperties defaults() {
        return new ExecutionProperties(true, true, false, 10, 100, 600, CacheMissPolicy.TOLERATE_DUPLICATE_WORK);
    }

    public ExecutionProperties withStreamingMode(boolean streaming) {
        return new ExecutionProperties(streaming, deleteWorkdir, saveWorkfiles, pipePollRetries, pipePollIntervalMs,
                producerJoinTimeoutSeconds, cacheMissPolicy);
    }

    public ExecutionProperties withSaveWorkfiles(boolean save) {
        return new ExecutionProperties(streamingMode, deleteWorkdir, save, pipePollRetries, pipePollIntervalMs,
                producerJoinTimeoutSeconds, cacheMissPolicy);
    }

    public ExecutionProperties withDeleteWorkdir(boolean delete) {
        return new ExecutionProperties(streamingMode, delete, saveWorkfiles, pipePollRetries, pipePollIntervalMs,
                producerJoinTimeoutSeconds, cacheMissPolicy);
    }

    public ExecutionProperties withPipePolling(int retries, long intervalMs) {
        return new ExecutionProperties(streamingMode, deleteWorkdir, saveWorkfiles, retries, intervalMs,
                producerJoinTimeoutSeconds, cacheMissPolicy);
    }

    public ExecutionProperties withCacheMissPolicy(CacheMissPolicy policy) {
        return new ExecutionProperties(streamingMode, deleteWorkdir, saveWorkfiles, pipePollRetries,
                pipePollIntervalMs, producerJoinTimeoutSeconds, policy);
    }

    public Duration pipePollInterval() {
        return Duration.ofMillis(pipePollIntervalMs);
    }

    public Duration producerJoinTimeout() {
        return Duration.ofSeconds(producerJoinTimeoutSeconds);
    }
}
