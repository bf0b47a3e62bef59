package com.phillippitts.mediametric.service.metrics;

import com.phillippitts.mediametric.exception.ComputeException;
import com.phillippitts.mediametric.exception.ConfigurationException;
import com.phillippitts.mediametric.exception.ExternalProcessException;
import com.phillippitts.mediametric.exception.MissingDependencyException;
import com.phillippitts.mediametric.exception.ResourceTimeoutException;
import com.phillippitts.mediametric.exception.ResultParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Null-safe facade over {@link RunMetrics} used by the pipeline.
 */
public final class RunMetricsPublisher {

    private static final Logger LOG = LogManager.getLogger(RunMetricsPublisher.class);

    /**
     * No-op instance for embedded use and tests.
     */
    public static final RunMetricsPublisher NOOP = new RunMetricsPublisher(null);

    private final RunMetrics metrics;

    /**
     * @param metrics metrics tracking service (nullable)
     */
    public RunMetricsPublisher(RunMetrics metrics) {
        this.metrics = metrics;
        if (metrics == null) {
            LOG.debug("RunMetricsPublisher created without metrics");
        }
    }

    public void recordCacheHit(String executorType) {
        if (metrics != null) {
            metrics.incrementCacheHit(executorType);
        }
    }

    public void recordSuccess(String executorType, long durationNanos) {
        if (metrics == null) {
            return;
        }
        metrics.incrementCacheMiss(executorType);
        metrics.recordLatency(executorType, durationNanos);
    }

    public void recordFailure(String executorType, Throwable error) {
        if (metrics != null) {
            metrics.incrementFailure(executorType, categorize(error));
        }
    }

    public boolean isEnabled() {
        return metrics != null;
    }

    /**
     * Maps an error to a low-cardinality tag value.
     */
    public static String categorize(Throwable error) {
        if (error instanceof ConfigurationException) {
            return "configuration";
        }
        if (error instanceof MissingDependencyException) {
            return "missing_dependency";
        }
        if (error instanceof ResourceTimeoutException) {
            return "resource_timeout";
        }
        if (error instanceof ExternalProcessException) {
            return "external_process";
        }
        if (error instanceof ComputeException) {
            return "compute";
        }
        if (error instanceof ResultParseException) {
            return "parse";
        }
        return "unexpected";
    }
}
