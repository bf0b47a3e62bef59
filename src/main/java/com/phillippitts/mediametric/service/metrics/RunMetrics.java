package com.phillippitts.mediametric.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation of asset runs.
 *
 * <p>Provides:
 * <ul>
 *   <li>Cache hits and misses per executor type</li>
 *   <li>Per-asset run latency per executor type</li>
 *   <li>Failures per executor type and error category</li>
 * </ul>
 */
public class RunMetrics {

    private static final String METRIC_PREFIX = "mediametric.run";

    private final MeterRegistry registry;

    public RunMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void incrementCacheHit(String executorType) {
        Counter.builder(METRIC_PREFIX + ".cache.hit")
                .description("Assets answered from the result cache")
                .tag("executor", executorType)
                .register(registry)
                .increment();
    }

    public void incrementCacheMiss(String executorType) {
        Counter.builder(METRIC_PREFIX + ".cache.miss")
                .description("Assets that had to be computed")
                .tag("executor", executorType)
                .register(registry)
                .increment();
    }

    /**
     * Records the duration of a computed (non-cached) asset run.
     */
    public void recordLatency(String executorType, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken to run one asset through the pipeline")
                .tag("executor", executorType)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementFailure(String executorType, String category) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Asset runs that failed")
                .tag("executor", executorType)
                .tag("category", category)
                .register(registry)
                .increment();
    }
}
