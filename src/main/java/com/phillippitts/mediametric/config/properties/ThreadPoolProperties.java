package com.phillippitts.mediametric.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for thread pools.
 *
 * <p>The worker pool runs whole assets and is created per pooled scheduling call. The stage
 * pool runs streaming producers; it never queues, because a queued producer would leave its
 * consumer waiting on a pipe that is never created.
 */
@ConfigurationProperties(prefix = "threadpool")
@Validated
public class ThreadPoolProperties {

    @Valid
    private WorkerPoolProperties worker = new WorkerPoolProperties();
    @Valid
    private StagePoolProperties stage = new StagePoolProperties();

    public WorkerPoolProperties getWorker() {
        return worker;
    }

    public void setWorker(WorkerPoolProperties worker) {
        this.worker = worker;
    }

    public StagePoolProperties getStage() {
        return stage;
    }

    public void setStage(StagePoolProperties stage) {
        this.stage = stage;
    }

    /**
     * Asset worker pool configuration. {@code maxWorkers} is the bound used when a run call
     * passes zero or less.
     */
    public static class WorkerPoolProperties {
        @Min(value = 0, message = "Max workers must be >= 0 (0 = host parallelism)")
        private int maxWorkers = 0;
        @NotBlank
        private String threadNamePrefix = "asset-worker-";

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Stage producer pool configuration. {@code maxPoolSize} caps the producers alive at once;
     * a run that would exceed it waits for another run to release its slots.
     */
    public static class StagePoolProperties {
        @Positive
        private int corePoolSize = 4;
        @Positive
        private int maxPoolSize = 64;
        @Positive
        private int keepAliveSeconds = 60;
        @NotBlank
        private String threadNamePrefix = "stage-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
