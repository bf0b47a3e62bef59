package com.phillippitts.mediametric.config;

import com.phillippitts.mediametric.config.properties.ThreadPoolProperties;
import com.phillippitts.mediametric.service.orchestration.WorkerPoolFactory;
import com.phillippitts.mediametric.service.stage.StageSlots;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the engine.
 *
 * <p>MDC propagation: both pools copy the Log4j2 ThreadContext of the submitting thread to the
 * worker, so stage producer logs carry the asset and executor id of their run.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Pool for streaming stage producers.
     *
     * <p>Queue capacity is zero and the thread count is not capped here: a run reserves its
     * producers from {@link #stageSlots()} before submitting them, so workers beyond the
     * configured maximum wait for a slot instead of being rejected. A queued producer would
     * leave its consumer blocked on a pipe nobody opens.
     *
     * @return executor for stage producers
     */
    @Bean(name = "stageExecutor")
    public AsyncTaskExecutor stageExecutor() {
        ThreadPoolProperties.StagePoolProperties props = threadPoolProperties.getStage();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(Integer.MAX_VALUE);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Caps the streaming producers alive at once at the configured stage maximum, raised to
     * the producers of one run when configured lower.
     *
     * @return shared stage slots
     */
    @Bean
    public StageSlots stageSlots() {
        ThreadPoolProperties.StagePoolProperties props = threadPoolProperties.getStage();
        return new StageSlots(Math.max(props.getMaxPoolSize(), StageSlots.MAX_PRODUCERS_PER_RUN));
    }

    /**
     * Creates one fixed-size asset worker pool per pooled scheduling call.
     *
     * @return factory for asset worker pools
     */
    @Bean
    public WorkerPoolFactory workerPoolFactory() {
        ThreadPoolProperties.WorkerPoolProperties props = threadPoolProperties.getWorker();
        return workers -> {
            ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(workers);
            executor.setMaxPoolSize(workers);
            executor.setThreadNamePrefix(props.getThreadNamePrefix());
            executor.setTaskDecorator(mdcPropagatingDecorator());
            executor.initialize();
            return executor.getThreadPoolExecutor();
        };
    }

    /**
     * Copies the submitting thread's ThreadContext into the worker for the task's duration.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
