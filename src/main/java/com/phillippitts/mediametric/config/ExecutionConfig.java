package com.phillippitts.mediametric.config;

import com.phillippitts.mediametric.config.cache.ResultCacheProperties;
import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.config.properties.ThreadPoolProperties;
import com.phillippitts.mediametric.config.transcode.TranscoderConfig;
import com.phillippitts.mediametric.service.cache.FileSystemResultCache;
import com.phillippitts.mediametric.service.cache.InMemoryResultCache;
import com.phillippitts.mediametric.service.cache.ResultCache;
import com.phillippitts.mediametric.service.metrics.RunMetrics;
import com.phillippitts.mediametric.service.metrics.RunMetricsPublisher;
import com.phillippitts.mediametric.service.orchestration.ComputationRunnerFactory;
import com.phillippitts.mediametric.service.orchestration.WorkerPoolFactory;
import com.phillippitts.mediametric.service.process.ProcessRunner;
import com.phillippitts.mediametric.service.stage.MkfifoPipeFactory;
import com.phillippitts.mediametric.service.stage.PipeFactory;
import com.phillippitts.mediametric.service.stage.StageSlots;
import com.phillippitts.mediametric.service.transcode.FfmpegTranscoder;
import com.phillippitts.mediametric.service.transcode.Transcoder;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;

import java.nio.file.Path;

/**
 * Wires the engine's collaborators.
 */
@Configuration
public class ExecutionConfig {

    private static final Logger LOG = LogManager.getLogger(ExecutionConfig.class);

    @Bean
    public ProcessRunner processRunner() {
        return new ProcessRunner();
    }

    @Bean
    public Transcoder transcoder(TranscoderConfig config, ProcessRunner processRunner) {
        return new FfmpegTranscoder(config, processRunner);
    }

    @Bean
    public PipeFactory pipeFactory(ProcessRunner processRunner) {
        return new MkfifoPipeFactory(processRunner);
    }

    @Bean
    public ResultCache resultCache(ResultCacheProperties props) {
        if (props.type() == ResultCacheProperties.Type.MEMORY) {
            LOG.info("Using in-memory result cache");
            return new InMemoryResultCache();
        }
        Path root = Path.of(props.root()).toAbsolutePath().normalize();
        LOG.info("Using filesystem result cache at {}", root);
        return new FileSystemResultCache(root);
    }

    /**
     * Fallback registry when no metrics backend is configured.
     */
    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public RunMetricsPublisher runMetricsPublisher(MeterRegistry registry) {
        return new RunMetricsPublisher(new RunMetrics(registry));
    }

    @Bean
    public ComputationRunnerFactory computationRunnerFactory(ResultCache cache,
                                                             Transcoder transcoder,
                                                             PipeFactory pipeFactory,
                                                             @Qualifier("stageExecutor") AsyncTaskExecutor stageExecutor,
                                                             StageSlots stageSlots,
                                                             WorkerPoolFactory workerPoolFactory,
                                                             ThreadPoolProperties threadPoolProperties,
                                                             ExecutionProperties execution,
                                                             RunMetricsPublisher metrics,
                                                             ApplicationEventPublisher events) {
        return new ComputationRunnerFactory(cache, transcoder, pipeFactory, stageExecutor, stageSlots,
                workerPoolFactory, threadPoolProperties.getWorker().getMaxWorkers(), execution, metrics, events);
    }
}
