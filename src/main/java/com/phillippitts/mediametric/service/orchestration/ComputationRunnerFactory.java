package com.phillippitts.mediametric.service.orchestration;

import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.service.cache.ResultCache;
import com.phillippitts.mediametric.service.metrics.RunMetricsPublisher;
import com.phillippitts.mediametric.service.plugin.ComputationPlugin;
import com.phillippitts.mediametric.service.stage.PipeFactory;
import com.phillippitts.mediametric.service.stage.StageSlots;
import com.phillippitts.mediametric.service.transcode.Transcoder;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.Map;

/**
 * Builds {@link ComputationRunner}s wired to the application's shared collaborators.
 */
public class ComputationRunnerFactory {

    private final ResultCache cache;
    private final Transcoder transcoder;
    private final PipeFactory pipeFactory;
    private final AsyncTaskExecutor stageExecutor;
    private final StageSlots stageSlots;
    private final WorkerPoolFactory workerPoolFactory;
    private final int defaultMaxWorkers;
    private final ExecutionProperties execution;
    private final RunMetricsPublisher metrics;
    private final ApplicationEventPublisher events;

    public ComputationRunnerFactory(ResultCache cache,
                                    Transcoder transcoder,
                                    PipeFactory pipeFactory,
                                    AsyncTaskExecutor stageExecutor,
                                    WorkerPoolFactory workerPoolFactory,
                                    ExecutionProperties execution,
                                    RunMetricsPublisher metrics,
                                    ApplicationEventPublisher events) {
        this(cache, transcoder, pipeFactory, stageExecutor, StageSlots.unbounded(), workerPoolFactory, 0,
                execution, metrics, events);
    }

    public ComputationRunnerFactory(ResultCache cache,
                                    Transcoder transcoder,
                                    PipeFactory pipeFactory,
                                    AsyncTaskExecutor stageExecutor,
                                    StageSlots stageSlots,
                                    WorkerPoolFactory workerPoolFactory,
                                    int defaultMaxWorkers,
                                    ExecutionProperties execution,
                                    RunMetricsPublisher metrics,
                                    ApplicationEventPublisher events) {
        this.cache = cache;
        this.transcoder = transcoder;
        this.pipeFactory = pipeFactory;
        this.stageExecutor = stageExecutor;
        this.stageSlots = stageSlots;
        this.workerPoolFactory = workerPoolFactory;
        this.defaultMaxWorkers = defaultMaxWorkers;
        this.execution = execution;
        this.metrics = metrics;
        this.events = events;
    }

    public ComputationRunner create(ComputationPlugin plugin) {
        return create(plugin, Map.of(), Map.of());
    }

    public ComputationRunner create(ComputationPlugin plugin,
                                    Map<String, Object> optionalParams,
                                    Map<String, Object> optionalParams2) {
        return ComputationRunner.builder(plugin)
                .optionalParams(optionalParams)
                .optionalParams2(optionalParams2)
                .cache(cache)
                .transcoder(transcoder)
                .pipeFactory(pipeFactory)
                .stageExecutor(stageExecutor)
                .stageSlots(stageSlots)
                .workerPoolFactory(workerPoolFactory)
                .defaultMaxWorkers(defaultMaxWorkers)
                .execution(execution)
                .metrics(metrics)
                .events(events)
                .build();
    }
}
