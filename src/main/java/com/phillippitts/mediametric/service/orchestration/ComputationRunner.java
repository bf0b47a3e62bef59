package com.phillippitts.mediametric.service.orchestration;

import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.exception.ConfigurationException;
import com.phillippitts.mediametric.service.cache.ResultCache;
import com.phillippitts.mediametric.service.metrics.RunMetricsPublisher;
import com.phillippitts.mediametric.service.plugin.ComputationPlugin;
import com.phillippitts.mediametric.service.stage.PipeFactory;
import com.phillippitts.mediametric.service.stage.StageOrchestrator;
import com.phillippitts.mediametric.service.stage.StagePlanner;
import com.phillippitts.mediametric.service.stage.StageSlots;
import com.phillippitts.mediametric.service.transcode.Transcoder;
import com.phillippitts.mediametric.service.validation.AssetValidator;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.AsyncTaskExecutor;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: one computation plugin with fixed options, run over batches of assets.
 *
 * <p>Build with {@link #builder(ComputationPlugin)}:
 * <pre>
 * ComputationRunner runner = ComputationRunner.builder(new PsnrPlugin())
 *         .transcoder(transcoder)
 *         .pipeFactory(pipeFactory)
 *         .stageExecutor(stageExecutor)
 *         .workerPoolFactory(poolFactory)
 *         .cache(cache)
 *         .build();
 * List&lt;Result&gt; results = runner.run(assets, true, 0);
 * </pre>
 */
public final class ComputationRunner {

    private final AssetPipeline pipeline;
    private final AssetScheduler scheduler;
    private final int defaultMaxWorkers;

    private ComputationRunner(AssetPipeline pipeline, AssetScheduler scheduler, int defaultMaxWorkers) {
        this.pipeline = pipeline;
        this.scheduler = scheduler;
        this.defaultMaxWorkers = defaultMaxWorkers;
    }

    public static Builder builder(ComputationPlugin plugin) {
        return new Builder(plugin);
    }

    /**
     * Cache key prefix and score-log label of this runner.
     */
    public String executorId() {
        return pipeline.executorId();
    }

    /**
     * Runs every asset; see {@link AssetScheduler#run}. A {@code maxWorkers} of zero or less
     * falls back to the runner's configured default, and to host parallelism when that is
     * unset too.
     */
    public List<Result> run(List<Asset> assets, boolean parallel, int maxWorkers) {
        return scheduler.run(pipeline, assets, parallel, maxWorkers > 0 ? maxWorkers : defaultMaxWorkers);
    }

    /**
     * Runs every asset sequentially on the calling thread.
     */
    public List<Result> run(List<Asset> assets) {
        return run(assets, false, 1);
    }

    /**
     * Deletes cached results and retained workfiles of every asset.
     */
    public void removeResults(List<Asset> assets) {
        for (Asset asset : assets) {
            pipeline.removeResult(asset);
        }
    }

    /**
     * Builder for {@link ComputationRunner}.
     */
    public static final class Builder {
        private final ComputationPlugin plugin;
        private Map<String, Object> optionalParams = Map.of();
        private Map<String, Object> optionalParams2 = Map.of();
        private ResultCache cache;
        private Transcoder transcoder;
        private PipeFactory pipeFactory;
        private AsyncTaskExecutor stageExecutor;
        private StageSlots stageSlots = StageSlots.unbounded();
        private WorkerPoolFactory workerPoolFactory;
        private int defaultMaxWorkers;
        private ExecutionProperties execution = ExecutionProperties.defaults();
        private RunMetricsPublisher metrics = RunMetricsPublisher.NOOP;
        private ApplicationEventPublisher events;

        private Builder(ComputationPlugin plugin) {
            this.plugin = Objects.requireNonNull(plugin, "plugin");
        }

        /**
         * Parameters that change the result; they are part of the executor id.
         */
        public Builder optionalParams(Map<String, Object> params) {
            this.optionalParams = params == null ? Map.of() : params;
            return this;
        }

        /**
         * Parameters that do not change the result; passed to the plugin only.
         */
        public Builder optionalParams2(Map<String, Object> params) {
            this.optionalParams2 = params == null ? Map.of() : params;
            return this;
        }

        public Builder cache(ResultCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder transcoder(Transcoder transcoder) {
            this.transcoder = transcoder;
            return this;
        }

        public Builder pipeFactory(PipeFactory pipeFactory) {
            this.pipeFactory = pipeFactory;
            return this;
        }

        public Builder stageExecutor(AsyncTaskExecutor stageExecutor) {
            this.stageExecutor = stageExecutor;
            return this;
        }

        /**
         * Slots shared by every runner on the same stage executor; unbounded when not set.
         */
        public Builder stageSlots(StageSlots stageSlots) {
            this.stageSlots = stageSlots;
            return this;
        }

        /**
         * Worker bound used when a call passes zero or less; zero means host parallelism.
         */
        public Builder defaultMaxWorkers(int defaultMaxWorkers) {
            this.defaultMaxWorkers = defaultMaxWorkers;
            return this;
        }

        public Builder workerPoolFactory(WorkerPoolFactory workerPoolFactory) {
            this.workerPoolFactory = workerPoolFactory;
            return this;
        }

        public Builder execution(ExecutionProperties execution) {
            this.execution = execution;
            return this;
        }

        public Builder metrics(RunMetricsPublisher metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder events(ApplicationEventPublisher events) {
            this.events = events;
            return this;
        }

        /**
         * @throws ConfigurationException if workfile retention is combined with streaming mode
         */
        public ComputationRunner build() {
            Objects.requireNonNull(cache, "cache");
            Objects.requireNonNull(transcoder, "transcoder");
            Objects.requireNonNull(pipeFactory, "pipeFactory");
            Objects.requireNonNull(stageExecutor, "stageExecutor");
            Objects.requireNonNull(stageSlots, "stageSlots");
            Objects.requireNonNull(workerPoolFactory, "workerPoolFactory");
            Objects.requireNonNull(execution, "execution");
            if (execution.saveWorkfiles() && execution.streamingMode()) {
                throw new ConfigurationException("Workfiles cannot be retained in streaming mode: "
                        + "pipes cannot be read twice");
            }
            StagePlanner planner = new StagePlanner();
            AssetValidator validator = new AssetValidator(planner, transcoder, pipeFactory, execution);
            StageOrchestrator stages = new StageOrchestrator(transcoder, pipeFactory, stageExecutor, execution,
                    stageSlots);
            AssetPipeline pipeline = new AssetPipeline(plugin, optionalParams, optionalParams2, cache, validator,
                    planner, stages, execution, metrics, events);
            return new ComputationRunner(pipeline, new AssetScheduler(workerPoolFactory), defaultMaxWorkers);
        }
    }
}
