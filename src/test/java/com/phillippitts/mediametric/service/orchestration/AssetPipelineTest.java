package com.phillippitts.mediametric.service.orchestration;

import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.domain.StreamSpec;
import com.phillippitts.mediametric.domain.Topology;
import com.phillippitts.mediametric.exception.ComputeException;
import com.phillippitts.mediametric.exception.ResourceTimeoutException;
import com.phillippitts.mediametric.identity.RunArtifacts;
import com.phillippitts.mediametric.service.cache.CacheMissPolicy;
import com.phillippitts.mediametric.service.cache.InMemoryResultCache;
import com.phillippitts.mediametric.service.cache.ResultCache;
import com.phillippitts.mediametric.service.metrics.RunMetricsPublisher;
import com.phillippitts.mediametric.service.plugin.ComputationPlugin;
import com.phillippitts.mediametric.service.plugin.ExecutionContext;
import com.phillippitts.mediametric.service.stage.PipeFactory;
import com.phillippitts.mediametric.service.stage.StageOrchestrator;
import com.phillippitts.mediametric.service.stage.StagePlanner;
import com.phillippitts.mediametric.service.validation.AssetValidator;
import com.phillippitts.mediametric.testutil.DelayedPipeFactory;
import com.phillippitts.mediametric.testutil.EventCapturingPublisher;
import com.phillippitts.mediametric.testutil.FakeTranscoder;
import com.phillippitts.mediametric.testutil.RawFiles;
import com.phillippitts.mediametric.testutil.RecordingPlugin;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.ThreadContext;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.filter.AbstractFilter;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.mediametric.domain.StreamRole.DISTORTED;
import static com.phillippitts.mediametric.domain.StreamRole.REFERENCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AssetPipelineTest {

    private static final Geometry NATIVE = Geometry.of(8, 4);
    private static final Geometry COMPUTE = Geometry.of(4, 2);

    @TempDir
    Path tmp;

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final FakeTranscoder transcoder = new FakeTranscoder().frames(3).luma(0.25f);
    private final InMemoryResultCache cache = new InMemoryResultCache();
    private final EventCapturingPublisher events = new EventCapturingPublisher();

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
        ThreadContext.clearAll();
    }

    private AssetPipeline pipeline(ComputationPlugin plugin, ExecutionProperties execution) {
        return pipeline(plugin, execution, new DelayedPipeFactory(0), cache);
    }

    private AssetPipeline pipeline(ComputationPlugin plugin, ExecutionProperties execution, PipeFactory pipes,
                                   ResultCache resultCache) {
        return pipeline(plugin, Map.of(), execution, pipes, resultCache);
    }

    private AssetPipeline pipeline(ComputationPlugin plugin, Map<String, Object> params, ExecutionProperties execution,
                                   PipeFactory pipes, ResultCache resultCache) {
        StagePlanner planner = new StagePlanner();
        return new AssetPipeline(plugin, params, Map.of(), resultCache,
                new AssetValidator(planner, transcoder, pipes, execution), planner,
                new StageOrchestrator(transcoder, pipes, new TaskExecutorAdapter(pool), execution),
                execution, RunMetricsPublisher.NOOP, events);
    }

    private static ExecutionProperties materialized() {
        return ExecutionProperties.defaults().withStreamingMode(false);
    }

    private Asset directAsset(String name) throws Exception {
        Path dis = RawFiles.write(tmp.resolve(name + ".yuv"), NATIVE, PixelFormat.YUV420P, 2, 0.5f);
        return Asset.builder("d", 0, 0)
                .distorted(StreamSpec.raw(dis, NATIVE, PixelFormat.YUV420P))
                .workdirRoot(tmp.resolve("work"))
                .build();
    }

    private Asset scaledAsset() throws Exception {
        Path ref = RawFiles.write(tmp.resolve("ref.yuv"), NATIVE, PixelFormat.YUV420P, 2, 0.5f);
        Path dis = RawFiles.write(tmp.resolve("dis.yuv"), NATIVE, PixelFormat.YUV420P, 2, 0.5f);
        return Asset.builder("d", 0, 0)
                .reference(StreamSpec.raw(ref, NATIVE, PixelFormat.YUV420P))
                .distorted(StreamSpec.raw(dis, NATIVE, PixelFormat.YUV420P))
                .computeGeometry(COMPUTE)
                .workdirRoot(tmp.resolve("work"))
                .build();
    }

    @Test
    void cacheHitSkipsEveryStage() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.NO_REFERENCE);
        Asset asset = directAsset("dis");
        AssetPipeline pipeline = pipeline(plugin, materialized());
        Result cached = new Result(asset, pipeline.executorId(), Map.of(RecordingPlugin.SCORE_KEY, List.of(0.1)));
        cache.save(cached);

        Result result = pipeline.run(asset);

        assertThat(result).isEqualTo(cached);
        assertThat(plugin.generateCalls()).isZero();
        assertThat(transcoder.invocations()).isZero();
        assertThat(asset.workdir()).doesNotExist();
    }

    @Test
    void matchingRawSourceIsReadInPlaceAndCached() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.NO_REFERENCE);
        Asset asset = directAsset("dis");
        AssetPipeline pipeline = pipeline(plugin, ExecutionProperties.defaults());

        Result result = pipeline.run(asset);

        assertThat(transcoder.invocations()).isZero();
        assertThat(plugin.contexts().get(0).procfile(DISTORTED)).isEqualTo(asset.stream(DISTORTED).path());
        assertThat(result.frameScores(RecordingPlugin.SCORE_KEY)).hasSize(2);
        assertThat(cache.load(asset, pipeline.executorId())).contains(result);
        assertThat(asset.stream(DISTORTED).path()).exists();
        assertThat(asset.workdir()).doesNotExist();
    }

    @Test
    void transcodedRunCleansUpIntermediatesAndLog() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.FULL_REFERENCE);
        Asset asset = scaledAsset();
        AssetPipeline pipeline = pipeline(plugin, materialized());

        Result result = pipeline.run(asset);

        assertThat(transcoder.invocations()).isEqualTo(2);
        assertThat(result.frameScores(RecordingPlugin.SCORE_KEY)).hasSize(3);
        assertThat(result.aggregate(RecordingPlugin.SCORE_KEY)).isCloseTo(64.0 / 255.0, within(1e-6));
        assertThat(RunArtifacts.workfilePath(asset, pipeline.executorId(), REFERENCE)).doesNotExist();
        assertThat(RunArtifacts.workfilePath(asset, pipeline.executorId(), DISTORTED)).doesNotExist();
        assertThat(RunArtifacts.logPath(asset, pipeline.executorId())).doesNotExist();
        assertThat(asset.workdir()).doesNotExist();
        assertThat(asset.stream(REFERENCE).path()).exists();
    }

    @Test
    void staleOutputsFromAnInterruptedRunAreReplaced() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.FULL_REFERENCE);
        Asset asset = scaledAsset();
        AssetPipeline pipeline = pipeline(plugin, materialized());
        Files.createDirectories(RunArtifacts.runDir(asset, pipeline.executorId()));
        Files.writeString(RunArtifacts.workfilePath(asset, pipeline.executorId(), DISTORTED),
                "garbage that is not a whole frame");

        Result result = pipeline.run(asset);

        assertThat(result.frameScores(RecordingPlugin.SCORE_KEY)).hasSize(3);
    }

    @Test
    void nonEmptyWorkdirIsKeptWithoutFailingTheRun() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.FULL_REFERENCE).leaveDiagnostics(true);
        Asset asset = scaledAsset();
        AssetPipeline pipeline = pipeline(plugin, materialized());

        Result result = pipeline.run(asset);

        assertThat(result).isNotNull();
        assertThat(RunArtifacts.runDir(asset, pipeline.executorId()).resolve("diagnostics.txt")).exists();
        assertThat(RunArtifacts.workfilePath(asset, pipeline.executorId(), DISTORTED)).doesNotExist();
    }

    @Test
    void workdirIsRetainedWhenDeletionIsDisabled() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.FULL_REFERENCE);
        Asset asset = scaledAsset();
        AssetPipeline pipeline = pipeline(plugin, materialized().withDeleteWorkdir(false));

        pipeline.run(asset);

        String id = pipeline.executorId();
        assertThat(asset.workdir()).isDirectory();
        assertThat(RunArtifacts.workfilePath(asset, id, REFERENCE)).isRegularFile();
        assertThat(RunArtifacts.workfilePath(asset, id, DISTORTED)).isRegularFile();
        assertThat(RunArtifacts.logPath(asset, id)).isRegularFile();
        assertThat(asset.stream(DISTORTED).path()).exists();
    }

    @Test
    void failedRunRemovesOutputsEvenWhenDeletionIsDisabled() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.FULL_REFERENCE).failFor("d");
        Asset asset = scaledAsset();
        AssetPipeline pipeline = pipeline(plugin, materialized().withDeleteWorkdir(false));

        assertThatThrownBy(() -> pipeline.run(asset)).isInstanceOf(ComputeException.class);

        assertThat(RunArtifacts.workfilePath(asset, pipeline.executorId(), DISTORTED)).doesNotExist();
        assertThat(RunArtifacts.logPath(asset, pipeline.executorId())).doesNotExist();
    }

    @Test
    void differentlyConfiguredRunsOnOneAssetDoNotShareStageOutputs() throws Exception {
        Asset asset = scaledAsset();
        AssetPipeline inner = pipeline(new RecordingPlugin(Topology.FULL_REFERENCE), Map.of("variant", "inner"),
                materialized(), new DelayedPipeFactory(0), cache);
        RecordingPlugin outerRecording = new RecordingPlugin(Topology.FULL_REFERENCE);
        List<Result> innerResults = new CopyOnWriteArrayList<>();
        ComputationPlugin nesting = new DelegatingPlugin(outerRecording) {
            @Override
            public void generateResult(ExecutionContext context) {
                innerResults.add(inner.run(context.asset()));
                super.generateResult(context);
            }
        };
        AssetPipeline outer = pipeline(nesting, Map.of("variant", "outer"), materialized(),
                new DelayedPipeFactory(0), cache);

        Result result = outer.run(asset);

        assertThat(outer.executorId()).isNotEqualTo(inner.executorId());
        assertThat(result.frameScores(RecordingPlugin.SCORE_KEY)).hasSize(3);
        assertThat(innerResults).singleElement()
                .satisfies(r -> assertThat(r.frameScores(RecordingPlugin.SCORE_KEY)).hasSize(3));
        assertThat(outerRecording.contexts().get(0).procfile(DISTORTED))
                .isNotEqualTo(RunArtifacts.workfilePath(asset, inner.executorId(), DISTORTED));
        assertThat(transcoder.invocations()).isEqualTo(4);
        assertThat(asset.workdir()).doesNotExist();
    }

    @Test
    void workfilesAreRetainedInTheCacheOnRequest() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.FULL_REFERENCE);
        Asset asset = scaledAsset();
        AssetPipeline pipeline = pipeline(plugin, materialized().withSaveWorkfiles(true));

        pipeline.run(asset);

        assertThat(cache.hasWorkfile(asset, pipeline.executorId(), REFERENCE)).isTrue();
        assertThat(cache.hasWorkfile(asset, pipeline.executorId(), DISTORTED)).isTrue();

        pipeline.removeResult(asset);
        assertThat(cache.load(asset, pipeline.executorId())).isEmpty();
        assertThat(cache.hasWorkfile(asset, pipeline.executorId(), DISTORTED)).isFalse();
    }

    @Test
    void computeFailureCachesNothingAndCleansUp() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.FULL_REFERENCE).failFor("d");
        Asset asset = scaledAsset();
        AssetPipeline pipeline = pipeline(plugin, materialized());

        assertThatThrownBy(() -> pipeline.run(asset))
                .isInstanceOf(ComputeException.class)
                .hasMessageContaining("Injected failure");

        assertThat(cache.size()).isZero();
        assertThat(RunArtifacts.workfilePath(asset, pipeline.executorId(), DISTORTED)).doesNotExist();
        assertThat(asset.workdir()).doesNotExist();
        assertThat(events.failures()).singleElement().satisfies(e -> {
            assertThat(e.state()).isEqualTo("COMPUTE");
            assertThat(e.category()).isEqualTo("compute");
            assertThat(e.executorId()).isEqualTo(pipeline.executorId());
        });
    }

    @Test
    void transcoderFailureIsReportedFromOpenTranscode() throws Exception {
        transcoder.failWith(1);
        RecordingPlugin plugin = new RecordingPlugin(Topology.FULL_REFERENCE);
        Asset asset = scaledAsset();

        assertThatThrownBy(() -> pipeline(plugin, materialized()).run(asset))
                .hasMessageContaining("Non-zero exit: 1");

        assertThat(plugin.generateCalls()).isZero();
        assertThat(events.failures()).singleElement()
                .satisfies(e -> assertThat(e.state()).isEqualTo("OPEN_TRANSCODE"));
    }

    @Test
    void slowPipeCreationFailsWithResourceTimeout() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.FULL_REFERENCE);
        Asset asset = scaledAsset();
        ExecutionProperties streaming = ExecutionProperties.defaults().withPipePolling(3, 50);
        AssetPipeline pipeline = pipeline(plugin, streaming, new DelayedPipeFactory(2000), cache);

        assertThatThrownBy(() -> pipeline.run(asset)).isInstanceOf(ResourceTimeoutException.class);

        assertThat(plugin.generateCalls()).isZero();
        assertThat(cache.size()).isZero();
        assertThat(events.failures()).singleElement()
                .satisfies(e -> assertThat(e.category()).isEqualTo("resource_timeout"));
    }

    @Test
    void postProcessAppliesToFreshAndCachedResults() throws Exception {
        RecordingPlugin recording = new RecordingPlugin(Topology.NO_REFERENCE);
        ComputationPlugin doubling = new DelegatingPlugin(recording) {
            @Override
            public Result postProcess(Result result) {
                return result.withScores(Map.of("doubled", List.of(result.aggregate(RecordingPlugin.SCORE_KEY) * 2)));
            }
        };
        Asset asset = directAsset("dis");
        AssetPipeline pipeline = pipeline(doubling, materialized());

        Result fresh = pipeline.run(asset);
        Result cached = pipeline.run(asset);

        assertThat(recording.generateCalls()).isEqualTo(1);
        assertThat(fresh.scores()).containsOnlyKeys("doubled");
        assertThat(cached.scores()).isEqualTo(fresh.scores());
        assertThat(cache.load(asset, pipeline.executorId()).orElseThrow().scores())
                .containsOnlyKeys(RecordingPlugin.SCORE_KEY);
    }

    @Test
    void logContextIsRestoredAfterRun() throws Exception {
        ThreadContext.put("request", "outer");
        Asset asset = directAsset("dis");

        pipeline(new RecordingPlugin(Topology.NO_REFERENCE), materialized()).run(asset);

        assertThat(ThreadContext.get("request")).isEqualTo("outer");
        assertThat(ThreadContext.get(AssetPipeline.MDC_ASSET)).isNull();
    }

    @Test
    void serializedMissesComputeOnlyOnceAcrossRunners() throws Exception {
        RecordingPlugin plugin = new RecordingPlugin(Topology.NO_REFERENCE).delay(ctx -> 300);
        Asset asset = directAsset("dis");
        ExecutionProperties execution = materialized().withCacheMissPolicy(CacheMissPolicy.SERIALIZE_MISSES);
        AssetPipeline first = pipeline(plugin, execution);
        AssetPipeline second = pipeline(plugin, execution);

        CompletableFuture<Result> a = CompletableFuture.supplyAsync(() -> first.run(asset), pool);
        CompletableFuture<Result> b = CompletableFuture.supplyAsync(() -> second.run(asset), pool);

        assertThat(a.get(5, TimeUnit.SECONDS)).isEqualTo(b.get(5, TimeUnit.SECONDS));
        assertThat(plugin.generateCalls()).isEqualTo(1);
        assertThat(plugin.overlapViolations()).isZero();
    }

    @Test
    void completionLogReportsElapsedMilliseconds() throws Exception {
        LoggerContext ctx = (LoggerContext) LogManager.getContext(false);
        Logger logger = ctx.getLogger(AssetPipeline.class.getName());
        InMemoryAppender appender = new InMemoryAppender("pipeline-test-appender");
        appender.start();
        logger.addAppender(appender);
        try {
            RecordingPlugin plugin = new RecordingPlugin(Topology.NO_REFERENCE).delay(c -> 200);
            pipeline(plugin, materialized()).run(directAsset("dis"));
        } finally {
            logger.removeAppender(appender);
            appender.stop();
        }

        String line = appender.messages().stream()
                .filter(m -> m.startsWith("Computed "))
                .findFirst()
                .orElseThrow();
        long millis = Long.parseLong(line.replaceAll(".* in (\\d+) ms$", "$1"));
        assertThat(millis).isBetween(200L, 60_000L);
    }

    @Test
    void executorIdIgnoresNonResultParameters() {
        RecordingPlugin plugin = new RecordingPlugin(Topology.NO_REFERENCE);
        StagePlanner planner = new StagePlanner();
        DelayedPipeFactory pipes = new DelayedPipeFactory(0);
        ExecutionProperties execution = materialized();
        HashMap<String, Object> params = new HashMap<>();
        params.put("model", null);
        AssetPipeline pipeline = new AssetPipeline(plugin, params, Map.of("verbose", true), cache,
                new AssetValidator(planner, transcoder, pipes, execution), planner,
                new StageOrchestrator(transcoder, pipes, new TaskExecutorAdapter(pool), execution),
                execution, null, null);

        assertThat(pipeline.executorId()).isEqualTo("RECORDING_0.1_model_None");
        assertThat(pipeline.topology()).isEqualTo(Topology.NO_REFERENCE);
    }

    /**
     * Captures formatted messages of the events it receives.
     */
    private static class InMemoryAppender extends AbstractAppender {
        private final List<String> messages = new CopyOnWriteArrayList<>();

        InMemoryAppender(String name) {
            super(name, new AbstractFilter() { }, PatternLayout.createDefaultLayout(), true, null);
        }

        @Override
        public void append(LogEvent event) {
            messages.add(event.toImmutable().getMessage().getFormattedMessage());
        }

        List<String> messages() {
            return messages;
        }
    }

    /**
     * Forwards every call to a delegate plugin.
     */
    private static class DelegatingPlugin implements ComputationPlugin {
        private final ComputationPlugin delegate;

        DelegatingPlugin(ComputationPlugin delegate) {
            this.delegate = delegate;
        }

        @Override
        public String type() {
            return delegate.type();
        }

        @Override
        public String version() {
            return delegate.version();
        }

        @Override
        public Topology topology() {
            return delegate.topology();
        }

        @Override
        public void generateResult(ExecutionContext context) {
            delegate.generateResult(context);
        }

        @Override
        public Result readResult(ExecutionContext context) {
            return delegate.readResult(context);
        }
    }
}
