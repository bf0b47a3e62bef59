package com.phillippitts.mediametric.service.orchestration;

import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.domain.StreamSpec;
import com.phillippitts.mediametric.exception.ConfigurationException;
import com.phillippitts.mediametric.service.cache.FileSystemResultCache;
import com.phillippitts.mediametric.service.metrics.RunMetrics;
import com.phillippitts.mediametric.service.metrics.RunMetricsPublisher;
import com.phillippitts.mediametric.service.plugin.PsnrPlugin;
import com.phillippitts.mediametric.service.stage.StageSlots;
import com.phillippitts.mediametric.testutil.DelayedPipeFactory;
import com.phillippitts.mediametric.testutil.FakeTranscoder;
import com.phillippitts.mediametric.testutil.RawFiles;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ComputationRunnerTest {

    private static final Geometry G = Geometry.of(8, 4);

    @TempDir
    Path tmp;

    private final ExecutorService stagePool = Executors.newCachedThreadPool();
    private final FakeTranscoder transcoder = new FakeTranscoder().frames(2).luma(0.5f);
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    @AfterEach
    void shutdown() {
        stagePool.shutdownNow();
    }

    private ComputationRunner.Builder builder(FileSystemResultCache cache) {
        return ComputationRunner.builder(new PsnrPlugin())
                .cache(cache)
                .transcoder(transcoder)
                .pipeFactory(new DelayedPipeFactory(0))
                .stageExecutor(new TaskExecutorAdapter(stagePool))
                .workerPoolFactory(Executors::newFixedThreadPool)
                .execution(ExecutionProperties.defaults().withStreamingMode(false))
                .metrics(new RunMetricsPublisher(new RunMetrics(registry)));
    }

    private Asset asset() throws Exception {
        return asset(1);
    }

    private Asset asset(int assetId) throws Exception {
        Path ref = RawFiles.write(tmp.resolve("ref.yuv"), G, PixelFormat.YUV420P, 2, 0.5f);
        Path dis = RawFiles.write(tmp.resolve("dis.yuv"), G, PixelFormat.YUV420P, 2, 0.5f);
        return Asset.builder("example", 0, assetId)
                .reference(StreamSpec.raw(ref, G, PixelFormat.YUV420P))
                .distorted(StreamSpec.raw(dis, G, PixelFormat.YUV420P))
                .computeGeometry(Geometry.of(4, 2))
                .workdirRoot(tmp.resolve("work"))
                .build();
    }

    @Test
    void secondRunIsServedFromPersistentCache() throws Exception {
        FileSystemResultCache cache = new FileSystemResultCache(tmp.resolve("cache"));
        Asset asset = asset();

        Result first = builder(cache).build().run(List.of(asset)).get(0);
        Result second = builder(new FileSystemResultCache(tmp.resolve("cache"))).build().run(List.of(asset)).get(0);

        assertThat(transcoder.invocations()).isEqualTo(2);
        assertThat(second.scores()).isEqualTo(first.scores());
        assertThat(first.aggregate(PsnrPlugin.SCORE_KEY)).isEqualTo(60.0);
        assertThat(registry.get("mediametric.run.cache.hit").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("mediametric.run.cache.miss").counter().count()).isEqualTo(1.0);
    }

    @Test
    void removeResultsForcesRecomputation() throws Exception {
        FileSystemResultCache cache = new FileSystemResultCache(tmp.resolve("cache"));
        ComputationRunner runner = builder(cache).build();
        Asset asset = asset();
        runner.run(List.of(asset));

        runner.removeResults(List.of(asset));
        runner.run(List.of(asset));

        assertThat(transcoder.invocations()).isEqualTo(4);
    }

    @Test
    void resultAffectingParamsChangeTheExecutorId() {
        FileSystemResultCache cache = new FileSystemResultCache(tmp);

        ComputationRunner plain = builder(cache).build();
        ComputationRunner tuned = builder(cache).optionalParams(Map.of("model", "v2")).build();
        ComputationRunner verbose = builder(cache).optionalParams2(Map.of("verbose", true)).build();

        assertThat(plain.executorId()).isEqualTo("PSNR_1.0");
        assertThat(tuned.executorId()).isEqualTo("PSNR_1.0_model_v2");
        assertThat(verbose.executorId()).isEqualTo("PSNR_1.0");
    }

    @Test
    void retainingWorkfilesRequiresMaterializedMode() {
        ComputationRunner.Builder streamingWithRetention = builder(new FileSystemResultCache(tmp))
                .execution(ExecutionProperties.defaults().withSaveWorkfiles(true));

        assertThatThrownBy(streamingWithRetention::build)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("streaming mode");
    }

    @Test
    void missingCollaboratorIsRejected() {
        assertThatThrownBy(() -> ComputationRunner.builder(new PsnrPlugin()).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("cache");
    }

    @Test
    void factoryCreatesRunnersWithSharedCollaborators() {
        FileSystemResultCache cache = new FileSystemResultCache(tmp);
        ComputationRunnerFactory factory = new ComputationRunnerFactory(cache, transcoder, new DelayedPipeFactory(0),
                new TaskExecutorAdapter(stagePool), Executors::newFixedThreadPool,
                ExecutionProperties.defaults(), RunMetricsPublisher.NOOP, null);

        assertThat(factory.create(new PsnrPlugin()).executorId()).isEqualTo("PSNR_1.0");
        assertThat(factory.create(new PsnrPlugin(), Map.of("k", 1), Map.of()).executorId())
                .isEqualTo("PSNR_1.0_k_1");
    }

    @Test
    void configuredWorkerBoundAppliesWhenCallPassesNone() throws Exception {
        List<Integer> poolSizes = new CopyOnWriteArrayList<>();
        WorkerPoolFactory recording = workers -> {
            poolSizes.add(workers);
            return Executors.newFixedThreadPool(workers);
        };
        ComputationRunnerFactory factory = new ComputationRunnerFactory(new FileSystemResultCache(tmp.resolve("cache")),
                transcoder, new DelayedPipeFactory(0), new TaskExecutorAdapter(stagePool), StageSlots.unbounded(),
                recording, 2, ExecutionProperties.defaults().withStreamingMode(false), RunMetricsPublisher.NOOP, null);
        ComputationRunner runner = factory.create(new PsnrPlugin());
        List<Asset> assets = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            assets.add(asset(i));
        }

        runner.run(assets, true, 0);
        runner.run(assets, true, 3);

        assertThat(poolSizes).containsExactly(2, 3);
    }

    @Test
    void unsetWorkerBoundFallsBackToHostParallelism() throws Exception {
        List<Integer> poolSizes = new CopyOnWriteArrayList<>();
        ComputationRunner runner = builder(new FileSystemResultCache(tmp.resolve("cache")))
                .workerPoolFactory(workers -> {
                    poolSizes.add(workers);
                    return Executors.newFixedThreadPool(workers);
                })
                .build();
        List<Asset> assets = new ArrayList<>();
        for (int i = 0; i < 64; i++) {
            assets.add(asset(i));
        }

        runner.run(assets, true, -1);

        assertThat(poolSizes).containsExactly(Math.min(64, Runtime.getRuntime().availableProcessors()));
    }
}
