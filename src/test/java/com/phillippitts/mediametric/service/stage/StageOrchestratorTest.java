package com.phillippitts.mediametric.service.stage;

import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.FrameCallback;
import com.phillippitts.mediametric.domain.Geometry;
import com.phillippitts.mediametric.domain.PixelFormat;
import com.phillippitts.mediametric.domain.StreamSpec;
import com.phillippitts.mediametric.domain.Topology;
import com.phillippitts.mediametric.exception.ExternalProcessException;
import com.phillippitts.mediametric.exception.MediaMetricException;
import com.phillippitts.mediametric.exception.ResourceTimeoutException;
import com.phillippitts.mediametric.testutil.DelayedPipeFactory;
import com.phillippitts.mediametric.testutil.FakeTranscoder;
import com.phillippitts.mediametric.testutil.RawFiles;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.support.TaskExecutorAdapter;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static com.phillippitts.mediametric.domain.StreamRole.DISTORTED;
import static com.phillippitts.mediametric.domain.StreamRole.REFERENCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

class StageOrchestratorTest {

    private static final Geometry NATIVE = Geometry.of(8, 4);
    private static final Geometry COMPUTE = Geometry.of(4, 2);

    @TempDir
    Path tmp;

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final TaskExecutorAdapter stageExecutor = new TaskExecutorAdapter(pool);
    private final FakeTranscoder transcoder = new FakeTranscoder().frames(2);
    private final StagePlanner planner = new StagePlanner();

    @AfterEach
    void shutdown() {
        pool.shutdownNow();
    }

    private Asset scaledAsset() throws Exception {
        Path ref = RawFiles.write(tmp.resolve("ref.yuv"), NATIVE, PixelFormat.YUV420P, 2, 0.5f);
        Path dis = RawFiles.write(tmp.resolve("dis.yuv"), NATIVE, PixelFormat.YUV420P, 2, 0.4f);
        return Asset.builder("d", 0, 0)
                .reference(StreamSpec.raw(ref, NATIVE, PixelFormat.YUV420P))
                .distorted(StreamSpec.raw(dis, NATIVE, PixelFormat.YUV420P))
                .computeGeometry(COMPUTE)
                .workdirRoot(tmp.resolve("work"))
                .build();
    }

    private StageOrchestrator orchestrator(PipeFactory pipes, ExecutionProperties execution) {
        return new StageOrchestrator(transcoder, pipes, stageExecutor, execution);
    }

    @Test
    void materializedTranscodeWritesWorkfilesSynchronously() throws Exception {
        Asset asset = scaledAsset();
        StageDecision decision = planner.plan(asset, Topology.FULL_REFERENCE, "X_1");
        StageOrchestrator stages = orchestrator(new DelayedPipeFactory(0),
                ExecutionProperties.defaults().withStreamingMode(false));
        StageHandles handles = stages.newHandles();

        stages.teardown(decision);
        stages.openTranscode(asset, decision, handles);

        assertThat(handles.isEmpty()).isTrue();
        assertThat(decision.workfile(REFERENCE)).isRegularFile();
        assertThat(decision.workfile(DISTORTED)).isRegularFile();
        assertThat(transcoder.requests()).extracting(r -> r.targetGeometry()).containsOnly(COMPUTE);
    }

    @Test
    void teardownRemovesStaleOutputsButNeverSources() throws Exception {
        Asset asset = scaledAsset();
        StageDecision decision = planner.plan(asset, Topology.FULL_REFERENCE, "X_1");
        Files.createDirectories(decision.runDir());
        Files.writeString(decision.workfile(DISTORTED), "stale");
        StageOrchestrator stages = orchestrator(new DelayedPipeFactory(0), ExecutionProperties.defaults());

        stages.teardown(decision);

        assertThat(decision.workfile(DISTORTED)).doesNotExist();
        assertThat(asset.stream(DISTORTED).path()).exists();
        assertThat(decision.runDir()).isDirectory();
    }

    @Test
    void streamingTranscodeStartsOneProducerPerStream() throws Exception {
        Asset asset = scaledAsset();
        StageDecision decision = planner.plan(asset, Topology.FULL_REFERENCE, "X_1");
        DelayedPipeFactory pipes = new DelayedPipeFactory(0);
        StageOrchestrator stages = orchestrator(pipes, ExecutionProperties.defaults());
        StageHandles handles = stages.newHandles();

        stages.teardown(decision);
        stages.openTranscode(asset, decision, handles);

        assertThat(handles.size()).isEqualTo(2);
        assertThat(pipes.created()).containsExactlyInAnyOrder(decision.workfile(REFERENCE),
                decision.workfile(DISTORTED));
        handles.awaitProducers(Duration.ofSeconds(5));
        assertThat(handles.isEmpty()).isTrue();
        assertThat(transcoder.invocations()).isEqualTo(2);
    }

    @Test
    void slowPipeCreationTimesOutAfterBoundedPoll() throws Exception {
        Asset asset = scaledAsset();
        StageDecision decision = planner.plan(asset, Topology.FULL_REFERENCE, "X_1");
        StageOrchestrator stages = orchestrator(new DelayedPipeFactory(2000),
                ExecutionProperties.defaults().withPipePolling(3, 50));
        StageHandles handles = stages.newHandles();
        stages.teardown(decision);

        long start = System.nanoTime();
        assertThatThrownBy(() -> stages.openTranscode(asset, decision, handles))
                .isInstanceOfSatisfying(ResourceTimeoutException.class, e ->
                        assertThat(e.getMissing()).containsExactlyInAnyOrder(decision.workfile(REFERENCE),
                                decision.workfile(DISTORTED)));
        assertThat((System.nanoTime() - start) / 1_000_000L).isLessThan(1500);

        handles.abort();
    }

    @Test
    void producerFailureIsReportedInsteadOfTimeout() throws Exception {
        Asset asset = scaledAsset();
        StageDecision decision = planner.plan(asset, Topology.FULL_REFERENCE, "X_1");
        PipeFactory failing = new PipeFactory() {
            @Override
            public void create(Path path) {
                throw new MediaMetricException("mkfifo refused " + path.getFileName());
            }

            @Override
            public boolean isAvailable() {
                return true;
            }

            @Override
            public String name() {
                return "failing";
            }
        };
        StageOrchestrator stages = orchestrator(failing, ExecutionProperties.defaults().withPipePolling(5, 50));
        StageHandles handles = stages.newHandles();
        stages.teardown(decision);

        assertThatThrownBy(() -> stages.openTranscode(asset, decision, handles))
                .isInstanceOf(MediaMetricException.class)
                .hasMessageContaining("mkfifo refused")
                .satisfies(e -> assertThat(e.getSuppressed()).hasAtLeastOneElementOfType(
                        ResourceTimeoutException.class));
    }

    @Test
    void transcoderFailureSurfacesWhenProducersAreJoined() throws Exception {
        Asset asset = scaledAsset();
        StageDecision decision = planner.plan(asset, Topology.FULL_REFERENCE, "X_1");
        transcoder.failWith(1);
        StageOrchestrator stages = orchestrator(new DelayedPipeFactory(0), ExecutionProperties.defaults());
        StageHandles handles = stages.newHandles();
        stages.teardown(decision);

        // the failed producer removes its pipe, so the failure may surface while waiting for it
        assertThatThrownBy(() -> {
            stages.openTranscode(asset, decision, handles);
            handles.awaitProducers(Duration.ofSeconds(5));
        })
                .isInstanceOf(ExternalProcessException.class)
                .hasMessageContaining("Non-zero exit: 1");
        await().atMost(2, TimeUnit.SECONDS).until(() -> Files.notExists(decision.workfile(DISTORTED)));
    }

    @Test
    void abortInterruptsBlockedProducers() throws Exception {
        Asset asset = scaledAsset();
        StageDecision decision = planner.plan(asset, Topology.FULL_REFERENCE, "X_1");
        DelayedPipeFactory slow = new DelayedPipeFactory(10_000);
        StageOrchestrator stages = orchestrator(slow, ExecutionProperties.defaults().withPipePolling(1, 10));
        StageHandles handles = stages.newHandles();
        stages.teardown(decision);
        assertThatThrownBy(() -> stages.openTranscode(asset, decision, handles))
                .isInstanceOf(ResourceTimeoutException.class);

        handles.abort();

        assertThat(handles.isEmpty()).isTrue();
        pool.shutdown();
        assertThat(pool.awaitTermination(2, TimeUnit.SECONDS)).isTrue();
        assertThat(slow.created()).isEmpty();
    }

    @Test
    void materializedTransformChainsOntoWorkfile() throws Exception {
        Asset base = scaledAsset();
        FrameCallback half = FrameCallback.named("half", luma -> {
            for (int i = 0; i < luma.length; i++) {
                luma[i] = luma[i] / 2;
            }
            return luma;
        });
        Asset asset = Asset.builder("d", 0, 0)
                .distorted(base.stream(DISTORTED).withCallback(half))
                .computeGeometry(COMPUTE)
                .workdirRoot(tmp.resolve("work"))
                .build();
        StageDecision decision = planner.plan(asset, Topology.NO_REFERENCE, "X_1");
        StageOrchestrator stages = orchestrator(new DelayedPipeFactory(0),
                ExecutionProperties.defaults().withStreamingMode(false));
        StageHandles handles = stages.newHandles();

        stages.teardown(decision);
        stages.openTranscode(asset, decision, handles);
        stages.openTransform(asset, decision, handles);

        assertThat(decision.procfile(DISTORTED)).isRegularFile();
        assertThat(Files.size(decision.procfile(DISTORTED)))
                .isEqualTo(2 * PixelFormat.YUV420P.frameBytes(COMPUTE));

        stages.removeOutputs(decision);
        assertThat(decision.workfile(DISTORTED)).doesNotExist();
        assertThat(decision.procfile(DISTORTED)).doesNotExist();
        assertThat(asset.stream(DISTORTED).path()).exists();
    }

    @Test
    void streamingProducersCarryNothingWhenNoStageIsNeeded() throws Exception {
        Path dis = RawFiles.write(tmp.resolve("plain.yuv"), NATIVE, PixelFormat.YUV420P, 1, 0.5f);
        Asset asset = Asset.builder("d", 0, 0)
                .distorted(StreamSpec.raw(dis, NATIVE, PixelFormat.YUV420P))
                .workdirRoot(tmp.resolve("work"))
                .build();
        StageDecision decision = planner.plan(asset, Topology.NO_REFERENCE, "X_1");
        StageOrchestrator stages = orchestrator(new DelayedPipeFactory(0), ExecutionProperties.defaults());
        StageHandles handles = stages.newHandles();

        stages.teardown(decision);
        stages.openTranscode(asset, decision, handles);
        stages.openTransform(asset, decision, handles);
        stages.refresh(asset, decision, handles);

        assertThat(handles.isEmpty()).isTrue();
        assertThat(transcoder.invocations()).isZero();
    }

    @Test
    void streamingRunReservesOneSlotPerProducer() throws Exception {
        Asset asset = scaledAsset();
        StageDecision decision = planner.plan(asset, Topology.FULL_REFERENCE, "X_1");
        StageSlots slots = new StageSlots(4);
        StageOrchestrator streaming = new StageOrchestrator(transcoder, new DelayedPipeFactory(0), stageExecutor,
                ExecutionProperties.defaults(), slots);
        StageOrchestrator materialized = new StageOrchestrator(transcoder, new DelayedPipeFactory(0), stageExecutor,
                ExecutionProperties.defaults().withStreamingMode(false), slots);

        try (StageSlots.Reservation held = streaming.reserve(decision)) {
            assertThat(slots.availableSlots()).isEqualTo(2);
            materialized.reserve(decision).close();
            assertThat(slots.availableSlots()).isEqualTo(2);
        }
        assertThat(slots.availableSlots()).isEqualTo(4);
    }
}
