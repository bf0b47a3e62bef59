package com.phillippitts.mediametric.service.stage;

import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.exception.MediaMetricException;
import com.phillippitts.mediametric.exception.ResourceTimeoutException;
import com.phillippitts.mediametric.service.transcode.TranscodeRequest;
import com.phillippitts.mediametric.service.transcode.Transcoder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.AsyncTaskExecutor;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Future;

/**
 * Opens, tears down and removes the transcode and sample-transform stages of one asset.
 *
 * <p>In materialized mode a stage runs to completion on the calling thread and leaves an
 * ordinary file. In streaming mode each stream gets a producer on the stage executor that
 * creates a named pipe at the target path and then writes into it; the caller blocks on a
 * bounded poll until every pipe of the stage exists.
 *
 * <p>Every method acts on the roles of the {@link StageDecision} only.
 */
public final class StageOrchestrator {

    private static final Logger LOG = LogManager.getLogger(StageOrchestrator.class);

    private final Transcoder transcoder;
    private final PipeFactory pipeFactory;
    private final AsyncTaskExecutor stageExecutor;
    private final SampleTransformStage transformStage;
    private final ExecutionProperties execution;
    private final PipeWaiter pipeWaiter;
    private final StageSlots slots;

    public StageOrchestrator(Transcoder transcoder,
                             PipeFactory pipeFactory,
                             AsyncTaskExecutor stageExecutor,
                             ExecutionProperties execution) {
        this(transcoder, pipeFactory, stageExecutor, execution, StageSlots.unbounded());
    }

    public StageOrchestrator(Transcoder transcoder,
                             PipeFactory pipeFactory,
                             AsyncTaskExecutor stageExecutor,
                             ExecutionProperties execution,
                             StageSlots slots) {
        this.transcoder = Objects.requireNonNull(transcoder, "transcoder");
        this.pipeFactory = Objects.requireNonNull(pipeFactory, "pipeFactory");
        this.stageExecutor = Objects.requireNonNull(stageExecutor, "stageExecutor");
        this.execution = Objects.requireNonNull(execution, "execution");
        this.transformStage = new SampleTransformStage();
        this.pipeWaiter = new PipeWaiter(execution.pipePollRetries(), execution.pipePollInterval());
        this.slots = Objects.requireNonNull(slots, "slots");
    }

    public boolean isStreaming() {
        return execution.streamingMode();
    }

    public PipeFactory pipeFactory() {
        return pipeFactory;
    }

    public StageHandles newHandles() {
        return new StageHandles(pipeFactory);
    }

    /**
     * Reserves a stage slot for every producer the decision starts in streaming mode. Blocks
     * while other runs hold the slots. Materialized stages need none.
     */
    public StageSlots.Reservation reserve(StageDecision decision) {
        if (!isStreaming()) {
            return slots.reserve(0);
        }
        return slots.reserve(stageTargets(decision).size());
    }

    /**
     * Removes stale outputs of both stages for every stream, then creates the run directory.
     *
     * <p>All removals are issued before anything is created so that a stream whose target
     * overlaps another stream's cannot have its fresh output deleted.
     */
    public void teardown(StageDecision decision) {
        for (Path target : stageTargets(decision)) {
            try {
                if (Files.deleteIfExists(target)) {
                    LOG.debug("Removed stale stage output {}", target);
                }
            } catch (IOException e) {
                throw new MediaMetricException("Cannot remove stale stage output " + target, e);
            }
        }
        try {
            Files.createDirectories(decision.runDir());
        } catch (IOException e) {
            throw new MediaMetricException("Cannot create run directory " + decision.runDir(), e);
        }
    }

    /**
     * Opens the transcode stage for every stream that needs it.
     */
    public void openTranscode(Asset asset, StageDecision decision, StageHandles handles) {
        List<Path> pipes = new ArrayList<>();
        for (StreamRole role : decision.roles()) {
            StageDecision.RolePlan plan = decision.plan(role);
            if (!plan.transcode()) {
                continue;
            }
            TranscodeRequest request = TranscodeRequest.forStream(asset.stream(role), decision.computeGeometry(),
                    decision.workfileFormat(), plan.workfile());
            if (!isStreaming()) {
                transcoder.transcode(request);
                continue;
            }
            Path pipe = plan.workfile();
            Future<?> future = stageExecutor.submit(() -> {
                try {
                    pipeFactory.create(pipe);
                    transcoder.transcode(request);
                } catch (RuntimeException e) {
                    discard(pipe);
                    throw e;
                }
            });
            handles.add("transcode-" + role.tag(), future, List.of(pipe));
            pipes.add(pipe);
        }
        awaitPipes(pipes, handles);
    }

    /**
     * Opens the sample-transform stage for every stream that needs it.
     */
    public void openTransform(Asset asset, StageDecision decision, StageHandles handles) {
        List<Path> pipes = new ArrayList<>();
        for (StreamRole role : decision.roles()) {
            StageDecision.RolePlan plan = decision.plan(role);
            if (!plan.transform()) {
                continue;
            }
            Path input = plan.workfile();
            Path output = plan.procfile();
            if (!isStreaming()) {
                runTransform(asset, decision, role, input, output);
                continue;
            }
            boolean inputIsPipe = plan.transcode();
            Future<?> future = stageExecutor.submit(() -> {
                try {
                    pipeFactory.create(output);
                    runTransform(asset, decision, role, input, output);
                } catch (RuntimeException e) {
                    discard(output);
                    if (inputIsPipe) {
                        discard(input);
                    }
                    throw e;
                }
            });
            handles.add("transform-" + role.tag(), future, List.of(output));
            pipes.add(output);
        }
        awaitPipes(pipes, handles);
    }

    /**
     * Reopens both stages so the workfiles can be read again. Only streaming stages are consumed
     * by reading; materialized files are left in place.
     */
    public void refresh(Asset asset, StageDecision decision, StageHandles handles) {
        if (!isStreaming() || !decision.anyStage()) {
            return;
        }
        handles.awaitProducers(execution.producerJoinTimeout());
        teardown(decision);
        openTranscode(asset, decision, handles);
        openTransform(asset, decision, handles);
    }

    /**
     * Deletes the outputs of every stage that ran. Sources are never touched. Best-effort.
     */
    public void removeOutputs(StageDecision decision) {
        for (Path target : stageTargets(decision)) {
            try {
                Files.deleteIfExists(target);
            } catch (IOException e) {
                LOG.warn("Could not remove stage output {}: {}", target, e.toString());
            }
        }
    }

    private void runTransform(Asset asset, StageDecision decision, StreamRole role, Path input, Path output) {
        try {
            transformStage.run(input, output, decision.computeGeometry(), decision.workfileFormat(),
                    asset.stream(role).callback());
        } catch (IOException e) {
            throw new MediaMetricException("Sample transform of " + role.tag() + " stream failed: "
                    + e.getMessage(), e);
        }
    }

    private void awaitPipes(List<Path> pipes, StageHandles handles) {
        if (pipes.isEmpty()) {
            return;
        }
        try {
            pipeWaiter.awaitAll(pipes);
        } catch (ResourceTimeoutException e) {
            Optional<Throwable> cause = handles.failedProducerCause();
            if (cause.isPresent() && cause.get() instanceof RuntimeException re) {
                re.addSuppressed(e);
                throw re;
            }
            throw e;
        }
    }

    private static List<Path> stageTargets(StageDecision decision) {
        List<Path> targets = new ArrayList<>();
        for (StreamRole role : decision.roles()) {
            StageDecision.RolePlan plan = decision.plan(role);
            if (plan.transcode()) {
                targets.add(plan.workfile());
            }
            if (plan.transform()) {
                targets.add(plan.procfile());
            }
        }
        return targets;
    }

    /**
     * Unblocks a consumer already waiting on the pipe of a failed producer, then removes the
     * pipe so a consumer arriving later fails on open instead of waiting forever.
     */
    private void discard(Path pipe) {
        try {
            pipeFactory.release(pipe);
            Files.deleteIfExists(pipe);
        } catch (IOException e) {
            LOG.debug("Discard of {} failed: {}", pipe, e.toString());
        }
    }
}
