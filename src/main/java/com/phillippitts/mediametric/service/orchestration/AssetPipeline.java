package com.phillippitts.mediametric.service.orchestration;

import com.phillippitts.mediametric.config.execution.ExecutionProperties;
import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.domain.Topology;
import com.phillippitts.mediametric.exception.MediaMetricException;
import com.phillippitts.mediametric.identity.ExecutorIdentity;
import com.phillippitts.mediametric.identity.RunArtifacts;
import com.phillippitts.mediametric.service.cache.CacheLease;
import com.phillippitts.mediametric.service.cache.CacheMissPolicy;
import com.phillippitts.mediametric.service.cache.ResultCache;
import com.phillippitts.mediametric.service.metrics.RunMetricsPublisher;
import com.phillippitts.mediametric.service.orchestration.event.AssetRunFailedEvent;
import com.phillippitts.mediametric.service.plugin.ComputationPlugin;
import com.phillippitts.mediametric.service.plugin.ExecutionContext;
import com.phillippitts.mediametric.service.plugin.ScoreLog;
import com.phillippitts.mediametric.service.stage.StageDecision;
import com.phillippitts.mediametric.service.stage.StageHandles;
import com.phillippitts.mediametric.service.stage.StageOrchestrator;
import com.phillippitts.mediametric.service.stage.StagePlanner;
import com.phillippitts.mediametric.service.stage.StageSlots;
import com.phillippitts.mediametric.service.validation.AssetValidator;
import com.phillippitts.mediametric.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs one computation over one asset.
 *
 * <p>State order, no cycles:
 * <pre>
 * CACHE_CHECK -> hit: DONE
 *             -> miss: VALIDATE -> PATH_RESOLVE -> TEARDOWN -> OPEN_TRANSCODE -> OPEN_TRANSFORM
 *                      -> LOG_INIT -> COMPUTE -> READ_RESULT -> CACHE_SAVE -> CLEANUP -> DONE
 * </pre>
 * Stage decisions are frozen in PATH_RESOLVE and read by every later state, including cleanup.
 * A failure aborts stage producers, removes what the run created and never caches anything.
 * A successful run keeps its stage outputs and score log for inspection when workdir deletion
 * is turned off.
 *
 * <p>The topology comes from the plugin; the same engine serves full- and no-reference runs.
 * Thread-safe: concurrent calls for distinct assets share no mutable state.
 */
public final class AssetPipeline {

    private static final Logger LOG = LogManager.getLogger(AssetPipeline.class);

    static final String MDC_ASSET = "asset";
    static final String MDC_EXECUTOR = "executorId";

    private final ComputationPlugin plugin;
    private final String executorId;
    private final Map<String, Object> optionalParams;
    private final Map<String, Object> optionalParams2;
    private final ResultCache cache;
    private final AssetValidator validator;
    private final StagePlanner planner;
    private final StageOrchestrator stages;
    private final ExecutionProperties execution;
    private final RunMetricsPublisher metrics;
    private final ApplicationEventPublisher events;

    AssetPipeline(ComputationPlugin plugin,
                  Map<String, Object> optionalParams,
                  Map<String, Object> optionalParams2,
                  ResultCache cache,
                  AssetValidator validator,
                  StagePlanner planner,
                  StageOrchestrator stages,
                  ExecutionProperties execution,
                  RunMetricsPublisher metrics,
                  ApplicationEventPublisher events) {
        this.plugin = Objects.requireNonNull(plugin, "plugin");
        this.optionalParams = copyOf(optionalParams);
        this.optionalParams2 = copyOf(optionalParams2);
        this.executorId = ExecutorIdentity.of(plugin.type(), plugin.version(), this.optionalParams).id();
        this.cache = Objects.requireNonNull(cache, "cache");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.stages = Objects.requireNonNull(stages, "stages");
        this.execution = Objects.requireNonNull(execution, "execution");
        this.metrics = metrics == null ? RunMetricsPublisher.NOOP : metrics;
        this.events = events;
    }

    public String executorId() {
        return executorId;
    }

    public Topology topology() {
        return plugin.topology();
    }

    /**
     * Structural and dependency checks only; touches nothing, not even the sources.
     */
    public void validate(Asset asset) {
        validator.validate(asset, topology());
    }

    /**
     * Runs the state machine for {@code asset}.
     *
     * @return the post-processed result, from the cache or freshly computed
     */
    public Result run(Asset asset) {
        Map<String, String> previous = ThreadContext.getImmutableContext();
        ThreadContext.put(MDC_ASSET, asset.toString());
        ThreadContext.put(MDC_EXECUTOR, executorId);
        try {
            LOG.debug("State {}", AssetRunState.CACHE_CHECK);
            Result cached = cache.load(asset, executorId).orElse(null);
            if (cached != null) {
                LOG.info("Cache hit for {}", executorId);
                metrics.recordCacheHit(plugin.type());
                return plugin.postProcess(cached);
            }
            LOG.info("Cache miss for {}", executorId);
            if (execution.cacheMissPolicy() == CacheMissPolicy.SERIALIZE_MISSES) {
                try (CacheLease lease = cache.lease(asset, executorId)) {
                    Result raced = cache.load(asset, executorId).orElse(null);
                    if (raced != null) {
                        LOG.info("Result for {} appeared while waiting for the cache lease", executorId);
                        metrics.recordCacheHit(plugin.type());
                        return plugin.postProcess(raced);
                    }
                    return plugin.postProcess(compute(asset));
                }
            }
            return plugin.postProcess(compute(asset));
        } finally {
            ThreadContext.clearMap();
            if (previous != null && !previous.isEmpty()) {
                ThreadContext.putAll(previous);
            }
        }
    }

    /**
     * Deletes the cached result and any retained workfiles of {@code asset}.
     */
    public void removeResult(Asset asset) {
        cache.delete(asset, executorId);
        for (StreamRole role : StreamRole.values()) {
            cache.deleteWorkfile(asset, executorId, role);
        }
    }

    private Result compute(Asset asset) {
        long start = System.nanoTime();
        AssetRunState state = AssetRunState.VALIDATE;
        StageDecision decision = null;
        StageHandles handles = stages.newHandles();
        StageSlots.Reservation reservation = null;
        Path logPath = RunArtifacts.logPath(asset, executorId);
        try {
            enter(state);
            validator.validate(asset, topology());
            validator.validateSources(asset, topology());

            state = enter(AssetRunState.PATH_RESOLVE);
            decision = planner.plan(asset, topology(), executorId);
            LOG.debug("Stage plan: {}", decision);

            state = enter(AssetRunState.TEARDOWN);
            stages.teardown(decision);
            reservation = stages.reserve(decision);

            state = enter(AssetRunState.OPEN_TRANSCODE);
            stages.openTranscode(asset, decision, handles);

            state = enter(AssetRunState.OPEN_TRANSFORM);
            stages.openTransform(asset, decision, handles);

            state = enter(AssetRunState.LOG_INIT);
            initLog(logPath);

            state = enter(AssetRunState.COMPUTE);
            StageDecision frozen = decision;
            ExecutionContext context = new ExecutionContext(asset, executorId, decision, logPath,
                    optionalParams, optionalParams2, () -> stages.refresh(asset, frozen, handles));
            plugin.generateResult(context);
            handles.awaitProducers(execution.producerJoinTimeout());

            state = enter(AssetRunState.READ_RESULT);
            Result result = plugin.readResult(context);

            state = enter(AssetRunState.CACHE_SAVE);
            cache.save(result);
            if (execution.saveWorkfiles()) {
                for (StreamRole role : decision.roles()) {
                    cache.saveWorkfile(asset, executorId, role, decision.workfile(role));
                }
            }

            state = enter(AssetRunState.CLEANUP);
            if (execution.deleteWorkdir()) {
                removeArtifacts(asset, decision, logPath);
            } else {
                LOG.info("Run artifacts kept in {}", decision.runDir());
            }

            enter(AssetRunState.DONE);
            long elapsed = System.nanoTime() - start;
            metrics.recordSuccess(plugin.type(), elapsed);
            LOG.info("Computed {} in {} ms", executorId, TimeUtils.nanosToMillis(elapsed));
            return result;
        } catch (RuntimeException e) {
            RuntimeException failure = rootFailure(e, handles);
            handles.abort();
            if (decision != null) {
                removeArtifacts(asset, decision, logPath);
            }
            LOG.warn("Asset failed in state {}: {}", state, failure.getMessage());
            metrics.recordFailure(plugin.type(), failure);
            publishFailure(asset, state, failure);
            throw failure;
        } finally {
            if (reservation != null) {
                reservation.close();
            }
        }
    }

    /**
     * A consumer that fails because its producer died reports the producer's error, with its own
     * attached as suppressed.
     */
    private static RuntimeException rootFailure(RuntimeException e, StageHandles handles) {
        Optional<Throwable> cause = handles.failedProducerCause();
        if (cause.isPresent() && cause.get() != e && cause.get() instanceof RuntimeException producer) {
            producer.addSuppressed(e);
            return producer;
        }
        return e;
    }

    private static Map<String, Object> copyOf(Map<String, Object> params) {
        return params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    private static AssetRunState enter(AssetRunState state) {
        LOG.debug("State {}", state);
        return state;
    }

    private void initLog(Path logPath) {
        try {
            Files.createDirectories(logPath.getParent());
            Files.deleteIfExists(logPath);
            ScoreLog.init(logPath, executorId);
        } catch (IOException e) {
            throw new MediaMetricException("Cannot initialize score log " + logPath, e);
        }
    }

    /**
     * Removes stage outputs and the score log, then the run directory and the asset's working
     * directory when they are left empty. Sources are never touched.
     */
    private void removeArtifacts(Asset asset, StageDecision decision, Path logPath) {
        stages.removeOutputs(decision);
        try {
            Files.deleteIfExists(logPath);
        } catch (IOException e) {
            LOG.warn("Could not remove score log {}: {}", logPath, e.toString());
        }
        if (!execution.deleteWorkdir()) {
            return;
        }
        deleteIfEmpty(decision.runDir());
        deleteIfEmpty(asset.workdir());
    }

    private static void deleteIfEmpty(Path dir) {
        try {
            Files.delete(dir);
        } catch (DirectoryNotEmptyException | NoSuchFileException e) {
            LOG.debug("Directory {} kept: {}", dir, e.getClass().getSimpleName());
        } catch (IOException e) {
            LOG.warn("Could not remove directory {}: {}", dir, e.toString());
        }
    }

    private void publishFailure(Asset asset, AssetRunState state, RuntimeException e) {
        if (events == null) {
            return;
        }
        try {
            events.publishEvent(new AssetRunFailedEvent(asset.toString(), executorId, state.name(),
                    RunMetricsPublisher.categorize(e), e.getMessage(), Instant.now()));
        } catch (RuntimeException publishError) {
            LOG.warn("Failed to publish failure event: {}", publishError.toString());
        }
    }
}
