package com.phillippitts.mediametric.service.orchestration;

import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.exception.MediaMetricException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;

/**
 * Runs a pipeline over many assets, sequentially or on a bounded worker pool.
 *
 * <p>Every asset is validated before any work starts; a configuration or dependency problem
 * aborts the whole batch. After that, a failing asset never cancels the others: all work
 * settles first, then the first failure in input order is thrown with the rest attached as
 * suppressed exceptions. Results always come back in input order.
 */
public final class AssetScheduler {

    private static final Logger LOG = LogManager.getLogger(AssetScheduler.class);

    private final WorkerPoolFactory poolFactory;

    public AssetScheduler(WorkerPoolFactory poolFactory) {
        this.poolFactory = Objects.requireNonNull(poolFactory, "poolFactory");
    }

    /**
     * @param pipeline   per-asset state machine
     * @param assets     assets in the order results are returned
     * @param parallel   dispatch to a worker pool instead of the calling thread
     * @param maxWorkers pool bound; zero or negative means host parallelism
     */
    public List<Result> run(AssetPipeline pipeline, List<Asset> assets, boolean parallel, int maxWorkers) {
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(assets, "assets");
        for (Asset asset : assets) {
            pipeline.validate(asset);
        }
        if (assets.isEmpty()) {
            return List.of();
        }
        LockRegistry locks = LockRegistry.of(assets);
        LOG.debug("Scheduling {} assets ({} distinct), parallel={}", assets.size(), locks.size(), parallel);
        return parallel
                ? runPooled(pipeline, assets, locks, effectiveWorkers(maxWorkers, assets.size()))
                : runSequential(pipeline, assets, locks);
    }

    static int effectiveWorkers(int maxWorkers, int assetCount) {
        int bound = maxWorkers > 0 ? maxWorkers : Runtime.getRuntime().availableProcessors();
        return Math.max(1, Math.min(bound, assetCount));
    }

    private List<Result> runSequential(AssetPipeline pipeline, List<Asset> assets, LockRegistry locks) {
        List<Result> results = new ArrayList<>(assets.size());
        List<RuntimeException> failures = new ArrayList<>();
        for (Asset asset : assets) {
            try {
                results.add(runLocked(pipeline, asset, locks.lockFor(asset)));
            } catch (RuntimeException e) {
                failures.add(e);
                results.add(null);
            }
        }
        throwFirst(failures);
        return results;
    }

    private List<Result> runPooled(AssetPipeline pipeline, List<Asset> assets, LockRegistry locks, int workers) {
        ExecutorService pool = poolFactory.create(workers);
        try {
            List<Future<Result>> futures = new ArrayList<>(assets.size());
            for (Asset asset : assets) {
                Lock lock = locks.lockFor(asset);
                futures.add(pool.submit(() -> runLocked(pipeline, asset, lock)));
            }
            List<Result> results = new ArrayList<>(assets.size());
            List<RuntimeException> failures = new ArrayList<>();
            for (Future<Result> future : futures) {
                try {
                    results.add(future.get());
                } catch (ExecutionException e) {
                    failures.add(asRuntime(e.getCause()));
                    results.add(null);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    futures.forEach(f -> f.cancel(true));
                    throw new MediaMetricException("Interrupted while waiting for asset workers", e);
                }
            }
            throwFirst(failures);
            return results;
        } finally {
            pool.shutdown();
        }
    }

    private static Result runLocked(AssetPipeline pipeline, Asset asset, Lock lock) {
        lock.lock();
        try {
            return pipeline.run(asset);
        } finally {
            lock.unlock();
        }
    }

    private static void throwFirst(List<RuntimeException> failures) {
        if (failures.isEmpty()) {
            return;
        }
        RuntimeException first = failures.get(0);
        for (int i = 1; i < failures.size(); i++) {
            first.addSuppressed(failures.get(i));
        }
        LOG.warn("{} asset(s) failed; first failure: {}", failures.size(), first.getMessage());
        throw first;
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new MediaMetricException("Asset worker failed: " + cause, cause);
    }
}
