package com.phillippitts.mediametric.service.cache;

import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.exception.MediaMetricException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local {@link ResultCache}. Leases are plain in-process locks.
 */
public final class InMemoryResultCache implements ResultCache {

    private final Map<String, Result> results = new ConcurrentHashMap<>();
    private final Map<String, byte[]> workfiles = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> leases = new ConcurrentHashMap<>();

    @Override
    public Optional<Result> load(Asset asset, String executorId) {
        return Optional.ofNullable(results.get(key(asset, executorId)));
    }

    @Override
    public void save(Result result) {
        results.put(key(result.asset(), result.executorId()), result);
    }

    @Override
    public void delete(Asset asset, String executorId) {
        results.remove(key(asset, executorId));
    }

    @Override
    public void saveWorkfile(Asset asset, String executorId, StreamRole role, Path workfile) {
        try {
            workfiles.put(key(asset, executorId) + role.artifactSuffix(), Files.readAllBytes(workfile));
        } catch (IOException e) {
            throw new MediaMetricException("Cannot retain workfile " + workfile, e);
        }
    }

    @Override
    public void deleteWorkfile(Asset asset, String executorId, StreamRole role) {
        workfiles.remove(key(asset, executorId) + role.artifactSuffix());
    }

    @Override
    public boolean hasWorkfile(Asset asset, String executorId, StreamRole role) {
        return workfiles.containsKey(key(asset, executorId) + role.artifactSuffix());
    }

    @Override
    public CacheLease lease(Asset asset, String executorId) {
        ReentrantLock lock = leases.computeIfAbsent(key(asset, executorId), k -> new ReentrantLock());
        lock.lock();
        return lock::unlock;
    }

    public int size() {
        return results.size();
    }

    private static String key(Asset asset, String executorId) {
        return executorId + "/" + asset;
    }
}
