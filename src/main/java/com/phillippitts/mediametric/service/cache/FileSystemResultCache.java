package com.phillippitts.mediametric.service.cache;

import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.domain.StreamRole;
import com.phillippitts.mediametric.exception.MediaMetricException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link ResultCache} persisted as JSON files.
 *
 * <p>Layout: {@code <root>/<executorId>/<assetFingerprint>.json}, with retained workfiles
 * next to it as {@code <assetFingerprint>_ref.yuv} / {@code _dis.yuv}. Writes go to a temp
 * file that is atomically moved into place, so readers never see a partial entry and the
 * last save wins. An unreadable entry is treated as a miss.
 */
public final class FileSystemResultCache implements ResultCache {

    private static final Logger LOG = LogManager.getLogger(FileSystemResultCache.class);

    private final Path root;
    // FileChannel locks are per JVM, so threads queue here first
    private final Map<Path, ReentrantLock> localLocks = new ConcurrentHashMap<>();

    public FileSystemResultCache(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Path root() {
        return root;
    }

    @Override
    public Optional<Result> load(Asset asset, String executorId) {
        Path entry = entryPath(asset, executorId);
        if (!Files.isRegularFile(entry)) {
            return Optional.empty();
        }
        try {
            JSONObject json = new JSONObject(Files.readString(entry, StandardCharsets.UTF_8));
            if (!asset.toString().equals(json.getString("asset"))
                    || !executorId.equals(json.getString("executorId"))) {
                LOG.warn("Cache entry {} belongs to a different asset; ignoring", entry);
                return Optional.empty();
            }
            return Optional.of(new Result(asset, executorId, readScores(json.getJSONObject("scores"))));
        } catch (IOException | JSONException | NumberFormatException e) {
            LOG.warn("Unreadable cache entry {}, treating as miss: {}", entry, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public void save(Result result) {
        JSONObject json = new JSONObject();
        json.put("executorId", result.executorId());
        json.put("asset", result.asset().toString());
        JSONObject scores = new JSONObject();
        result.scores().forEach((k, v) -> scores.put(k, writeScores(v)));
        json.put("scores", scores);
        Path entry = entryPath(result.asset(), result.executorId());
        writeAtomically(entry, json.toString(2).getBytes(StandardCharsets.UTF_8));
        LOG.debug("Saved result {} to {}", result.executorId(), entry);
    }

    @Override
    public void delete(Asset asset, String executorId) {
        deleteQuietly(entryPath(asset, executorId));
    }

    @Override
    public void saveWorkfile(Asset asset, String executorId, StreamRole role, Path workfile) {
        Path target = workfilePath(asset, executorId, role);
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            Files.copy(workfile, tmp, StandardCopyOption.REPLACE_EXISTING);
            move(tmp, target);
        } catch (IOException e) {
            throw new MediaMetricException("Cannot retain workfile " + workfile + " as " + target, e);
        }
    }

    @Override
    public void deleteWorkfile(Asset asset, String executorId, StreamRole role) {
        deleteQuietly(workfilePath(asset, executorId, role));
    }

    @Override
    public boolean hasWorkfile(Asset asset, String executorId, StreamRole role) {
        return Files.isRegularFile(workfilePath(asset, executorId, role));
    }

    /**
     * Holds an exclusive lock on the entry's lock file, visible to other processes sharing the root.
     */
    @Override
    public CacheLease lease(Asset asset, String executorId) {
        Path lockFile = executorDir(executorId).resolve(asset.fingerprint() + ".lock");
        ReentrantLock local = localLocks.computeIfAbsent(lockFile, k -> new ReentrantLock());
        local.lock();
        try {
            Files.createDirectories(lockFile.getParent());
            FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.lock();
            } catch (IOException | RuntimeException e) {
                channel.close();
                throw e;
            }
            return () -> {
                try {
                    lock.release();
                    channel.close();
                } catch (IOException e) {
                    LOG.warn("Could not release cache lease {}: {}", lockFile, e.toString());
                } finally {
                    local.unlock();
                }
            };
        } catch (IOException e) {
            local.unlock();
            throw new MediaMetricException("Cannot lease cache entry " + lockFile, e);
        }
    }

    Path entryPath(Asset asset, String executorId) {
        return executorDir(executorId).resolve(asset.fingerprint() + ".json");
    }

    Path workfilePath(Asset asset, String executorId, StreamRole role) {
        return executorDir(executorId).resolve(asset.fingerprint() + role.artifactSuffix() + ".yuv");
    }

    private Path executorDir(String executorId) {
        return root.resolve(executorId);
    }

    /**
     * JSON has no NaN or infinities; those are stored as their {@link Double#toString} text.
     */
    private static JSONArray writeScores(List<Double> values) {
        JSONArray array = new JSONArray();
        for (Double v : values) {
            if (Double.isFinite(v)) {
                array.put(v.doubleValue());
            } else {
                array.put(v.toString());
            }
        }
        return array;
    }

    private static Map<String, List<Double>> readScores(JSONObject json) {
        Map<String, List<Double>> scores = new LinkedHashMap<>();
        for (String key : json.keySet()) {
            JSONArray values = json.getJSONArray(key);
            List<Double> list = new ArrayList<>(values.length());
            for (int i = 0; i < values.length(); i++) {
                Object value = values.get(i);
                list.add(value instanceof String text ? Double.parseDouble(text) : values.getDouble(i));
            }
            scores.put(key, list);
        }
        return scores;
    }

    private static void writeAtomically(Path target, byte[] content) {
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            Files.write(tmp, content);
            move(tmp, target);
        } catch (IOException e) {
            throw new MediaMetricException("Cannot write cache entry " + target, e);
        }
    }

    private static void move(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.warn("Could not delete cache file {}: {}", path, e.toString());
        }
    }
}
