package com.phillippitts.mediametric.service.orchestration;

import com.phillippitts.mediametric.domain.Asset;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per distinct asset canonical string, built once per scheduling call.
 *
 * <p>Immutable after construction, so workers may look locks up concurrently.
 */
public final class LockRegistry {

    private final Map<String, Lock> locks;

    private LockRegistry(Map<String, Lock> locks) {
        this.locks = Collections.unmodifiableMap(locks);
    }

    public static LockRegistry of(Collection<Asset> assets) {
        Map<String, Lock> locks = new LinkedHashMap<>();
        for (Asset asset : assets) {
            locks.computeIfAbsent(asset.toString(), k -> new ReentrantLock());
        }
        return new LockRegistry(locks);
    }

    /**
     * Lock shared by every asset with the same canonical string as {@code asset}.
     *
     * @throws IllegalArgumentException if the asset was not part of the registry's batch
     */
    public Lock lockFor(Asset asset) {
        Lock lock = locks.get(asset.toString());
        if (lock == null) {
            throw new IllegalArgumentException("Asset not registered: " + asset);
        }
        return lock;
    }

    /**
     * Number of distinct identities.
     */
    public int size() {
        return locks.size();
    }
}
