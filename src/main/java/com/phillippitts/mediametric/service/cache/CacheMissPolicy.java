package com.phillippitts.mediametric.service.cache;

/**
 * How concurrent cache misses for the same (asset, executor) across independent runs are handled.
 */
public enum CacheMissPolicy {
    /**
     * Both runs compute; the last save wins. Wasted work, never a wrong result.
     */
    TOLERATE_DUPLICATE_WORK,
    /**
     * A miss takes the cache's exclusive lease and re-checks before computing.
     */
    SERIALIZE_MISSES
}
