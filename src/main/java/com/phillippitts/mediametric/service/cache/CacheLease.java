package com.phillippitts.mediametric.service.cache;

/**
 * Exclusive hold on one cache entry, released by {@link #close()}.
 */
@FunctionalInterface
public interface CacheLease extends AutoCloseable {

    CacheLease NONE = () -> { };

    @Override
    void close();
}
