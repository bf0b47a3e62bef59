package com.phillippitts.mediametric.service.cache;

import com.phillippitts.mediametric.domain.Asset;
import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.domain.StreamRole;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Stores results keyed by (asset, executor id), plus optional retained workfiles.
 *
 * <p>Implementations must tolerate concurrent callers. A save replaces any previous entry.
 */
public interface ResultCache {

    Optional<Result> load(Asset asset, String executorId);

    void save(Result result);

    void delete(Asset asset, String executorId);

    /**
     * Retains a copy of a workfile, tagged by stream role.
     */
    void saveWorkfile(Asset asset, String executorId, StreamRole role, Path workfile);

    void deleteWorkfile(Asset asset, String executorId, StreamRole role);

    boolean hasWorkfile(Asset asset, String executorId, StreamRole role);

    /**
     * Takes an exclusive hold on one entry. The default holds nothing.
     */
    default CacheLease lease(Asset asset, String executorId) {
        return CacheLease.NONE;
    }
}
