package com.phillippitts.mediametric.service.plugin;

import com.phillippitts.mediametric.domain.Result;
import com.phillippitts.mediametric.domain.Topology;

/**
 * A feature extractor or quality metric run by the per-asset pipeline.
 *
 * <p>The pipeline prepares the input streams, writes the executor id as the first line of the
 * score log and then calls {@link #generateResult} followed by {@link #readResult}. Plugins
 * must be stateless with respect to individual runs: one instance serves many assets
 * concurrently.
 */
public interface ComputationPlugin {

    /**
     * Computation type, first component of the executor id.
     */
    String type();

    /**
     * Computation version, second component of the executor id.
     */
    String version();

    /**
     * Stream roles the computation consumes.
     */
    Topology topology();

    /**
     * Runs the computation on the prepared procfiles and appends per-frame scores to the log.
     *
     * @throws com.phillippitts.mediametric.exception.ComputeException on failure
     */
    void generateResult(ExecutionContext context);

    /**
     * Parses the score log written by {@link #generateResult}.
     *
     * @throws com.phillippitts.mediametric.exception.ResultParseException on a malformed log
     */
    Result readResult(ExecutionContext context);

    /**
     * Optional transform applied to every result returned to the caller, including cache hits.
     */
    default Result postProcess(Result result) {
        return result;
    }
}
