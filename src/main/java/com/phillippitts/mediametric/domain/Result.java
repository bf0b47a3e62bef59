package com.phillippitts.mediametric.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable outcome of one successful computation over an asset.
 *
 * @param asset      asset the scores belong to
 * @param executorId identity of the computation configuration that produced them
 * @param scores     per-frame score lists keyed by score name, in insertion order
 */
public record Result(
        Asset asset,
        String executorId,
        Map<String, List<Double>> scores
) {

    public Result {
        Objects.requireNonNull(asset, "Asset must not be null");
        Objects.requireNonNull(executorId, "Executor id must not be null");
        Objects.requireNonNull(scores, "Scores must not be null");
        Map<String, List<Double>> copy = new LinkedHashMap<>();
        scores.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        scores = Collections.unmodifiableMap(copy);
    }

    /**
     * Per-frame scores for {@code key}.
     *
     * @throws IllegalArgumentException if no such score exists
     */
    public List<Double> frameScores(String key) {
        List<Double> values = scores.get(key);
        if (values == null) {
            throw new IllegalArgumentException("No score named '" + key + "' in result for " + executorId);
        }
        return values;
    }

    /**
     * Arithmetic mean of the per-frame scores for {@code key}.
     *
     * @throws IllegalArgumentException if no such score exists or the list is empty
     */
    public double aggregate(String key) {
        List<Double> values = frameScores(key);
        if (values.isEmpty()) {
            throw new IllegalArgumentException("Score '" + key + "' has no frames");
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.size();
    }

    public Result withScores(Map<String, List<Double>> newScores) {
        return new Result(asset, executorId, newScores);
    }
}
