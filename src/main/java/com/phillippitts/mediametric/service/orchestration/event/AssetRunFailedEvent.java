package com.phillippitts.mediametric.service.orchestration.event;

import java.time.Instant;

/**
 * Emitted when one asset's pipeline fails.
 *
 * @param asset      canonical string form of the asset
 * @param executorId identity of the computation
 * @param state      pipeline state the failure occurred in
 * @param category   error category (see {@code RunMetricsPublisher.categorize})
 * @param message    error message
 * @param timestamp  when the failure was observed
 */
public record AssetRunFailedEvent(
        String asset,
        String executorId,
        String state,
        String category,
        String message,
        Instant timestamp
) {}
