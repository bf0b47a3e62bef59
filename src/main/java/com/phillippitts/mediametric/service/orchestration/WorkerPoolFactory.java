package com.phillippitts.mediametric.service.orchestration;

import java.util.concurrent.ExecutorService;

/**
 * Creates the bounded worker pool of one pooled scheduling call. The scheduler shuts it down.
 */
@FunctionalInterface
public interface WorkerPoolFactory {

    ExecutorService create(int workers);
}
