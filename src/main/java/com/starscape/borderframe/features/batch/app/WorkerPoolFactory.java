package com.starscape.borderframe.features.batch.app;

import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Creates the fixed-size worker pool of a batch.
 */
@FunctionalInterface
public interface WorkerPoolFactory {

    WorkerPoolFactory FIXED_THREAD_POOL = workers ->
        Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("frame-worker-"));

    ExecutorService create(int workers);
}
