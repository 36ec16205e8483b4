package com.starscape.borderframe.features.batch.app;

import com.starscape.borderframe.common.config.ProcessingProperties;
import com.starscape.borderframe.features.batch.domain.BatchOutcome;
import com.starscape.borderframe.features.batch.domain.CancellationToken;
import com.starscape.borderframe.features.batch.domain.Job;
import com.starscape.borderframe.features.batch.domain.JobResult;
import com.starscape.borderframe.features.batch.domain.Settings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs one job per source image on a bounded worker pool.
 *
 * Responsibilities:
 * - Submits jobs in input order, never more than the worker count at a time
 * - Stops submitting once the batch is cancelled; submitted jobs still finish and report
 * - Reports progress in completion order and collects per-image errors
 * - Reports the outcome exactly once, after every progress event
 *
 * A failing image never stops the batch, and neither does a failing listener. Problems
 * outside the per-image loop, such as a pool that cannot be created, end up as a single
 * error entry; jobs already running are still waited for and reported.
 */
@Service
public class BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    static final String FATAL_ERROR_TITLE = "Processing Error";

    private final JobProcessor jobProcessor;
    private final WorkerPoolFactory workerPoolFactory;
    private final int maxWorkers;

    @Autowired
    public BatchExecutor(JobProcessor jobProcessor, ProcessingProperties processingProperties) {
        this(jobProcessor, WorkerPoolFactory.FIXED_THREAD_POOL, processingProperties.getMaxWorkers());
    }

    /**
     * @param maxWorkers upper bound on workers, 0 or less to use all available processors
     */
    public BatchExecutor(JobProcessor jobProcessor, WorkerPoolFactory workerPoolFactory, int maxWorkers) {
        this.jobProcessor = jobProcessor;
        this.workerPoolFactory = workerPoolFactory;
        this.maxWorkers = maxWorkers;
    }

    /**
     * Process the sources and block until the batch has drained.
     *
     * @param sources      images to process, in submission order
     * @param outputDir    existing, writable directory for the results
     * @param settings     validated batch settings
     * @param cancellation stop flag observed before each submission and inside each job
     * @param listener     receives progress, fatal and finished events
     * @return the aggregate outcome, also passed to {@link BatchListener#onFinished}
     */
    public BatchOutcome run(List<Path> sources, Path outputDir, Settings settings,
                            CancellationToken cancellation, BatchListener listener) {
        int total = sources.size();
        BatchProgress progress = new BatchProgress(total);
        ExecutorService pool = null;
        CompletionService<JobResult> completions = null;
        int inFlight = 0;

        try {
            int workers = workerCount(total);
            log.info("Starting batch: images={}, workers={}, format={}, outputDir={}",
                total, workers, settings.saveFormat(), outputDir);

            pool = workerPoolFactory.create(workers);
            completions = new ExecutorCompletionService<>(pool);

            for (int index = 0; index < total; index++) {
                // Wait for a free worker, reporting whatever finishes meanwhile
                while (inFlight >= workers) {
                    report(completions, progress, listener);
                    inFlight--;
                }
                if (cancellation.isCancelled()) {
                    log.warn("Batch cancelled after submitting {} of {} images", index, total);
                    break;
                }
                Job job = new Job(sources.get(index), index, total);
                completions.submit(() -> jobProcessor.process(job, settings, outputDir, cancellation));
                inFlight++;
            }
            while (inFlight > 0) {
                report(completions, progress, listener);
                inFlight--;
            }

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Batch interrupted while waiting for workers", e);
            // Running jobs stop at their next checkpoint
            cancellation.cancel();
            drain(completions, inFlight, progress, listener);
            fail(progress, listener, "Processing interrupted");
        } catch (RuntimeException e) {
            log.error("Batch failed outside the per-image loop", e);
            drain(completions, inFlight, progress, listener);
            fail(progress, listener, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        } finally {
            if (pool != null) {
                pool.shutdown();
            }
        }

        BatchOutcome outcome = progress.toOutcome(cancellation.isCancelled());
        log.info("Batch finished: status={}, completed={}/{}, failed={}",
            outcome.status(), outcome.completedCount(), total, outcome.failedCount());
        notifyListener("finished", () -> listener.onFinished(outcome.errors()));
        return outcome;
    }

    /**
     * Run the batch on its own coordinating thread.
     * Listener callbacks are made from that thread.
     */
    public BatchHandle start(List<Path> sources, Path outputDir, Settings settings, BatchListener listener) {
        CancellationToken cancellation = new CancellationToken();
        ExecutorService coordinator = Executors.newSingleThreadExecutor(
            new CustomizableThreadFactory("frame-batch-"));
        CompletableFuture<BatchOutcome> outcome = CompletableFuture.supplyAsync(
            () -> run(List.copyOf(sources), outputDir, settings, cancellation, listener), coordinator);
        outcome.whenComplete((result, error) -> coordinator.shutdown());
        return new BatchHandle(cancellation, outcome);
    }

    /**
     * Worker count: all processors, capped by the job count and the configured maximum, at least one.
     */
    int workerCount(int jobCount) {
        int available = Runtime.getRuntime().availableProcessors();
        if (maxWorkers > 0) {
            available = Math.min(available, maxWorkers);
        }
        return Math.max(1, Math.min(available, jobCount));
    }

    private void report(CompletionService<JobResult> completions, BatchProgress progress,
                        BatchListener listener) throws InterruptedException {
        Future<JobResult> future = completions.take();
        BatchProgress.Snapshot snapshot;
        try {
            snapshot = progress.record(future.get());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Job ended with an unexpected exception", cause);
            snapshot = progress.recordUnexpected("Unexpected error: " + cause.getMessage());
        }
        BatchProgress.Snapshot reported = snapshot;
        notifyListener("progress", () -> listener.onProgress(reported.completedCount(), reported.statusText()));
    }

    /**
     * Wait for jobs that were already submitted when the batch failed, so that each of them
     * is reported and none keeps writing after the outcome is built.
     */
    private void drain(CompletionService<JobResult> completions, int inFlight,
                       BatchProgress progress, BatchListener listener) {
        if (completions == null || inFlight == 0) {
            return;
        }
        log.info("Waiting for {} running job(s) to finish", inFlight);
        boolean interrupted = Thread.interrupted();
        try {
            while (inFlight > 0) {
                try {
                    report(completions, progress, listener);
                    inFlight--;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void fail(BatchProgress progress, BatchListener listener, String message) {
        progress.recordBatchError("Unexpected error: " + message);
        notifyListener("fatal error", () -> listener.onFatalError(FATAL_ERROR_TITLE, message));
    }

    // A misbehaving listener must not stop the batch or lose results
    private void notifyListener(String event, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Batch listener failed on {} event", event, e);
        }
    }
}
