package dev.pooleval.labeling;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on an asynchronous labeling run.
 *
 * @param runId      key for {@link LabelingProgressTracker#getProgress(String)}
 * @param completion completes with the run report once every scheduled call has settled
 */
public record LabelingRun(String runId, CompletableFuture<LabelingReport> completion) {}
