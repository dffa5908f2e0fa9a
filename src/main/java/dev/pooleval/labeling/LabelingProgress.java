package dev.pooleval.labeling;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a labeling run's progress.
 *
 * <p>Created and updated by {@link LabelingProgressTracker} while workers settle calls.
 * Each mutation produces a new record (value semantics for thread safety).
 *
 * @param runId         the labeling run
 * @param status        current run status (RUNNING, COMPLETED, FAILED)
 * @param completed     calls that produced a grade
 * @param failed        calls that failed or timed out
 * @param totalPending  documents scheduled for this run
 * @param sampledErrors up to five distinct error messages
 * @param startedAt     when the run started
 */
public record LabelingProgress(
        String runId,
        Status status,
        int completed,
        int failed,
        int totalPending,
        List<String> sampledErrors,
        Instant startedAt
) {

    public LabelingProgress {
        sampledErrors = sampledErrors == null ? List.of() : List.copyOf(sampledErrors);
    }

    /** Documents whose call has settled, successfully or not. */
    public int settled() {
        return completed + failed;
    }

    public enum Status {
        RUNNING,
        COMPLETED,
        FAILED
    }
}
