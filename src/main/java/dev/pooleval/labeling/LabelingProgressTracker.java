package dev.pooleval.labeling;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker for labeling run progress.
 *
 * <p>Maintains a {@link ConcurrentHashMap} of {@link LabelingProgress} snapshots keyed by run ID.
 * Each update atomically reads the current state, creates a new immutable record with the
 * updated field, and writes it back using {@code computeIfPresent()}.
 *
 * <p>Progress data is transient; the judgment store is the durable record of a run.
 */
@Component
public class LabelingProgressTracker {

    static final int MAX_SAMPLED_ERRORS = 5;

    private final ConcurrentHashMap<String, LabelingProgress> activeRuns = new ConcurrentHashMap<>();
    private final Clock clock;

    public LabelingProgressTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Start tracking a new run.
     *
     * @param runId        the run identifier
     * @param totalPending number of documents scheduled
     */
    public void startRun(String runId, int totalPending) {
        activeRuns.put(runId, new LabelingProgress(
                runId,
                LabelingProgress.Status.RUNNING,
                0,
                0,
                totalPending,
                List.of(),
                clock.instant()
        ));
    }

    /**
     * Record that a call produced a grade.
     *
     * @param runId the run identifier
     */
    public void recordCompleted(String runId) {
        activeRuns.computeIfPresent(runId, (id, progress) ->
                new LabelingProgress(
                        progress.runId(),
                        progress.status(),
                        progress.completed() + 1,
                        progress.failed(),
                        progress.totalPending(),
                        progress.sampledErrors(),
                        progress.startedAt()
                )
        );
    }

    /**
     * Record that a call failed. The message is sampled if it is new and fewer than five
     * distinct messages have been kept.
     *
     * @param runId the run identifier
     * @param error the error message
     */
    public void recordFailed(String runId, String error) {
        activeRuns.computeIfPresent(runId, (id, progress) -> {
            List<String> errors = progress.sampledErrors();
            if (errors.size() < MAX_SAMPLED_ERRORS && !errors.contains(error)) {
                errors = new ArrayList<>(errors);
                errors.add(error);
            }
            return new LabelingProgress(
                    progress.runId(),
                    progress.status(),
                    progress.completed(),
                    progress.failed() + 1,
                    progress.totalPending(),
                    errors,
                    progress.startedAt()
            );
        });
    }

    /** Mark a run as completed. */
    public void completeRun(String runId) {
        updateStatus(runId, LabelingProgress.Status.COMPLETED);
    }

    /** Mark a run as failed. */
    public void failRun(String runId) {
        updateStatus(runId, LabelingProgress.Status.FAILED);
    }

    private void updateStatus(String runId, LabelingProgress.Status status) {
        activeRuns.computeIfPresent(runId, (id, progress) ->
                new LabelingProgress(
                        progress.runId(),
                        status,
                        progress.completed(),
                        progress.failed(),
                        progress.totalPending(),
                        progress.sampledErrors(),
                        progress.startedAt()
                )
        );
    }

    /**
     * Get the current progress snapshot for a run.
     *
     * @param runId the run to check
     * @return progress snapshot, or empty if not tracking this run
     */
    public Optional<LabelingProgress> getProgress(String runId) {
        return Optional.ofNullable(activeRuns.get(runId));
    }

    public void removeRun(String runId) {
        activeRuns.remove(runId);
    }
}
