package dev.pooleval.labeling;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a labeling run.
 *
 * @param totalDocuments      documents in the pool
 * @param alreadyJudged       documents that carried a grade before the run
 * @param pending             documents not yet judged (before any limit)
 * @param attempted           documents actually submitted to the judge
 * @param labeled             submissions that produced a grade
 * @param failed              submissions that failed or timed out
 * @param sampledErrors       up to five distinct failure messages
 * @param gradeDistribution   count per grade over the whole pool after the run
 * @param totalJudgedAfterRun pool documents carrying a grade after the run
 * @param elapsed             wall-clock duration of the run
 */
public record LabelingReport(
        int totalDocuments,
        int alreadyJudged,
        int pending,
        int attempted,
        int labeled,
        int failed,
        List<String> sampledErrors,
        Map<Integer, Integer> gradeDistribution,
        int totalJudgedAfterRun,
        Duration elapsed
) {

    public LabelingReport {
        sampledErrors = List.copyOf(sampledErrors);
        gradeDistribution = Map.copyOf(gradeDistribution);
    }

    /** Fraction of attempted documents that were labeled; 1.0 when nothing was attempted. */
    public double successRate() {
        return attempted == 0 ? 1.0 : (double) labeled / attempted;
    }

    public int remaining() {
        return totalDocuments - totalJudgedAfterRun;
    }
}
