package dev.pooleval.labeling;

import dev.pooleval.error.ConfigurationException;
import java.time.Duration;
import org.jspecify.annotations.Nullable;

/**
 * Options for one labeling run.
 *
 * @param concurrency       maximum number of judge calls outstanding at once
 * @param skipAlreadyJudged when true, documents that already carry a grade are not resubmitted
 * @param limit             label at most this many pending documents (first N in pool order)
 * @param callTimeout       per-call timeout; a call that exceeds it is recorded as failed
 * @param labeledBy         label written into each produced judgment
 */
public record LabelingOptions(
        int concurrency,
        boolean skipAlreadyJudged,
        @Nullable Integer limit,
        Duration callTimeout,
        String labeledBy
) {

    public static final int DEFAULT_CONCURRENCY = 10;
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(120);

    public LabelingOptions {
        if (concurrency < 1) {
            throw new ConfigurationException("concurrency must be >= 1 but was " + concurrency);
        }
        if (limit != null && limit < 0) {
            throw new ConfigurationException("limit must be >= 0 but was " + limit);
        }
        if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
            throw new ConfigurationException("callTimeout must be positive but was " + callTimeout);
        }
        if (labeledBy == null || labeledBy.isBlank()) {
            throw new ConfigurationException("labeledBy must not be blank");
        }
    }

    public static LabelingOptions defaults(String labeledBy) {
        return new LabelingOptions(DEFAULT_CONCURRENCY, true, null, DEFAULT_CALL_TIMEOUT, labeledBy);
    }

    public LabelingOptions withConcurrency(int newConcurrency) {
        return new LabelingOptions(newConcurrency, skipAlreadyJudged, limit, callTimeout, labeledBy);
    }

    public LabelingOptions withSkipAlreadyJudged(boolean skip) {
        return new LabelingOptions(concurrency, skip, limit, callTimeout, labeledBy);
    }

    public LabelingOptions withLimit(@Nullable Integer newLimit) {
        return new LabelingOptions(concurrency, skipAlreadyJudged, newLimit, callTimeout, labeledBy);
    }

    public LabelingOptions withCallTimeout(Duration timeout) {
        return new LabelingOptions(concurrency, skipAlreadyJudged, limit, timeout, labeledBy);
    }
}
