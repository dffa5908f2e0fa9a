package dev.pooleval.metrics;

import dev.pooleval.error.MissingDataException;
import org.jspecify.annotations.Nullable;

/**
 * Unweighted mean of one method's per-query metrics at cutoff K.
 *
 * @param method the retrieval method
 * @param k the cutoff
 * @param coverage whether K lies within the pooling depth
 * @param queriesMeasured queries that contributed to the mean
 * @param queriesMissing evaluated queries excluded because the method returned nothing for them
 * @param mean the mean values, or null when no query could be measured
 */
public record AggregateMetrics(
    String method,
    int k,
    Coverage coverage,
    int queriesMeasured,
    int queriesMissing,
    @Nullable MetricScores mean) {

  public boolean isMissing() {
    return mean == null;
  }

  /**
   * Returns the mean of {@code metric}.
   *
   * @throws MissingDataException if no query could be measured for this method
   */
  public double valueOrThrow(Metric metric) {
    if (mean == null) {
      throw new MissingDataException(
          "Method '%s' has no measurable queries at k=%d".formatted(method, k));
    }
    return mean.get(metric);
  }
}
