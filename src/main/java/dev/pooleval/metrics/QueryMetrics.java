package dev.pooleval.metrics;

import dev.pooleval.error.MissingDataException;
import org.jspecify.annotations.Nullable;

/**
 * Metric values of one method for one query at cutoff K.
 *
 * @param method the retrieval method
 * @param query the query text
 * @param k the cutoff
 * @param coverage whether K lies within the pooling depth
 * @param numResults documents the method ranked for the query within the pool
 * @param numRelevant documents judged relevant for the query in the pool
 * @param scores the metric values, or null when the cell is missing
 */
public record QueryMetrics(
    String method,
    String query,
    int k,
    Coverage coverage,
    int numResults,
    int numRelevant,
    @Nullable MetricScores scores) {

  /** True when the method returned nothing for this query, so no value can be measured. */
  public boolean isMissing() {
    return scores == null;
  }

  /**
   * Returns the value of {@code metric}.
   *
   * @throws MissingDataException if the cell is missing
   */
  public double valueOrThrow(Metric metric) {
    if (scores == null) {
      throw new MissingDataException(
          "No results from method '%s' for query '%s'; %s@%d is unmeasurable"
              .formatted(method, query, metric.columnName(), k));
    }
    return scores.get(metric);
  }
}
