package dev.pooleval.pool;

import java.util.List;

/**
 * Row-level accounting of a pooling run, kept apart from the pool itself.
 *
 * @param rowsRead total input rows seen
 * @param rowsSkipped rows rejected by validation (missing query, docId or rank)
 * @param scoresDegraded rows whose score was absent or non-numeric and pooled as null
 * @param duplicatesOverwritten repeated (query, docId, method) rows replaced by a later occurrence
 * @param sampledErrors up to five validation messages for diagnostics
 */
public record PoolingReport(
    int rowsRead,
    int rowsSkipped,
    int scoresDegraded,
    int duplicatesOverwritten,
    List<String> sampledErrors) {

  public PoolingReport {
    sampledErrors = List.copyOf(sampledErrors);
  }
}
