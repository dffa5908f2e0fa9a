package dev.pooleval.pool;

import java.util.List;

/**
 * Output of a pooling run.
 *
 * @param documents pooled documents in deterministic order
 * @param methods method identifiers in configured order
 * @param depthK the pooling depth
 * @param report row-level accounting (skipped rows, degraded scores, duplicates)
 */
public record PoolingResult(
    List<PooledDocument> documents, List<String> methods, int depthK, PoolingReport report) {

  public PoolingResult {
    documents = List.copyOf(documents);
    methods = List.copyOf(methods);
  }

  public int size() {
    return documents.size();
  }

  /** Number of distinct queries in the pool. */
  public long queryCount() {
    return documents.stream().map(PooledDocument::query).distinct().count();
  }
}
