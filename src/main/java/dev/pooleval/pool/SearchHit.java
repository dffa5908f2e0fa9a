package dev.pooleval.pool;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * One row of a retrieval run: a document returned for a query by a single method.
 *
 * <p>Rows come straight from an external result file, so {@code query}, {@code docId} and {@code
 * rank} may be missing on malformed input; {@link PoolMerger} validates them. {@code score} is kept
 * as raw text because non-numeric scores degrade to null rather than rejecting the row.
 *
 * @param query the query text
 * @param docId the returned document identifier
 * @param rank the 1-based rank position within the method's result list
 * @param score the raw retrieval score, if any
 * @param method the retrieval method that produced the row
 * @param partition optional query population tag (e.g. HEAD or TAIL)
 * @param contentFields remaining columns, passed through to the pool unchanged
 */
public record SearchHit(
    @Nullable String query,
    @Nullable String docId,
    @Nullable Integer rank,
    @Nullable String score,
    String method,
    @Nullable String partition,
    Map<String, String> contentFields) {

  public SearchHit {
    contentFields =
        contentFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(contentFields));
  }

  /** Convenience constructor for a hit without partition or content fields. */
  public SearchHit(String query, String docId, int rank, @Nullable Double score, String method) {
    this(query, docId, rank, score == null ? null : String.valueOf(score), method, null, Map.of());
  }
}
