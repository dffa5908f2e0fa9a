package dev.pooleval.pool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * A unique (query, document) entry of a depth-K pool with per-method provenance.
 *
 * <p>Built once by {@link PoolMerger}. The only change afterwards is attaching a judgment via
 * {@link #withJudgment(RelevanceJudgment)}, which returns a new instance.
 *
 * @param key the (query, docId) identity
 * @param foundByMethods methods whose top-K list contained the document, in configured method order
 * @param methodHits rank and score per method that found the document; methods absent here did not
 *     find it within depth K
 * @param partition optional query population tag
 * @param contentFields pass-through content columns of the first contributing row
 * @param judgment the attached relevance judgment, or null when unjudged
 */
public record PooledDocument(
    DocumentKey key,
    List<String> foundByMethods,
    Map<String, MethodHit> methodHits,
    @Nullable String partition,
    Map<String, String> contentFields,
    @Nullable RelevanceJudgment judgment) {

  public PooledDocument {
    if (foundByMethods == null || foundByMethods.isEmpty()) {
      throw new IllegalArgumentException("foundByMethods must not be empty for " + key);
    }
    foundByMethods = List.copyOf(foundByMethods);
    methodHits = Collections.unmodifiableMap(new LinkedHashMap<>(methodHits));
    contentFields =
        contentFields == null
            ? Map.of()
            : Collections.unmodifiableMap(new TreeMap<>(contentFields));
  }

  public String query() {
    return key.query();
  }

  public String docId() {
    return key.docId();
  }

  public int numMethodsFound() {
    return foundByMethods.size();
  }

  /** Rank assigned by {@code method}, or null when the method did not find the document. */
  public @Nullable Integer rankFor(String method) {
    MethodHit hit = methodHits.get(method);
    return hit == null ? null : hit.rank();
  }

  /** Score assigned by {@code method}, or null when not found or the score was degraded. */
  public @Nullable Double scoreFor(String method) {
    MethodHit hit = methodHits.get(method);
    return hit == null ? null : hit.score();
  }

  /** Relevance grade of the attached judgment, or null when unjudged or the judgment failed. */
  public @Nullable Integer relevance() {
    return judgment == null ? null : judgment.relevance();
  }

  public boolean isJudged() {
    return judgment != null && judgment.isJudged();
  }

  public PooledDocument withJudgment(@Nullable RelevanceJudgment newJudgment) {
    return new PooledDocument(
        key, foundByMethods, methodHits, partition, contentFields, newJudgment);
  }
}
