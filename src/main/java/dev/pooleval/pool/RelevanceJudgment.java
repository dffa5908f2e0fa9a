package dev.pooleval.pool;

import java.time.Instant;
import org.jspecify.annotations.Nullable;

/**
 * A graded relevance judgment for one (query, document) pair.
 *
 * <p>A null {@code relevance} records a classification attempt that failed; {@code notes} then
 * carries the error. Such judgments count as unjudged when a labeling run resumes.
 *
 * @param query the query text
 * @param docId the judged document
 * @param relevance relevance grade: 0 = not relevant, 1 = partially relevant, 2 = highly relevant
 * @param labeledBy who produced the judgment (model label or annotator name)
 * @param labeledAt when the judgment was produced
 * @param notes judge reasoning, or the error message of a failed attempt
 */
public record RelevanceJudgment(
    String query,
    String docId,
    @Nullable Integer relevance,
    String labeledBy,
    Instant labeledAt,
    @Nullable String notes) {

  public static final int MAX_GRADE = 2;

  public RelevanceJudgment {
    if (relevance != null && (relevance < 0 || relevance > MAX_GRADE)) {
      throw new IllegalArgumentException("Grade must be 0, 1, or 2 but was " + relevance);
    }
  }

  /** Creates the null-grade judgment that records a failed classification. */
  public static RelevanceJudgment failed(
      DocumentKey key, String labeledBy, Instant labeledAt, String error) {
    return new RelevanceJudgment(key.query(), key.docId(), null, labeledBy, labeledAt, error);
  }

  public DocumentKey key() {
    return new DocumentKey(query, docId);
  }

  /** True when this judgment carries a usable grade. */
  public boolean isJudged() {
    return relevance != null;
  }
}
