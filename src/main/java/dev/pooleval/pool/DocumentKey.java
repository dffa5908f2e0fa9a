package dev.pooleval.pool;

import java.util.Comparator;

/**
 * Identity of a pooled document: one row per distinct (query, document id) pair.
 *
 * @param query the query text
 * @param docId the document identifier returned by the search index
 */
public record DocumentKey(String query, String docId) implements Comparable<DocumentKey> {

  private static final Comparator<DocumentKey> ORDER =
      Comparator.comparing(DocumentKey::query).thenComparing(DocumentKey::docId);

  public DocumentKey {
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("query must not be blank");
    }
    if (docId == null || docId.isBlank()) {
      throw new IllegalArgumentException("docId must not be blank");
    }
  }

  @Override
  public int compareTo(DocumentKey other) {
    return ORDER.compare(this, other);
  }
}
