package dev.pooleval.pool;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Statistics derived from a pool: per-method contribution, overlap histogram, unique contributions
 * and query-level document counts. Always recomputed from the pooled documents; never stored as
 * primary state.
 *
 * @param depthK the pooling depth
 * @param methods methods in configured order
 * @param totalDocuments unique pooled documents
 * @param queryCount distinct queries in the pool
 * @param contributions per-method contribution, in method order
 * @param overlapHistogram number of documents found by exactly n methods, for n = 1..#methods
 * @param uniqueContributions per method, documents found by that method only
 * @param documentsPerQuery distribution of pool size per query
 * @param documentsPerPartition pooled documents per partition tag (untagged documents excluded)
 */
public record PoolStatistics(
    int depthK,
    List<String> methods,
    int totalDocuments,
    int queryCount,
    List<MethodContribution> contributions,
    Map<Integer, Integer> overlapHistogram,
    Map<String, Integer> uniqueContributions,
    QueryStats documentsPerQuery,
    Map<String, Integer> documentsPerPartition) {

  /**
   * How much one method contributed to the pool.
   *
   * @param method the method identifier
   * @param count pooled documents this method found within depth K
   * @param percentOfCapacity count relative to K x #queries
   * @param percentOfPool count relative to the pool size
   * @param averagePerQuery count divided by the number of queries
   */
  public record MethodContribution(
      String method,
      int count,
      double percentOfCapacity,
      double percentOfPool,
      double averagePerQuery) {}

  /** Min, max, mean and median number of pooled documents per query. */
  public record QueryStats(int min, int max, double mean, double median) {}

  public static PoolStatistics compute(PoolingResult result) {
    return compute(result.documents(), result.methods(), result.depthK());
  }

  public static PoolStatistics compute(
      List<PooledDocument> documents, List<String> methods, int depthK) {
    int total = documents.size();
    Map<String, Integer> perQuery = new TreeMap<>();
    Map<String, Integer> perPartition = new TreeMap<>();
    for (PooledDocument doc : documents) {
      perQuery.merge(doc.query(), 1, Integer::sum);
      if (doc.partition() != null) {
        perPartition.merge(doc.partition(), 1, Integer::sum);
      }
    }
    int queryCount = perQuery.size();
    int capacity = depthK * queryCount;

    List<MethodContribution> contributions = new ArrayList<>(methods.size());
    Map<String, Integer> unique = new LinkedHashMap<>();
    for (String method : methods) {
      int count = 0;
      int onlyThis = 0;
      for (PooledDocument doc : documents) {
        if (doc.methodHits().containsKey(method)) {
          count++;
          if (doc.numMethodsFound() == 1) {
            onlyThis++;
          }
        }
      }
      contributions.add(
          new MethodContribution(
              method,
              count,
              percent(count, capacity),
              percent(count, total),
              queryCount == 0 ? 0.0 : (double) count / queryCount));
      unique.put(method, onlyThis);
    }

    Map<Integer, Integer> histogram = new LinkedHashMap<>();
    for (int n = 1; n <= methods.size(); n++) {
      histogram.put(n, 0);
    }
    for (PooledDocument doc : documents) {
      histogram.merge(doc.numMethodsFound(), 1, Integer::sum);
    }

    return new PoolStatistics(
        depthK,
        List.copyOf(methods),
        total,
        queryCount,
        List.copyOf(contributions),
        Collections.unmodifiableMap(histogram),
        Collections.unmodifiableMap(unique),
        queryStats(new ArrayList<>(perQuery.values())),
        Collections.unmodifiableMap(perPartition));
  }

  /** Documents found by exactly {@code n} methods. */
  public int foundByExactly(int n) {
    return overlapHistogram.getOrDefault(n, 0);
  }

  /** Sum of the overlap histogram; equals {@link #totalDocuments()} for a well-formed pool. */
  public int histogramTotal() {
    return overlapHistogram.values().stream().mapToInt(Integer::intValue).sum();
  }

  /** Renders the plain-text statistics report written next to a pooled table. */
  public String toReport() {
    String rule = "-".repeat(70) + "\n";
    StringBuilder sb = new StringBuilder();
    sb.append("=".repeat(70)).append('\n');
    sb.append("Pooling Statistics Report\n");
    sb.append("=".repeat(70)).append("\n\n");
    sb.append("Depth-K: ").append(depthK).append('\n');
    sb.append("Methods: ")
        .append(String.join(", ", methods))
        .append(" (")
        .append(methods.size())
        .append(" total)\n");
    sb.append("Number of queries: ").append(queryCount).append('\n');
    sb.append("Total unique documents in pool: ").append(totalDocuments).append('\n');
    sb.append(format("Average documents per query: %.1f%n%n", documentsPerQuery.mean()));

    sb.append(rule).append("Documents Found Per Method:\n").append(rule);
    for (MethodContribution c : contributions) {
      sb.append(
          format(
              "  %-20s: %6d (%5.1f%% of pool, %5.1f%% of K x queries) - avg %.1f per query%n",
              c.method(),
              c.count(),
              c.percentOfPool(),
              c.percentOfCapacity(),
              c.averagePerQuery()));
    }
    sb.append('\n');

    sb.append(rule).append("Document Overlap by Number of Methods:\n").append(rule);
    for (Map.Entry<Integer, Integer> entry : overlapHistogram.entrySet()) {
      int n = entry.getKey();
      String label =
          n == methods.size() ? "all methods" : n + (n > 1 ? " methods only" : " method only");
      sb.append(
          format(
              "  Found by %-20s: %6d (%5.1f%%)%n",
              label, entry.getValue(), percent(entry.getValue(), totalDocuments)));
    }
    sb.append('\n');

    sb.append(rule).append("Unique Contributions (found by only one method):\n").append(rule);
    for (Map.Entry<String, Integer> entry : uniqueContributions.entrySet()) {
      sb.append(
          format(
              "  %-20s only: %6d (%5.1f%%)%n",
              entry.getKey(), entry.getValue(), percent(entry.getValue(), totalDocuments)));
    }
    sb.append('\n');

    sb.append(rule).append("Query-Level Statistics:\n").append(rule);
    sb.append(format("  Min documents per query: %d%n", documentsPerQuery.min()));
    sb.append(format("  Max documents per query: %d%n", documentsPerQuery.max()));
    sb.append(format("  Mean documents per query: %.1f%n", documentsPerQuery.mean()));
    sb.append(format("  Median documents per query: %.1f%n", documentsPerQuery.median()));
    if (!documentsPerPartition.isEmpty()) {
      sb.append(
          format(
              "  Documents per partition: %s%n",
              documentsPerPartition.entrySet().stream()
                  .map(e -> e.getKey() + "=" + e.getValue())
                  .collect(Collectors.joining(", "))));
    }
    sb.append('\n').append("=".repeat(70)).append('\n');
    return sb.toString();
  }

  private static QueryStats queryStats(List<Integer> counts) {
    if (counts.isEmpty()) {
      return new QueryStats(0, 0, 0.0, 0.0);
    }
    Collections.sort(counts);
    int size = counts.size();
    double mean = counts.stream().mapToInt(Integer::intValue).average().orElse(0.0);
    double median =
        size % 2 == 1
            ? counts.get(size / 2)
            : (counts.get(size / 2 - 1) + counts.get(size / 2)) / 2.0;
    return new QueryStats(counts.get(0), counts.get(size - 1), mean, median);
  }

  private static double percent(int count, int total) {
    return total == 0 ? 0.0 : count * 100.0 / total;
  }

  private static String format(String pattern, Object... args) {
    return String.format(Locale.US, pattern, args);
  }
}
