package dev.pooleval.metrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Output of an evaluation: per-query cells, per-(method, K) aggregates and the missing cells.
 *
 * @param methods evaluated methods in request order
 * @param cutoffs cutoffs in ascending order
 * @param poolDepth the pooling depth
 * @param partition the partition filter, or null for all queries
 * @param evaluatedQueries queries with at least one judgment, in lexicographic order
 * @param perQuery cells ordered by method, then query, then K
 * @param aggregates aggregates ordered by method, then K
 * @param missingCells (method, query) pairs that could not be measured
 */
public record MetricsReport(
    List<String> methods,
    List<Integer> cutoffs,
    int poolDepth,
    @Nullable String partition,
    List<String> evaluatedQueries,
    List<QueryMetrics> perQuery,
    List<AggregateMetrics> aggregates,
    List<MissingCell> missingCells) {

  public MetricsReport {
    methods = List.copyOf(methods);
    cutoffs = List.copyOf(cutoffs);
    evaluatedQueries = List.copyOf(evaluatedQueries);
    perQuery = List.copyOf(perQuery);
    aggregates = List.copyOf(aggregates);
    missingCells = List.copyOf(missingCells);
  }

  public AggregateMetrics aggregate(String method, int k) {
    return aggregates.stream()
        .filter(a -> a.method().equals(method) && a.k() == k)
        .findFirst()
        .orElseThrow(() -> new IllegalArgumentException(
            "No aggregate for method '%s' at k=%d".formatted(method, k)));
  }

  public List<QueryMetrics> perQuery(String method, int k) {
    return perQuery.stream().filter(q -> q.method().equals(method) && q.k() == k).toList();
  }

  /**
   * Methods ordered by their aggregate {@code metric} at {@code k}, best first. Methods without a
   * measurable query come last.
   */
  public List<AggregateMetrics> rankMethods(Metric metric, int k) {
    List<AggregateMetrics> ranked = new ArrayList<>();
    for (String method : methods) {
      ranked.add(aggregate(method, k));
    }
    Comparator<AggregateMetrics> byValue =
        Comparator.comparingDouble(a -> a.isMissing() ? 0.0 : a.valueOrThrow(metric));
    ranked.sort(
        Comparator.comparing(AggregateMetrics::isMissing).thenComparing(byValue.reversed()));
    return ranked;
  }

  /**
   * The {@code n} best (or worst) measured queries of {@code method} by nDCG@{@code k}. Ties are
   * broken by query text.
   */
  public List<QueryMetrics> extremeQueries(String method, int k, int n, boolean best) {
    Comparator<QueryMetrics> byNdcg = Comparator.comparingDouble(q -> q.valueOrThrow(Metric.NDCG));
    if (best) {
      byNdcg = byNdcg.reversed();
    }
    return perQuery(method, k).stream()
        .filter(q -> !q.isMissing())
        .sorted(byNdcg.thenComparing(QueryMetrics::query))
        .limit(n)
        .toList();
  }
}
