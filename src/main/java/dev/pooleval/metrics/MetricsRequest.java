package dev.pooleval.metrics;

import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * What to evaluate.
 *
 * @param methods methods to score, in report order
 * @param cutoffs cutoff values K
 * @param poolDepth the depth K used when the pool was built
 * @param partition restrict evaluation to documents with this partition tag; null for all
 */
public record MetricsRequest(
    List<String> methods, List<Integer> cutoffs, int poolDepth, @Nullable String partition) {

  public static final List<Integer> DEFAULT_CUTOFFS = List.of(5, 10, 20);

  public MetricsRequest {
    methods = methods == null ? List.of() : List.copyOf(methods);
    cutoffs = cutoffs == null ? List.of() : List.copyOf(cutoffs);
  }

  public static MetricsRequest of(List<String> methods, int poolDepth) {
    return new MetricsRequest(methods, DEFAULT_CUTOFFS, poolDepth, null);
  }

  public MetricsRequest withPartition(@Nullable String newPartition) {
    return new MetricsRequest(methods, cutoffs, poolDepth, newPartition);
  }
}
