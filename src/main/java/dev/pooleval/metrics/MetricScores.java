package dev.pooleval.metrics;

/** The five metric values of one cell, or their means over queries. */
public record MetricScores(double ndcg, double recall, double precision, double mrr, double map) {

  public double get(Metric metric) {
    return switch (metric) {
      case NDCG -> ndcg;
      case RECALL -> recall;
      case PRECISION -> precision;
      case MRR -> mrr;
      case MAP -> map;
    };
  }
}
