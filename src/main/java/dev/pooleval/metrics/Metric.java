package dev.pooleval.metrics;

/** Ranking metrics produced for every (method, query, K) cell. */
public enum Metric {
  NDCG("ndcg", true),
  RECALL("recall", true),
  PRECISION("precision", true),
  MRR("mrr", false),
  MAP("map", false);

  private final String columnName;
  private final boolean cutoffDependent;

  Metric(String columnName, boolean cutoffDependent) {
    this.columnName = columnName;
    this.cutoffDependent = cutoffDependent;
  }

  public String columnName() {
    return columnName;
  }

  /** MRR and MAP are computed over the full ranked list and repeat across cutoffs. */
  public boolean cutoffDependent() {
    return cutoffDependent;
  }
}
