package dev.pooleval.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import dev.pooleval.error.ConfigurationException;
import dev.pooleval.error.MissingDataException;
import dev.pooleval.fixture.PooledDocumentBuilder;
import dev.pooleval.pool.PooledDocument;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MetricsEngineTest {

  private static final double TOLERANCE = 0.001;

  private static final List<String> METHODS = List.of("bm25", "vector");

  private final MetricsEngine engine = new MetricsEngine();

  /**
   * laptop: bm25 ranks d1(0), d2(2), d3(1); vector ranks d3(1), d1(0). phone: only bm25 ranks
   * e1(2). tablet: nothing judged, so not evaluated.
   */
  private static List<PooledDocument> pool() {
    return List.of(
        new PooledDocumentBuilder().docId("d1").rank("bm25", 1).rank("vector", 2).grade(0).build(),
        new PooledDocumentBuilder().docId("d2").rank("bm25", 2).grade(2).build(),
        new PooledDocumentBuilder().docId("d3").rank("bm25", 3).rank("vector", 1).grade(1).build(),
        new PooledDocumentBuilder().query("phone").docId("e1").rank("bm25", 1).grade(2).build(),
        new PooledDocumentBuilder().query("tablet").docId("t1").rank("vector", 1).build());
  }

  private static MetricsRequest request(List<Integer> cutoffs) {
    return new MetricsRequest(METHODS, cutoffs, 3, null);
  }

  private static QueryMetrics cell(MetricsReport report, String method, String query, int k) {
    return report.perQuery(method, k).stream()
        .filter(q -> q.query().equals(query))
        .findFirst()
        .orElseThrow();
  }

  @Nested
  class PerQuery {

    @Test
    void worked_example_values() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(3)));

      MetricScores scores = cell(report, "bm25", "laptop", 3).scores();
      assertThat(scores).isNotNull();
      assertThat(scores.ndcg()).isCloseTo(0.659, within(TOLERANCE));
      assertThat(scores.precision()).isCloseTo(2.0 / 3, within(TOLERANCE));
      assertThat(scores.recall()).isCloseTo(1.0, within(TOLERANCE));
      assertThat(scores.mrr()).isCloseTo(0.5, within(TOLERANCE));
      assertThat(scores.map()).isCloseTo(0.5833, within(TOLERANCE));
    }

    @Test
    void ideal_ranking_is_built_from_every_judged_document() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(3)));

      QueryMetrics vector = cell(report, "vector", "laptop", 3);
      assertThat(vector.numResults()).isEqualTo(2);
      assertThat(vector.numRelevant()).isEqualTo(2);
      // DCG = 1, IDCG = 3 + 1/log2(3)
      assertThat(vector.valueOrThrow(Metric.NDCG)).isCloseTo(0.2754, within(TOLERANCE));
      assertThat(vector.valueOrThrow(Metric.RECALL)).isCloseTo(0.5, within(TOLERANCE));
    }

    @Test
    void only_queries_with_a_judgment_are_evaluated() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(3)));

      assertThat(report.evaluatedQueries()).containsExactly("laptop", "phone");
    }

    @Test
    void unjudged_documents_count_as_not_relevant() {
      List<PooledDocument> docs = new ArrayList<>(pool());
      docs.add(new PooledDocumentBuilder().query("phone").docId("e0").rank("vector", 1).build());

      MetricsReport report = engine.evaluate(docs, request(List.of(1)));

      QueryMetrics vector = cell(report, "vector", "phone", 1);
      assertThat(vector.isMissing()).isFalse();
      assertThat(vector.valueOrThrow(Metric.PRECISION)).isCloseTo(0.0, within(TOLERANCE));
    }

    @Test
    void precision_beyond_result_count_divides_by_k() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(5)));

      assertThat(cell(report, "bm25", "phone", 5).valueOrThrow(Metric.PRECISION))
          .isCloseTo(0.2, within(TOLERANCE));
    }

    @Test
    void cutoff_beyond_pool_depth_is_partial_coverage() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(3, 5)));

      assertThat(cell(report, "bm25", "laptop", 3).coverage()).isEqualTo(Coverage.EXACT);
      assertThat(cell(report, "bm25", "laptop", 5).coverage())
          .isEqualTo(Coverage.PARTIAL_COVERAGE);
      assertThat(report.aggregate("bm25", 5).coverage()).isEqualTo(Coverage.PARTIAL_COVERAGE);
    }
  }

  @Nested
  class MissingCells {

    @Test
    void method_without_results_yields_missing_cell() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(3, 5)));

      assertThat(report.missingCells())
          .singleElement()
          .satisfies(
              missing -> {
                assertThat(missing.method()).isEqualTo("vector");
                assertThat(missing.query()).isEqualTo("phone");
              });
      QueryMetrics cell = cell(report, "vector", "phone", 3);
      assertThat(cell.isMissing()).isTrue();
      assertThat(cell.numResults()).isZero();
      assertThatThrownBy(() -> cell.valueOrThrow(Metric.NDCG))
          .isInstanceOf(MissingDataException.class);
    }

    @Test
    void missing_cells_are_excluded_from_the_mean() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(3)));

      AggregateMetrics vector = report.aggregate("vector", 3);
      assertThat(vector.queriesMeasured()).isEqualTo(1);
      assertThat(vector.queriesMissing()).isEqualTo(1);
      assertThat(vector.valueOrThrow(Metric.NDCG)).isCloseTo(0.2754, within(TOLERANCE));

      AggregateMetrics bm25 = report.aggregate("bm25", 3);
      assertThat(bm25.queriesMeasured()).isEqualTo(2);
      assertThat(bm25.valueOrThrow(Metric.NDCG)).isCloseTo((0.659 + 1.0) / 2, within(TOLERANCE));
    }

    @Test
    void method_missing_everywhere_has_missing_aggregate() {
      List<PooledDocument> docs = new ArrayList<>(pool());
      docs.add(new PooledDocumentBuilder().query("tablet").docId("t2").rank("sparse", 1).build());

      MetricsReport report =
          engine.evaluate(docs, new MetricsRequest(List.of("bm25", "sparse"), List.of(3), 3, null));

      AggregateMetrics sparse = report.aggregate("sparse", 3);
      assertThat(sparse.isMissing()).isTrue();
      assertThat(sparse.queriesMissing()).isEqualTo(2);
      assertThat(report.rankMethods(Metric.NDCG, 3))
          .extracting(AggregateMetrics::method)
          .containsExactly("bm25", "sparse");
    }
  }

  @Nested
  class Reporting {

    @Test
    void rank_methods_best_first() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(3)));

      assertThat(report.rankMethods(Metric.NDCG, 3))
          .extracting(AggregateMetrics::method)
          .containsExactly("bm25", "vector");
    }

    @Test
    void extreme_queries_sorted_by_ndcg() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(3)));

      assertThat(report.extremeQueries("bm25", 3, 10, true))
          .extracting(QueryMetrics::query)
          .containsExactly("phone", "laptop");
      assertThat(report.extremeQueries("bm25", 3, 1, false))
          .extracting(QueryMetrics::query)
          .containsExactly("laptop");
      assertThat(report.extremeQueries("vector", 3, 10, true))
          .extracting(QueryMetrics::query)
          .containsExactly("laptop");
    }

    @Test
    void cutoffs_are_sorted_and_deduplicated() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(10, 5, 5)));

      assertThat(report.cutoffs()).containsExactly(5, 10);
      assertThat(report.aggregates()).hasSize(4);
    }

    @Test
    void partition_filter_restricts_queries() {
      List<PooledDocument> docs =
          List.of(
              new PooledDocumentBuilder().docId("d1").partition("head").grade(2).build(),
              new PooledDocumentBuilder()
                  .query("rare")
                  .docId("r1")
                  .partition("tail")
                  .grade(1)
                  .build());

      MetricsReport report =
          engine.evaluate(docs, MetricsRequest.of(List.of("bm25"), 20).withPartition("tail"));

      assertThat(report.partition()).isEqualTo("tail");
      assertThat(report.evaluatedQueries()).containsExactly("rare");
    }

    @Test
    void unknown_aggregate_is_rejected() {
      MetricsReport report = engine.evaluate(pool(), request(List.of(3)));

      assertThatThrownBy(() -> report.aggregate("bm25", 7))
          .isInstanceOf(IllegalArgumentException.class)
          .hasMessageContaining("k=7");
    }
  }

  @Nested
  class Configuration {

    @Test
    void unknown_method_is_rejected() {
      assertThatThrownBy(
              () ->
                  engine.evaluate(
                      pool(), new MetricsRequest(List.of("bm25", "splade"), List.of(5), 3, null)))
          .isInstanceOf(ConfigurationException.class)
          .hasMessageContaining("splade");
    }

    @Test
    void duplicate_method_is_rejected() {
      assertThatThrownBy(
              () ->
                  engine.evaluate(
                      pool(), new MetricsRequest(List.of("bm25", "bm25"), List.of(5), 3, null)))
          .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void empty_methods_are_rejected() {
      assertThatThrownBy(
              () -> engine.evaluate(pool(), new MetricsRequest(List.of(), List.of(5), 3, null)))
          .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void non_positive_cutoff_is_rejected() {
      assertThatThrownBy(() -> engine.evaluate(pool(), request(List.of(0, 5))))
          .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void non_positive_pool_depth_is_rejected() {
      assertThatThrownBy(
              () -> engine.evaluate(pool(), new MetricsRequest(METHODS, List.of(5), 0, null)))
          .isInstanceOf(ConfigurationException.class);
    }
  }
}
