package dev.pooleval.pool;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;
import net.jqwik.api.constraints.IntRange;

/**
 * Property-based tests for {@link PoolMerger} invariants using jqwik.
 *
 * <p>Inputs are arbitrary ranked lists: per method, per query, a list of distinct documents in rank
 * order. The invariants must hold for every such input and every depth.
 */
class PoolMergerPropertyTest {

  private static final List<String> QUERIES = List.of("q1", "q2", "q3");
  private static final List<String> DOCS =
      List.of("d0", "d1", "d2", "d3", "d4", "d5", "d6", "d7", "d8", "d9");

  private final PoolMerger merger = new PoolMerger();

  // methods -> queries -> ranked doc ids
  @Provide
  Arbitrary<List<List<List<String>>>> runs() {
    Arbitrary<List<String>> rankedList = Arbitraries.of(DOCS).list().uniqueElements().ofMaxSize(8);
    Arbitrary<List<List<String>>> methodRun = rankedList.list().ofSize(QUERIES.size());
    return methodRun.list().ofMinSize(1).ofMaxSize(3);
  }

  @Property
  void merging_is_idempotent(
      @ForAll("runs") List<List<List<String>>> runs, @ForAll @IntRange(min = 1, max = 10) int k) {
    PoolingResult first = merger.merge(methods(runs), hits(runs), k);
    PoolingResult second = merger.merge(methods(runs), hits(runs), k);

    assertThat(second.documents()).isEqualTo(first.documents());
  }

  @Property
  void every_hit_within_depth_is_pooled_with_its_rank(
      @ForAll("runs") List<List<List<String>>> runs, @ForAll @IntRange(min = 1, max = 10) int k) {
    PoolingResult result = merger.merge(methods(runs), hits(runs), k);

    for (int m = 0; m < runs.size(); m++) {
      String method = "m" + m;
      for (int q = 0; q < QUERIES.size(); q++) {
        List<String> ranked = runs.get(m).get(q);
        for (int r = 0; r < ranked.size(); r++) {
          PooledDocument doc = find(result, QUERIES.get(q), ranked.get(r));
          if (r < k) {
            assertThat(doc).isNotNull();
            assertThat(doc.rankFor(method)).isEqualTo(r + 1);
          } else if (doc != null) {
            assertThat(doc.rankFor(method)).isNull();
          }
        }
      }
    }
  }

  @Property
  void per_method_contribution_is_conserved(
      @ForAll("runs") List<List<List<String>>> runs, @ForAll @IntRange(min = 1, max = 10) int k) {
    PoolingResult result = merger.merge(methods(runs), hits(runs), k);
    PoolStatistics statistics = PoolStatistics.compute(result);

    for (int m = 0; m < runs.size(); m++) {
      int expected = 0;
      for (List<String> ranked : runs.get(m)) {
        expected += Math.min(k, ranked.size());
      }
      assertThat(statistics.contributions().get(m).count()).isEqualTo(expected);
    }
  }

  @Property
  void overlap_histogram_sums_to_pool_size(
      @ForAll("runs") List<List<List<String>>> runs, @ForAll @IntRange(min = 1, max = 10) int k) {
    PoolingResult result = merger.merge(methods(runs), hits(runs), k);
    PoolStatistics statistics = PoolStatistics.compute(result);

    assertThat(statistics.histogramTotal()).isEqualTo(result.size());
    assertThat(statistics.overlapHistogram().keySet()).hasSize(runs.size());
  }

  @Property
  void pool_has_no_duplicate_keys(
      @ForAll("runs") List<List<List<String>>> runs, @ForAll @IntRange(min = 1, max = 10) int k) {
    PoolingResult result = merger.merge(methods(runs), hits(runs), k);

    Set<DocumentKey> keys = new HashSet<>();
    for (PooledDocument doc : result.documents()) {
      assertThat(keys.add(doc.key())).isTrue();
      assertThat(doc.foundByMethods()).isNotEmpty();
    }
  }

  private static List<String> methods(List<List<List<String>>> runs) {
    List<String> methods = new ArrayList<>();
    for (int m = 0; m < runs.size(); m++) {
      methods.add("m" + m);
    }
    return methods;
  }

  private static List<List<SearchHit>> hits(List<List<List<String>>> runs) {
    List<List<SearchHit>> hitsPerMethod = new ArrayList<>();
    for (int m = 0; m < runs.size(); m++) {
      List<SearchHit> hits = new ArrayList<>();
      for (int q = 0; q < QUERIES.size(); q++) {
        List<String> ranked = runs.get(m).get(q);
        for (int r = 0; r < ranked.size(); r++) {
          hits.add(new SearchHit(QUERIES.get(q), ranked.get(r), r + 1, 1.0 / (r + 1), "m" + m));
        }
      }
      hitsPerMethod.add(hits);
    }
    return hitsPerMethod;
  }

  private static PooledDocument find(PoolingResult result, String query, String docId) {
    return result.documents().stream()
        .filter(d -> d.query().equals(query) && d.docId().equals(docId))
        .findFirst()
        .orElse(null);
  }
}
