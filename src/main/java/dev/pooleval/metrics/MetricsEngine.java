package dev.pooleval.metrics;

import dev.pooleval.error.ConfigurationException;
import dev.pooleval.pool.PooledDocument;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Scores each method's ranking of a judged pool.
 *
 * <p>For a query, a method's ranked list is the pool documents carrying a rank for that method,
 * ordered by rank. Unjudged documents count as grade 0. Only queries with at least one judgment are
 * evaluated; a method that ranked nothing for such a query yields a missing cell, which is listed
 * and excluded from the aggregate mean rather than counted as zero.
 */
@Service
public class MetricsEngine {

  private static final Logger log = LoggerFactory.getLogger(MetricsEngine.class);

  private static final Comparator<PooledDocument> BY_DOC_ID =
      Comparator.comparing(PooledDocument::docId);

  public MetricsReport evaluate(List<PooledDocument> judgedPool, MetricsRequest request) {
    List<Integer> cutoffs = validate(judgedPool, request);
    SortedMap<String, List<PooledDocument>> byQuery = evaluatedQueries(judgedPool, request);

    List<QueryMetrics> perQuery = new ArrayList<>();
    List<AggregateMetrics> aggregates = new ArrayList<>();
    List<MissingCell> missing = new ArrayList<>();

    for (String method : request.methods()) {
      Map<Integer, List<MetricScores>> measuredByK = new TreeMap<>();
      int missingQueries = 0;
      for (Map.Entry<String, List<PooledDocument>> entry : byQuery.entrySet()) {
        String query = entry.getKey();
        List<PooledDocument> docs = entry.getValue();
        List<Integer> judgedGrades = judgedGrades(docs);
        int relevant = (int) judgedGrades.stream().filter(RankingMetrics::isRelevant).count();
        List<Integer> ranked = rankedGrades(docs, method);

        if (ranked.isEmpty()) {
          missingQueries++;
          missing.add(new MissingCell(method, query, "method returned no results for query"));
          for (int k : cutoffs) {
            perQuery.add(
                new QueryMetrics(
                    method, query, k, Coverage.of(k, request.poolDepth()), 0, relevant, null));
          }
          continue;
        }

        double mrr = RankingMetrics.reciprocalRank(ranked);
        double map = RankingMetrics.averagePrecision(ranked);
        for (int k : cutoffs) {
          MetricScores scores =
              new MetricScores(
                  RankingMetrics.ndcgAtK(ranked, judgedGrades, k),
                  RankingMetrics.recallAtK(ranked, relevant, k),
                  RankingMetrics.precisionAtK(ranked, k),
                  mrr,
                  map);
          perQuery.add(
              new QueryMetrics(
                  method,
                  query,
                  k,
                  Coverage.of(k, request.poolDepth()),
                  ranked.size(),
                  relevant,
                  scores));
          measuredByK.computeIfAbsent(k, key -> new ArrayList<>()).add(scores);
        }
      }

      for (int k : cutoffs) {
        List<MetricScores> measured = measuredByK.getOrDefault(k, List.of());
        aggregates.add(
            new AggregateMetrics(
                method,
                k,
                Coverage.of(k, request.poolDepth()),
                measured.size(),
                missingQueries,
                mean(measured)));
      }
      if (missingQueries > 0) {
        log.warn(
            "Method '{}' returned no results for {} of {} evaluated queries",
            method,
            missingQueries,
            byQuery.size());
      }
    }

    log.info(
        "Evaluated {} methods over {} queries at cutoffs {}{}",
        request.methods().size(),
        byQuery.size(),
        cutoffs,
        request.partition() == null ? "" : " (partition " + request.partition() + ")");
    return new MetricsReport(
        request.methods(),
        cutoffs,
        request.poolDepth(),
        request.partition(),
        new ArrayList<>(byQuery.keySet()),
        perQuery,
        aggregates,
        missing);
  }

  private static List<Integer> validate(List<PooledDocument> pool, MetricsRequest request) {
    if (request.methods().isEmpty()) {
      throw new ConfigurationException("At least one method is required");
    }
    if (request.cutoffs().isEmpty()) {
      throw new ConfigurationException("At least one cutoff is required");
    }
    if (request.poolDepth() < 1) {
      throw new ConfigurationException("poolDepth must be >= 1 but was " + request.poolDepth());
    }
    for (int k : request.cutoffs()) {
      if (k < 1) {
        throw new ConfigurationException("Cutoffs must be >= 1 but got " + k);
      }
    }
    Set<String> known = new HashSet<>();
    for (PooledDocument doc : pool) {
      known.addAll(doc.methodHits().keySet());
    }
    Set<String> seen = new LinkedHashSet<>();
    for (String method : request.methods()) {
      if (!known.contains(method)) {
        throw new ConfigurationException(
            "Unknown method '%s'; pool contains %s".formatted(method, new TreeSet<>(known)));
      }
      if (!seen.add(method)) {
        throw new ConfigurationException("Duplicate method '%s'".formatted(method));
      }
    }
    return List.copyOf(new TreeSet<>(request.cutoffs()));
  }

  private static SortedMap<String, List<PooledDocument>> evaluatedQueries(
      List<PooledDocument> pool, MetricsRequest request) {
    SortedMap<String, List<PooledDocument>> byQuery = new TreeMap<>();
    for (PooledDocument doc : pool) {
      if (request.partition() != null && !request.partition().equals(doc.partition())) {
        continue;
      }
      byQuery.computeIfAbsent(doc.query(), q -> new ArrayList<>()).add(doc);
    }
    byQuery.values().removeIf(docs -> docs.stream().noneMatch(PooledDocument::isJudged));
    return byQuery;
  }

  private static List<Integer> judgedGrades(List<PooledDocument> docs) {
    List<Integer> grades = new ArrayList<>();
    for (PooledDocument doc : docs) {
      if (doc.isJudged()) {
        grades.add(doc.relevance());
      }
    }
    return grades;
  }

  private static List<Integer> rankedGrades(List<PooledDocument> docs, String method) {
    Comparator<PooledDocument> byRank =
        Comparator.comparing((PooledDocument d) -> d.rankFor(method)).thenComparing(BY_DOC_ID);
    return docs.stream()
        .filter(d -> d.rankFor(method) != null)
        .sorted(byRank)
        .map(d -> d.isJudged() ? d.relevance() : 0)
        .toList();
  }

  private static @Nullable MetricScores mean(List<MetricScores> measured) {
    if (measured.isEmpty()) {
      return null;
    }
    double ndcg = 0.0;
    double recall = 0.0;
    double precision = 0.0;
    double mrr = 0.0;
    double map = 0.0;
    for (MetricScores scores : measured) {
      ndcg += scores.ndcg();
      recall += scores.recall();
      precision += scores.precision();
      mrr += scores.mrr();
      map += scores.map();
    }
    int n = measured.size();
    return new MetricScores(ndcg / n, recall / n, precision / n, mrr / n, map / n);
  }
}
