package dev.pooleval.metrics;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Standard graded-relevance ranking metrics.
 *
 * <p>All methods are pure functions over grade lists. {@code rankedGrades} holds the grade of each
 * retrieved document in rank order (unjudged documents count as 0). A document is relevant when its
 * grade is >= 1.
 */
public final class RankingMetrics {

  private RankingMetrics() {}

  /** Precision@k: relevant documents in the top k, divided by k (not by the list length). */
  public static double precisionAtK(List<Integer> rankedGrades, int k) {
    requirePositive(k);
    return (double) relevantInTopK(rankedGrades, k) / k;
  }

  /**
   * Recall@k relative to the pool: relevant documents in the top k divided by the relevant
   * documents judged for the query. 0 when nothing relevant was judged.
   */
  public static double recallAtK(List<Integer> rankedGrades, int relevantInPool, int k) {
    requirePositive(k);
    if (relevantInPool == 0) {
      return 0.0;
    }
    return (double) relevantInTopK(rankedGrades, k) / relevantInPool;
  }

  /**
   * NDCG@k with exponential gain {@code 2^grade - 1}. The ideal ordering is built from {@code
   * judgedGrades}, every grade judged for the query. 0 when the ideal DCG is 0.
   */
  public static double ndcgAtK(List<Integer> rankedGrades, List<Integer> judgedGrades, int k) {
    requirePositive(k);
    double idcg = idcgAtK(judgedGrades, k);
    if (idcg == 0.0) {
      return 0.0;
    }
    return dcgAtK(rankedGrades, k) / idcg;
  }

  /** DCG@k = sum over i = 1..k of (2^grade_i - 1) / log2(i + 1). */
  public static double dcgAtK(List<Integer> rankedGrades, int k) {
    double dcg = 0.0;
    int limit = Math.min(k, rankedGrades.size());
    for (int i = 0; i < limit; i++) {
      dcg += gain(rankedGrades.get(i)) / log2(i + 2); // rank is 1-based: log2(1+1), log2(2+1), ...
    }
    return dcg;
  }

  static double idcgAtK(List<Integer> judgedGrades, int k) {
    List<Integer> sortedGrades = new ArrayList<>(judgedGrades);
    sortedGrades.sort(Comparator.reverseOrder());
    return dcgAtK(sortedGrades, k);
  }

  /** Reciprocal rank of the first relevant document over the full list; 0 if there is none. */
  public static double reciprocalRank(List<Integer> rankedGrades) {
    for (int i = 0; i < rankedGrades.size(); i++) {
      if (isRelevant(rankedGrades.get(i))) {
        return 1.0 / (i + 1);
      }
    }
    return 0.0;
  }

  /**
   * Average precision over the full list: the mean of precision@i over the ranks i that hold a
   * relevant document. 0 when the list holds none.
   */
  public static double averagePrecision(List<Integer> rankedGrades) {
    double sumPrecision = 0.0;
    int relevantFound = 0;
    for (int i = 0; i < rankedGrades.size(); i++) {
      if (isRelevant(rankedGrades.get(i))) {
        relevantFound++;
        sumPrecision += (double) relevantFound / (i + 1);
      }
    }
    return relevantFound == 0 ? 0.0 : sumPrecision / relevantFound;
  }

  static double gain(int grade) {
    return Math.pow(2, grade) - 1;
  }

  static boolean isRelevant(int grade) {
    return grade >= 1;
  }

  private static int relevantInTopK(List<Integer> rankedGrades, int k) {
    int limit = Math.min(k, rankedGrades.size());
    int found = 0;
    for (int i = 0; i < limit; i++) {
      if (isRelevant(rankedGrades.get(i))) {
        found++;
      }
    }
    return found;
  }

  private static void requirePositive(int k) {
    if (k < 1) {
      throw new IllegalArgumentException("k must be >= 1 but was " + k);
    }
  }

  private static double log2(double x) {
    return Math.log(x) / Math.log(2);
  }
}
