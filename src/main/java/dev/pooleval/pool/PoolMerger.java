package dev.pooleval.pool;

import dev.pooleval.error.ConfigurationException;
import dev.pooleval.error.HitValidationException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Depth-K pooling (TREC style): merges the top-K results of several retrieval methods into one
 * deduplicated pool keyed by (query, document id), recording which methods found each document.
 *
 * <p>For every query only the first K valid hits per method are considered; anything deeper counts
 * as "not found by that method". Malformed rows are skipped and counted, non-numeric scores degrade
 * to null, and a repeated (query, document, method) row overwrites the earlier one. The merge is a
 * single-threaded pass with no state between calls, so identical input always yields an identical
 * pool in identical order.
 */
@Component
public class PoolMerger {

  private static final Logger log = LoggerFactory.getLogger(PoolMerger.class);

  static final int MAX_SAMPLED_ERRORS = 5;

  private static final Comparator<Candidate> BY_RANK = Comparator.comparingInt(Candidate::rank);

  /**
   * Pools one homogeneous set of inputs.
   *
   * @param methods method identifiers, one per input list
   * @param hitsPerMethod rank-sorted hits per method, in the same order as {@code methods}
   * @param depthK number of top hits per method and query to pool
   * @return the pool with its row-level report
   * @throws ConfigurationException if the method and input counts differ or the depth is invalid
   */
  public PoolingResult merge(
      List<String> methods, List<List<SearchHit>> hitsPerMethod, int depthK) {
    validateConfiguration(methods, hitsPerMethod.size(), depthK);
    log.info("Depth-K pooling (K={}) over methods {}", depthK, methods);

    Accumulator accumulator = new Accumulator();
    List<PooledDocument> documents = mergeGroup(null, methods, hitsPerMethod, depthK, accumulator);

    return finish(documents, methods, depthK, accumulator);
  }

  /**
   * Pools each partition independently and unions the results. Every document keeps the tag of the
   * partition it was pooled in, so metrics can later be sliced without re-pooling.
   *
   * @param methods method identifiers, one per input list of every partition
   * @param partitions input groups, pooled in the given order
   * @param depthK number of top hits per method and query to pool
   * @return the union of all partition pools
   * @throws ConfigurationException if a partition's input count differs from the method count, the
   *     depth is invalid, or a query appears in more than one partition
   */
  public PoolingResult mergePartitioned(
      List<String> methods, List<PartitionInput> partitions, int depthK) {
    if (partitions.isEmpty()) {
      throw new ConfigurationException("At least one partition is required");
    }
    for (PartitionInput partition : partitions) {
      validateConfiguration(methods, partition.hitsPerMethod().size(), depthK);
    }
    log.info(
        "Partitioned depth-K pooling (K={}) over methods {} and partitions {}",
        depthK,
        methods,
        partitions.stream().map(PartitionInput::tag).toList());

    Accumulator accumulator = new Accumulator();
    Map<String, String> partitionByQuery = new HashMap<>();
    List<PooledDocument> documents = new ArrayList<>();

    for (PartitionInput partition : partitions) {
      List<PooledDocument> partitionDocs =
          mergeGroup(partition.tag(), methods, partition.hitsPerMethod(), depthK, accumulator);
      for (PooledDocument doc : partitionDocs) {
        String previous = partitionByQuery.putIfAbsent(doc.query(), partition.tag());
        if (previous != null && !previous.equals(partition.tag())) {
          throw new ConfigurationException(
              ("Query '%s' appears in partitions %s and %s; partitions must hold disjoint query"
                      + " sets (e.g. HEAD and TAIL queries must not overlap)")
                  .formatted(doc.query(), previous, partition.tag()));
        }
      }
      log.info("Partition {}: {} pooled documents", partition.tag(), partitionDocs.size());
      documents.addAll(partitionDocs);
    }

    return finish(documents, methods, depthK, accumulator);
  }

  private PoolingResult finish(
      List<PooledDocument> documents, List<String> methods, int depthK, Accumulator accumulator) {
    PoolingReport report = accumulator.toReport();
    log.info(
        "Pooled {} unique documents ({} rows read, {} skipped, {} degraded scores, {} duplicates)",
        documents.size(),
        report.rowsRead(),
        report.rowsSkipped(),
        report.scoresDegraded(),
        report.duplicatesOverwritten());
    return new PoolingResult(documents, methods, depthK, report);
  }

  private List<PooledDocument> mergeGroup(
      @Nullable String partitionTag,
      List<String> methods,
      List<List<SearchHit>> hitsPerMethod,
      int depthK,
      Accumulator accumulator) {
    // method index -> query -> top-K candidates
    List<Map<String, List<Candidate>>> topKPerMethod = new ArrayList<>(methods.size());
    SortedSet<String> queries = new TreeSet<>();

    for (int i = 0; i < methods.size(); i++) {
      Map<String, LinkedHashMap<String, Candidate>> byQuery =
          collectCandidates(methods.get(i), hitsPerMethod.get(i), accumulator);
      Map<String, List<Candidate>> topK = new HashMap<>();
      for (Map.Entry<String, LinkedHashMap<String, Candidate>> entry : byQuery.entrySet()) {
        topK.put(entry.getKey(), truncate(entry.getValue().values(), depthK));
        queries.add(entry.getKey());
      }
      topKPerMethod.add(topK);
    }

    List<PooledDocument> documents = new ArrayList<>();
    for (String query : queries) {
      Map<String, DocumentBuilder> queryPool = new LinkedHashMap<>();
      for (int i = 0; i < methods.size(); i++) {
        String method = methods.get(i);
        for (Candidate candidate : topKPerMethod.get(i).getOrDefault(query, List.of())) {
          queryPool
              .computeIfAbsent(
                  candidate.docId(),
                  docId -> new DocumentBuilder(query, docId, partitionTag, candidate))
              .foundBy(method, candidate);
        }
      }
      for (DocumentBuilder builder : queryPool.values()) {
        documents.add(builder.build());
      }
    }
    return documents;
  }

  /**
   * Validates the rows of one method and groups them by query. Within a query, a repeated document
   * replaces the earlier candidate but keeps its insertion position.
   */
  private Map<String, LinkedHashMap<String, Candidate>> collectCandidates(
      String method, List<SearchHit> hits, Accumulator accumulator) {
    Map<String, LinkedHashMap<String, Candidate>> byQuery = new LinkedHashMap<>();
    int position = 0;
    for (SearchHit hit : hits) {
      position++;
      accumulator.rowsRead++;
      if (!method.equals(hit.method())) {
        throw new ConfigurationException(
            "Hit %d of method '%s' is tagged with method '%s'"
                .formatted(position, method, hit.method()));
      }
      try {
        requireValid(hit, method, position);
      } catch (HitValidationException e) {
        accumulator.skip(e.getMessage());
        continue;
      }

      Double score = parseScore(hit.score());
      if (score == null) {
        accumulator.scoresDegraded++;
      }
      Candidate candidate = new Candidate(hit.docId(), hit.rank(), score, hit);
      Candidate previous =
          byQuery
              .computeIfAbsent(hit.query(), q -> new LinkedHashMap<>())
              .put(hit.docId(), candidate);
      if (previous != null) {
        accumulator.duplicatesOverwritten++;
        log.debug(
            "Duplicate hit for query='{}', doc='{}', method='{}': rank {} replaced by {}",
            hit.query(),
            hit.docId(),
            method,
            previous.rank(),
            candidate.rank());
      }
    }
    return byQuery;
  }

  private static void requireValid(SearchHit hit, String method, int position) {
    if (hit.query() == null || hit.query().isBlank()) {
      throw new HitValidationException(
          "Row %d of method '%s' has no query".formatted(position, method));
    }
    if (hit.docId() == null || hit.docId().isBlank()) {
      throw new HitValidationException(
          "Row %d of method '%s' has no doc_id".formatted(position, method));
    }
    if (hit.rank() == null) {
      throw new HitValidationException(
          "Row %d of method '%s' has no rank".formatted(position, method));
    }
    if (hit.rank() < 1) {
      throw new HitValidationException(
          "Row %d of method '%s' has invalid rank %d".formatted(position, method, hit.rank()));
    }
  }

  /** Parses a raw score; absent, non-numeric and non-finite values degrade to null. */
  static @Nullable Double parseScore(@Nullable String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    try {
      double value = Double.parseDouble(raw.trim());
      return Double.isFinite(value) ? value : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static List<Candidate> truncate(Iterable<Candidate> candidates, int depthK) {
    List<Candidate> sorted = new ArrayList<>();
    candidates.forEach(sorted::add);
    // List.sort is stable: equal ranks keep input order
    sorted.sort(BY_RANK);
    return sorted.subList(0, Math.min(depthK, sorted.size()));
  }

  private static void validateConfiguration(List<String> methods, int inputGroups, int depthK) {
    if (methods.isEmpty()) {
      throw new ConfigurationException("At least one method is required");
    }
    if (methods.size() != inputGroups) {
      throw new ConfigurationException(
          "Number of method identifiers (%d) must match number of input groups (%d)"
              .formatted(methods.size(), inputGroups));
    }
    Set<String> seen = new HashSet<>();
    for (String method : methods) {
      if (method == null || method.isBlank()) {
        throw new ConfigurationException("Method identifiers must not be blank");
      }
      if (!seen.add(method)) {
        throw new ConfigurationException("Duplicate method identifier: " + method);
      }
    }
    if (depthK < 1) {
      throw new ConfigurationException("depthK must be at least 1 but was " + depthK);
    }
  }

  private record Candidate(String docId, int rank, @Nullable Double score, SearchHit hit) {}

  /** Accumulates the provenance of one (query, docId) while the methods are walked in order. */
  private static final class DocumentBuilder {

    private final DocumentKey key;
    private final @Nullable String partition;
    private final Map<String, String> contentFields;
    private final List<String> foundBy = new ArrayList<>();
    private final Map<String, MethodHit> methodHits = new LinkedHashMap<>();

    DocumentBuilder(String query, String docId, @Nullable String partitionTag, Candidate first) {
      this.key = new DocumentKey(query, docId);
      this.partition = partitionTag != null ? partitionTag : first.hit().partition();
      this.contentFields = first.hit().contentFields();
    }

    DocumentBuilder foundBy(String method, Candidate candidate) {
      foundBy.add(method);
      methodHits.put(method, new MethodHit(candidate.rank(), candidate.score()));
      return this;
    }

    PooledDocument build() {
      return new PooledDocument(key, foundBy, methodHits, partition, contentFields, null);
    }
  }

  private static final class Accumulator {

    private int rowsRead;
    private int rowsSkipped;
    private int scoresDegraded;
    private int duplicatesOverwritten;
    private final List<String> sampledErrors = new ArrayList<>();

    void skip(String message) {
      rowsSkipped++;
      if (sampledErrors.size() < MAX_SAMPLED_ERRORS) {
        sampledErrors.add(message);
      }
      log.warn("Skipping invalid hit: {}", message);
    }

    PoolingReport toReport() {
      return new PoolingReport(
          rowsRead, rowsSkipped, scoresDegraded, duplicatesOverwritten, sampledErrors);
    }
  }
}
