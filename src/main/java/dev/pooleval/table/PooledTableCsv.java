package dev.pooleval.table;

import dev.pooleval.pool.DocumentKey;
import dev.pooleval.pool.MethodHit;
import dev.pooleval.pool.PooledDocument;
import dev.pooleval.pool.RelevanceJudgment;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads and writes the pooled table, the hand-off format between pooling, labeling and metrics.
 *
 * <p>Columns: {@code query, doc_id, query_set, found_by_methods, num_methods_found}, then {@code
 * <method>_rank} and {@code <method>_score} per method, then the content columns in name order,
 * then {@code relevance, labeled_by, labeled_at, notes}. Writing the same documents twice yields
 * byte-identical files.
 */
@Component
public class PooledTableCsv {

  private static final Logger log = LoggerFactory.getLogger(PooledTableCsv.class);

  static final String QUERY = "query";
  static final String DOC_ID = "doc_id";
  static final String QUERY_SET = "query_set";
  static final String FOUND_BY = "found_by_methods";
  static final String NUM_METHODS = "num_methods_found";
  static final String RELEVANCE = "relevance";
  static final String LABELED_BY = "labeled_by";
  static final String LABELED_AT = "labeled_at";
  static final String NOTES = "notes";
  static final String RANK_SUFFIX = "_rank";
  static final String SCORE_SUFFIX = "_score";

  private static final List<String> LEADING =
      List.of(QUERY, DOC_ID, QUERY_SET, FOUND_BY, NUM_METHODS);
  private static final List<String> TRAILING = List.of(RELEVANCE, LABELED_BY, LABELED_AT, NOTES);
  private static final String UNKNOWN_LABELER = "unknown";

  public void write(Path file, List<PooledDocument> documents, List<String> methods)
      throws IOException {
    Set<String> contentColumns = new TreeSet<>();
    for (PooledDocument doc : documents) {
      contentColumns.addAll(doc.contentFields().keySet());
    }
    contentColumns.removeAll(LEADING);
    contentColumns.removeAll(TRAILING);

    List<String> header = new ArrayList<>(LEADING);
    for (String method : methods) {
      header.add(method + RANK_SUFFIX);
      header.add(method + SCORE_SUFFIX);
    }
    header.addAll(contentColumns);
    header.addAll(TRAILING);

    List<List<String>> rows = new ArrayList<>(documents.size());
    for (PooledDocument doc : documents) {
      List<String> row = new ArrayList<>(header.size());
      row.add(doc.query());
      row.add(doc.docId());
      row.add(orEmpty(doc.partition()));
      row.add(String.join(",", doc.foundByMethods()));
      row.add(String.valueOf(doc.numMethodsFound()));
      for (String method : methods) {
        Integer rank = doc.rankFor(method);
        Double score = doc.scoreFor(method);
        row.add(rank == null ? "" : String.valueOf(rank));
        row.add(score == null ? "" : String.valueOf(score));
      }
      for (String column : contentColumns) {
        row.add(orEmpty(doc.contentFields().get(column)));
      }
      RelevanceJudgment judgment = doc.judgment();
      if (judgment == null) {
        row.addAll(List.of("", "", "", ""));
      } else {
        row.add(judgment.relevance() == null ? "" : String.valueOf(judgment.relevance()));
        row.add(judgment.labeledBy());
        row.add(judgment.labeledAt().toString());
        row.add(orEmpty(judgment.notes()));
      }
      rows.add(row);
    }
    CsvTables.writeRows(file, header, rows);
    log.info("Wrote {} pooled documents for methods {} to {}", documents.size(), methods, file);
  }

  /**
   * Reads a pooled table. Methods are detected from the {@code <method>_rank} columns.
   *
   * @throws IOException if the file cannot be read or lacks the {@code query} and {@code doc_id}
   *     columns
   */
  public PooledTable read(Path file) throws IOException {
    List<String[]> rows = CsvTables.readRows(file);
    if (rows.isEmpty()) {
      throw new IOException("Pooled table " + file + " is empty");
    }
    String[] header = rows.get(0);
    int query = CsvTables.indexOf(header, QUERY);
    int docId = CsvTables.indexOf(header, DOC_ID);
    if (query < 0 || docId < 0) {
      throw new IOException(
          "Pooled table %s must have '%s' and '%s' columns".formatted(file, QUERY, DOC_ID));
    }
    List<String> methods = detectMethods(header);
    Set<String> structural = new TreeSet<>(LEADING);
    structural.addAll(TRAILING);
    for (String method : methods) {
      structural.add(method + RANK_SUFFIX);
      structural.add(method + SCORE_SUFFIX);
    }

    List<PooledDocument> documents = new ArrayList<>(rows.size() - 1);
    int skipped = 0;
    for (int line = 1; line < rows.size(); line++) {
      String[] row = rows.get(line);
      String q = CsvTables.cell(row, query);
      String d = CsvTables.cell(row, docId);
      if (q == null || d == null) {
        skipped++;
        continue;
      }
      Map<String, MethodHit> hits = new LinkedHashMap<>();
      for (String method : methods) {
        Integer rank =
            CsvTables.parseInteger(
                CsvTables.cell(row, CsvTables.indexOf(header, method + RANK_SUFFIX)));
        if (rank != null) {
          String score = CsvTables.cell(row, CsvTables.indexOf(header, method + SCORE_SUFFIX));
          hits.put(method, new MethodHit(rank, parseScore(score)));
        }
      }
      List<String> foundBy = new ArrayList<>(hits.keySet());
      if (foundBy.isEmpty()) {
        foundBy = parseFoundBy(CsvTables.cell(row, CsvTables.indexOf(header, FOUND_BY)));
      }
      if (foundBy.isEmpty()) {
        log.warn("Skipping pooled row {} of {}: no method found ({}, {})", line, file, q, d);
        skipped++;
        continue;
      }
      Map<String, String> content = new LinkedHashMap<>();
      for (int i = 0; i < header.length; i++) {
        if (!structural.contains(header[i])) {
          String value = CsvTables.rawCell(row, i);
          if (value != null) {
            content.put(header[i], value);
          }
        }
      }
      DocumentKey key = new DocumentKey(q, d);
      documents.add(
          new PooledDocument(
              key,
              foundBy,
              hits,
              CsvTables.cell(row, CsvTables.indexOf(header, QUERY_SET)),
              content,
              judgment(key, header, row)));
    }
    if (skipped > 0) {
      log.warn("Skipped {} unreadable rows in {}", skipped, file);
    }
    log.info("Read {} pooled documents for methods {} from {}", documents.size(), methods, file);
    return new PooledTable(methods, documents);
  }

  static List<String> detectMethods(String[] header) {
    List<String> methods = new ArrayList<>();
    for (String column : header) {
      if (column != null
          && column.endsWith(RANK_SUFFIX)
          && column.length() > RANK_SUFFIX.length()) {
        methods.add(column.substring(0, column.length() - RANK_SUFFIX.length()));
      }
    }
    return methods;
  }

  private static @Nullable RelevanceJudgment judgment(
      DocumentKey key, String[] header, String[] row) {
    Integer relevance =
        CsvTables.parseInteger(CsvTables.cell(row, CsvTables.indexOf(header, RELEVANCE)));
    String labeledBy = CsvTables.cell(row, CsvTables.indexOf(header, LABELED_BY));
    String notes = CsvTables.rawCell(row, CsvTables.indexOf(header, NOTES));
    if (relevance == null && labeledBy == null) {
      return null;
    }
    if (relevance != null && (relevance < 0 || relevance > RelevanceJudgment.MAX_GRADE)) {
      log.warn("Ignoring out-of-range relevance {} for {}", relevance, key);
      return null;
    }
    Instant labeledAt = parseInstant(CsvTables.cell(row, CsvTables.indexOf(header, LABELED_AT)));
    return new RelevanceJudgment(
        key.query(),
        key.docId(),
        relevance,
        labeledBy == null ? UNKNOWN_LABELER : labeledBy,
        labeledAt,
        notes);
  }

  /** Accepts ISO instants and zone-less ISO date-times (read as UTC); anything else is epoch. */
  static Instant parseInstant(@Nullable String value) {
    if (value == null) {
      return Instant.EPOCH;
    }
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException e) {
      try {
        return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
      } catch (DateTimeParseException notLocal) {
        log.warn("Unreadable labeled_at '{}', using epoch", value);
        return Instant.EPOCH;
      }
    }
  }

  private static @Nullable Double parseScore(@Nullable String value) {
    if (value == null) {
      return null;
    }
    try {
      double score = Double.parseDouble(value);
      return Double.isFinite(score) ? score : null;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static List<String> parseFoundBy(@Nullable String value) {
    if (value == null) {
      return List.of();
    }
    return Arrays.stream(value.split(",")).map(String::strip).filter(s -> !s.isEmpty()).toList();
  }

  private static String orEmpty(@Nullable String value) {
    return value == null ? "" : value;
  }
}
