package dev.pooleval.table;

import dev.pooleval.pool.SearchHit;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads one method's retrieval results from CSV.
 *
 * <p>Expected columns are {@code query, doc_id, rank, score}; a {@code query_set} column, when
 * present, is the partition tag. Every other column is passed through as document content. Rows
 * are returned as-is, malformed ones included; validation belongs to the pool merger.
 */
@Component
public class SearchHitCsvReader {

  private static final Logger log = LoggerFactory.getLogger(SearchHitCsvReader.class);

  static final String QUERY = "query";
  static final String DOC_ID = "doc_id";
  static final String RANK = "rank";
  static final String SCORE = "score";
  static final String QUERY_SET = "query_set";

  private static final Set<String> RESERVED = Set.of(QUERY, DOC_ID, RANK, SCORE, QUERY_SET);

  /**
   * Reads the hits of {@code method} from {@code file}.
   *
   * @throws IOException if the file cannot be read, or lacks a {@code query} or {@code doc_id}
   *     column
   */
  public List<SearchHit> read(Path file, String method) throws IOException {
    List<String[]> rows = CsvTables.readRows(file);
    if (rows.isEmpty()) {
      log.warn("Result file {} for method '{}' is empty", file, method);
      return List.of();
    }
    String[] header = rows.get(0);
    int query = CsvTables.indexOf(header, QUERY);
    int docId = CsvTables.indexOf(header, DOC_ID);
    if (query < 0 || docId < 0) {
      throw new IOException(
          "Result file %s must have '%s' and '%s' columns".formatted(file, QUERY, DOC_ID));
    }
    int rank = CsvTables.indexOf(header, RANK);
    int score = CsvTables.indexOf(header, SCORE);
    int querySet = CsvTables.indexOf(header, QUERY_SET);

    List<SearchHit> hits = new ArrayList<>(rows.size() - 1);
    for (String[] row : rows.subList(1, rows.size())) {
      if (isEmptyRow(row)) {
        continue;
      }
      hits.add(
          new SearchHit(
              CsvTables.cell(row, query),
              CsvTables.cell(row, docId),
              CsvTables.parseInteger(CsvTables.cell(row, rank)),
              CsvTables.cell(row, score),
              method,
              CsvTables.cell(row, querySet),
              contentFields(header, row)));
    }
    log.info("Read {} hits for method '{}' from {}", hits.size(), method, file);
    return hits;
  }

  private static Map<String, String> contentFields(String[] header, String[] row) {
    Map<String, String> fields = new LinkedHashMap<>();
    for (int i = 0; i < header.length; i++) {
      if (RESERVED.contains(header[i])) {
        continue;
      }
      String value = CsvTables.rawCell(row, i);
      if (value != null) {
        fields.put(header[i], value);
      }
    }
    return fields;
  }

  private static boolean isEmptyRow(String[] row) {
    for (String value : row) {
      if (value != null && !value.isBlank()) {
        return false;
      }
    }
    return true;
  }
}
