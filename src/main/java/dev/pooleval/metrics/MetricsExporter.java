package dev.pooleval.metrics;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Exports a metrics report to CSV files for comparing methods across pooling runs.
 *
 * <p>Produces two CSV files per export: an aggregate CSV with one row per (method, K), and a
 * per-query CSV with one row per (method, query, K). Unmeasurable cells are written with empty
 * values and a {@code MISSING} status.
 */
@Service
public class MetricsExporter {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss");

  static final String AGGREGATE_HEADER =
      "method,k,coverage,status,queries_measured,queries_missing,ndcg,recall,precision,mrr,map";

  static final String PER_QUERY_HEADER =
      "method,query,k,coverage,status,num_results,num_relevant,ndcg,recall,precision,mrr,map";

  private final Path outputDir;
  private final Clock clock;

  public MetricsExporter(
      @Value("${pooleval.metrics.output-dir:results/metrics}") String outputDir, Clock clock) {
    this.outputDir = Path.of(outputDir);
    this.clock = clock;
  }

  /**
   * Exports the report to aggregate and per-query CSV files.
   *
   * @param report the evaluation to export
   * @param label a descriptive label included in the filename (e.g., "all", "head", "baseline")
   * @return the paths to the two generated CSV files (aggregate first, per-query second)
   * @throws IOException if file writing fails
   */
  public List<Path> export(MetricsReport report, String label) throws IOException {
    Files.createDirectories(outputDir);

    String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    Path aggregatePath =
        outputDir.resolve("metrics-aggregate-%s-%s.csv".formatted(timestamp, label));
    Path perQueryPath =
        outputDir.resolve("metrics-per-query-%s-%s.csv".formatted(timestamp, label));

    writeAggregateCsv(report, aggregatePath);
    writePerQueryCsv(report, perQueryPath);

    return List.of(aggregatePath, perQueryPath);
  }

  private void writeAggregateCsv(MetricsReport report, Path path) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      writer.write(AGGREGATE_HEADER);
      writer.newLine();

      for (AggregateMetrics aggregate : report.aggregates()) {
        writer.write(
            String.join(
                ",",
                escapeCsv(aggregate.method()),
                String.valueOf(aggregate.k()),
                aggregate.coverage().name(),
                aggregate.isMissing() ? "MISSING" : "OK",
                String.valueOf(aggregate.queriesMeasured()),
                String.valueOf(aggregate.queriesMissing()),
                values(aggregate.mean())));
        writer.newLine();
      }
    }
  }

  private void writePerQueryCsv(MetricsReport report, Path path) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
      writer.write(PER_QUERY_HEADER);
      writer.newLine();

      for (QueryMetrics cell : report.perQuery()) {
        writer.write(
            String.join(
                ",",
                escapeCsv(cell.method()),
                escapeCsv(cell.query()),
                String.valueOf(cell.k()),
                cell.coverage().name(),
                cell.isMissing() ? "MISSING" : "OK",
                String.valueOf(cell.numResults()),
                String.valueOf(cell.numRelevant()),
                values(cell.scores())));
        writer.newLine();
      }
    }
  }

  private static String values(@Nullable MetricScores scores) {
    if (scores == null) {
      return ",,,,";
    }
    return String.format(
        Locale.US,
        "%.4f,%.4f,%.4f,%.4f,%.4f",
        scores.ndcg(),
        scores.recall(),
        scores.precision(),
        scores.mrr(),
        scores.map());
  }

  static String escapeCsv(String value) {
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
