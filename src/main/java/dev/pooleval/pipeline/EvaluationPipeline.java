package dev.pooleval.pipeline;

import dev.pooleval.error.ConfigurationException;
import dev.pooleval.labeling.LabelingOptions;
import dev.pooleval.labeling.LabelingOrchestrator;
import dev.pooleval.labeling.LabelingProperties;
import dev.pooleval.labeling.LabelingReport;
import dev.pooleval.metrics.AggregateMetrics;
import dev.pooleval.metrics.Metric;
import dev.pooleval.metrics.MetricsEngine;
import dev.pooleval.metrics.MetricsExporter;
import dev.pooleval.metrics.MetricsProperties;
import dev.pooleval.metrics.MetricsReport;
import dev.pooleval.metrics.MetricsRequest;
import dev.pooleval.metrics.QueryMetrics;
import dev.pooleval.pool.PartitionInput;
import dev.pooleval.pool.PoolMerger;
import dev.pooleval.pool.PoolStatistics;
import dev.pooleval.pool.PoolingResult;
import dev.pooleval.pool.PooledDocument;
import dev.pooleval.pool.SearchHit;
import dev.pooleval.table.PooledTable;
import dev.pooleval.table.PooledTableCsv;
import dev.pooleval.table.SearchHitCsvReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * File-based evaluation pipeline: pool the per-method result files, label the pooled table and
 * score the methods against the judgments.
 *
 * <p>Each stage reads and writes the pooled table, so stages can be run separately and labeling can
 * be resumed across processes.
 */
@Service
public class EvaluationPipeline {

  private static final Logger log = LoggerFactory.getLogger(EvaluationPipeline.class);

  static final String STATISTICS_SUFFIX = "_statistics.txt";

  private final PoolMerger poolMerger;
  private final SearchHitCsvReader hitReader;
  private final PooledTableCsv pooledTableCsv;
  private final ObjectProvider<LabelingOrchestrator> labelingOrchestrator;
  private final LabelingProperties labelingProperties;
  private final MetricsEngine metricsEngine;
  private final MetricsExporter metricsExporter;
  private final MetricsProperties metricsProperties;

  public EvaluationPipeline(
      PoolMerger poolMerger,
      SearchHitCsvReader hitReader,
      PooledTableCsv pooledTableCsv,
      ObjectProvider<LabelingOrchestrator> labelingOrchestrator,
      LabelingProperties labelingProperties,
      MetricsEngine metricsEngine,
      MetricsExporter metricsExporter,
      MetricsProperties metricsProperties) {
    this.poolMerger = poolMerger;
    this.hitReader = hitReader;
    this.pooledTableCsv = pooledTableCsv;
    this.labelingOrchestrator = labelingOrchestrator;
    this.labelingProperties = labelingProperties;
    this.metricsEngine = metricsEngine;
    this.metricsExporter = metricsExporter;
    this.metricsProperties = metricsProperties;
  }

  /** Runs the configured step (or all steps in order). */
  public void run(PipelineProperties properties) throws IOException {
    PipelineProperties.Step step = properties.getStep();
    log.info("Running pipeline step {}", step);
    if (step == PipelineProperties.Step.POOL || step == PipelineProperties.Step.ALL) {
      pool(properties);
    }
    if (step == PipelineProperties.Step.LABEL || step == PipelineProperties.Step.ALL) {
      label(properties.getPooledTable(), labelingProperties.toOptions(properties.effectiveLimit()));
    }
    if (step == PipelineProperties.Step.METRICS || step == PipelineProperties.Step.ALL) {
      evaluate(
          properties.getPooledTable(),
          properties.getDepthK(),
          properties.getEvaluatePartition(),
          properties.getExportLabel());
    }
  }

  /**
   * Pools the configured result files and writes the pooled table and its statistics report.
   *
   * @throws ConfigurationException if no methods are configured
   * @throws IOException if a result file cannot be read or the outputs cannot be written
   */
  public PoolingResult pool(PipelineProperties properties) throws IOException {
    List<String> methods = properties.getMethods();
    if (methods.isEmpty()) {
      throw new ConfigurationException("pooleval.pipeline.methods must list at least one method");
    }
    PoolingResult result;
    if (properties.getPartitions().isEmpty()) {
      List<List<SearchHit>> hits = readHits(properties.getResultsDir(), methods);
      result = poolMerger.merge(methods, hits, properties.getDepthK());
    } else {
      List<PartitionInput> inputs = new ArrayList<>();
      for (String partition : properties.getPartitions()) {
        Path dir = properties.getResultsDir().resolve(partition);
        inputs.add(new PartitionInput(partition, readHits(dir, methods)));
      }
      result = poolMerger.mergePartitioned(methods, inputs, properties.getDepthK());
    }

    Path pooledTable = properties.getPooledTable();
    pooledTableCsv.write(pooledTable, result.documents(), methods);
    PoolStatistics statistics = PoolStatistics.compute(result);
    Path statisticsFile = statisticsPath(pooledTable);
    Files.writeString(statisticsFile, statistics.toReport(), StandardCharsets.UTF_8);
    log.info(
        "Pooled {} documents over {} queries; statistics written to {}",
        result.size(),
        result.queryCount(),
        statisticsFile);
    if (result.report().rowsSkipped() > 0) {
      log.warn(
          "{} invalid rows skipped while pooling, e.g. {}",
          result.report().rowsSkipped(),
          result.report().sampledErrors());
    }
    return result;
  }

  /**
   * Labels the pooled table in place: pending documents are judged and every known judgment is
   * written back into the table.
   */
  public LabelingReport label(Path pooledTablePath, LabelingOptions options) throws IOException {
    PooledTable table = pooledTableCsv.read(pooledTablePath);
    LabelingOrchestrator orchestrator = labelingOrchestrator.getObject();
    LabelingReport report = orchestrator.label(table.documents(), options);
    List<PooledDocument> judged = orchestrator.attachJudgments(table.documents());
    pooledTableCsv.write(pooledTablePath, judged, table.methods());
    log.info(
        "Labeling: {} labeled, {} failed ({} success), {} of {} judged, grades {}",
        report.labeled(),
        report.failed(),
        String.format(Locale.US, "%.1f%%", report.successRate() * 100),
        report.totalJudgedAfterRun(),
        report.totalDocuments(),
        report.gradeDistribution());
    return report;
  }

  /** Scores every method of the pooled table and exports the metric CSVs. */
  public MetricsReport evaluate(
      Path pooledTablePath, int poolDepth, @Nullable String partition, String exportLabel)
      throws IOException {
    PooledTable table = pooledTableCsv.read(pooledTablePath);
    MetricsRequest request =
        new MetricsRequest(table.methods(), metricsProperties.getCutoffs(), poolDepth, partition);
    MetricsReport report = metricsEngine.evaluate(table.documents(), request);
    List<Path> exported = metricsExporter.export(report, exportLabel);
    log.info("Metrics exported to {}", exported);
    logComparison(report);
    return report;
  }

  private void logComparison(MetricsReport report) {
    if (report.evaluatedQueries().isEmpty()) {
      log.warn("No judged queries to evaluate");
      return;
    }
    int k = report.cutoffs().get(report.cutoffs().size() - 1);
    for (AggregateMetrics aggregate : report.rankMethods(Metric.NDCG, k)) {
      if (aggregate.isMissing()) {
        log.info("  {}: no measurable queries", aggregate.method());
        continue;
      }
      log.info(
          "  {}: ndcg@{}={} recall@{}={} mrr={} map={} ({} queries, {} missing)",
          aggregate.method(),
          k,
          format(aggregate.valueOrThrow(Metric.NDCG)),
          k,
          format(aggregate.valueOrThrow(Metric.RECALL)),
          format(aggregate.valueOrThrow(Metric.MRR)),
          format(aggregate.valueOrThrow(Metric.MAP)),
          aggregate.queriesMeasured(),
          aggregate.queriesMissing());
    }
    int n = metricsProperties.getExtremeQueries();
    if (n == 0) {
      return;
    }
    for (String method : report.methods()) {
      logExtremes("Best", report.extremeQueries(method, k, n, true), method, k);
      logExtremes("Worst", report.extremeQueries(method, k, n, false), method, k);
    }
  }

  private static void logExtremes(String label, List<QueryMetrics> queries, String method, int k) {
    log.info("{} {} queries for {} by ndcg@{}:", label, queries.size(), method, k);
    for (QueryMetrics q : queries) {
      log.info("  {} {}", format(q.valueOrThrow(Metric.NDCG)), q.query());
    }
  }

  private List<List<SearchHit>> readHits(Path dir, List<String> methods) throws IOException {
    List<List<SearchHit>> hitsPerMethod = new ArrayList<>(methods.size());
    for (String method : methods) {
      hitsPerMethod.add(hitReader.read(dir.resolve(method + ".csv"), method));
    }
    return hitsPerMethod;
  }

  static Path statisticsPath(Path pooledTable) {
    String name = pooledTable.getFileName().toString();
    String base = name.endsWith(".csv") ? name.substring(0, name.length() - 4) : name;
    return pooledTable.resolveSibling(base + STATISTICS_SUFFIX);
  }

  private static String format(double value) {
    return String.format(Locale.US, "%.4f", value);
  }
}
